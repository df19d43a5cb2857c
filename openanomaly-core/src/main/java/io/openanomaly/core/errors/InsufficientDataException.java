package io.openanomaly.core.errors;

/** The context window returned fewer points than the pipeline requires. */
public class InsufficientDataException extends DataUnavailableException {
  private final int points;
  private final int required;

  public InsufficientDataException(int points, int required) {
    super("context has " + points + " points, at least " + required + " required");
    this.points = points;
    this.required = required;
  }

  public int getPoints() {
    return points;
  }

  public int getRequired() {
    return required;
  }
}
