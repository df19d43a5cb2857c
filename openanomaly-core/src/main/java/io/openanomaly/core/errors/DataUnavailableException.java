package io.openanomaly.core.errors;

/**
 * The TSDB could not provide the data a task needs. Soft failure: the tick is skipped.
 *
 * <p>A TSDB that could not be reached, or failed on its side, is an exception: the job is
 * redelivered, since the data may well be there on the next attempt.
 */
public class DataUnavailableException extends TaskException {
  private final boolean unreachable;

  public DataUnavailableException(String message) {
    this(message, false);
  }

  private DataUnavailableException(String message, boolean unreachable) {
    super(ErrorClass.DATA_UNAVAILABLE, message);
    this.unreachable = unreachable;
  }

  public DataUnavailableException(String message, Throwable cause) {
    this(message, cause, false);
  }

  private DataUnavailableException(String message, Throwable cause, boolean unreachable) {
    super(ErrorClass.DATA_UNAVAILABLE, message, cause);
    this.unreachable = unreachable;
  }

  /** The TSDB was unreachable or answered with a server error. */
  public static DataUnavailableException unreachable(String message, Throwable cause) {
    return new DataUnavailableException(message, cause, true);
  }

  /** The TSDB was unreachable or answered with a server error. */
  public static DataUnavailableException unreachable(String message) {
    return new DataUnavailableException(message, true);
  }

  public boolean isUnreachable() {
    return unreachable;
  }

  @Override
  public boolean isRetryable() {
    return unreachable;
  }
}
