package io.openanomaly.core.errors;

/** Base class of all classified failures. */
public abstract class TaskException extends Exception {
  private final ErrorClass errorClass;

  protected TaskException(ErrorClass errorClass, String message) {
    super(message);
    this.errorClass = errorClass;
  }

  protected TaskException(ErrorClass errorClass, String message, Throwable cause) {
    super(message, cause);
    this.errorClass = errorClass;
  }

  public ErrorClass errorClass() {
    return errorClass;
  }

  /** Whether a job failing with this exception is redelivered. Defaults to the class policy. */
  public boolean isRetryable() {
    return errorClass.isRetryable();
  }
}
