package io.openanomaly.core.errors;

/** Writing results to the TSDB failed after all retries. */
public class WriteException extends TaskException {
  public WriteException(String message) {
    super(ErrorClass.WRITE, message);
  }

  public WriteException(String message, Throwable cause) {
    super(ErrorClass.WRITE, message, cause);
  }
}
