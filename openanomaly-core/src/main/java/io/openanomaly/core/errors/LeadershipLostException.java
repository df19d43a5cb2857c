package io.openanomaly.core.errors;

/** Raised inside the scheduler when the lease is gone or changed mid-evaluation. */
public class LeadershipLostException extends TaskException {
  public LeadershipLostException(String message) {
    super(ErrorClass.LEADERSHIP_LOST, message);
  }

  public LeadershipLostException(String message, Throwable cause) {
    super(ErrorClass.LEADERSHIP_LOST, message, cause);
  }
}
