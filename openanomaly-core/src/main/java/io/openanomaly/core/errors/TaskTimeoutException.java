package io.openanomaly.core.errors;

import java.time.Duration;

/** The task did not finish within its wall-clock budget and was aborted. */
public class TaskTimeoutException extends TaskException {
  public TaskTimeoutException(Duration budget) {
    super(ErrorClass.TIMEOUT, "task exceeded its budget of " + budget.toMillis() + "ms");
  }
}
