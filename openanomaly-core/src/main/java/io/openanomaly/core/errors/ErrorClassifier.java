package io.openanomaly.core.errors;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** Maps any throwable raised at a task boundary onto an {@link ErrorClass}. */
public final class ErrorClassifier {
  private ErrorClassifier() {}

  public static ErrorClass classify(Throwable throwable) {
    Throwable t = unwrap(throwable);
    if (t instanceof TaskException) {
      return ((TaskException) t).errorClass();
    }
    if (t instanceof TimeoutException) {
      return ErrorClass.TIMEOUT;
    }
    return ErrorClass.INTERNAL;
  }

  /** Whether a job failing with the throwable should be redelivered. */
  public static boolean isRetryable(Throwable throwable) {
    Throwable t = unwrap(throwable);
    if (t instanceof TaskException) {
      return ((TaskException) t).isRetryable();
    }
    return classify(t).isRetryable();
  }

  public static Throwable unwrap(Throwable throwable) {
    Throwable t = throwable;
    while ((t instanceof ExecutionException || t instanceof CompletionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
