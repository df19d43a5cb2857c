package io.openanomaly.core.errors;

/**
 * ErrorClass is the classification surfaced to logs, metrics and the ops CLI for any task or
 * configuration failure.
 *
 * <p>Each class has a stable process exit code and a redelivery policy.
 */
public enum ErrorClass {
  /** Unclassified failure. */
  INTERNAL(1, true),
  /** Pipeline definition rejected at load time. The pipeline is excluded from scheduling. */
  CONFIG_VALIDATION(2, false),
  /**
   * The TSDB returned too little data. The tick is skipped and the next tick retries. A TSDB that
   * could not be reached is redelivered instead.
   */
  DATA_UNAVAILABLE(3, false),
  /** The model engine failed. Redelivered up to the configured attempt count. */
  INFERENCE(4, true),
  /** A remote response could not be decoded. A configuration problem, never retried. */
  SERIALIZATION(5, false),
  /** TSDB write failed after the client's own retries. The tick is reported lost. */
  WRITE(6, false),
  /** The scheduler lost its lease while evaluating. */
  LEADERSHIP_LOST(7, false),
  /** The task ran past its wall-clock budget. */
  TIMEOUT(8, true);

  private final int exitCode;
  private final boolean retryable;

  ErrorClass(int exitCode, boolean retryable) {
    this.exitCode = exitCode;
    this.retryable = retryable;
  }

  public int exitCode() {
    return exitCode;
  }

  /** Whether a job failing with this class should be redelivered. */
  public boolean isRetryable() {
    return retryable;
  }

  public String tag() {
    return name().toLowerCase();
  }
}
