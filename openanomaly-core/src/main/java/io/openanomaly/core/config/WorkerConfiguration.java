package io.openanomaly.core.config;

import io.openanomaly.core.worker.LedgerMode;
import java.time.Duration;
import java.util.UUID;
import javax.annotation.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Worker runtime configurations. */
@ConfigurationProperties(prefix = "worker")
public class WorkerConfiguration {

  // Number of consumer threads.
  private int threads = 4;

  // How long a consumer blocks on the queue before checking for shutdown.
  private Duration pollTimeout = Duration.ofSeconds(1);

  // Wall-clock budget of one task. The task is cancelled after it.
  private Duration taskTimeout = Duration.ofMinutes(5);

  // Deliveries of a job before a retryable failure is dropped and reported.
  private int maxAttempts = 3;

  // Delay before a failed job is redelivered.
  private Duration retryBackoff = Duration.ofSeconds(30);

  // How long a result claim blocks other workers. Must exceed taskTimeout.
  private Duration claimTtl = Duration.ofMinutes(10);

  // Backend for the result ledger.
  private LedgerMode ledgerMode = LedgerMode.LOCAL;

  private String ledgerZkPath = "/ledger";

  // Committed results older than this are purged from the ledger.
  private Duration ledgerRetention = Duration.ofDays(7);

  @Nullable private String workerId = null;

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public Duration getTaskTimeout() {
    return taskTimeout;
  }

  public void setTaskTimeout(Duration taskTimeout) {
    this.taskTimeout = taskTimeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }

  public Duration getClaimTtl() {
    return claimTtl;
  }

  public void setClaimTtl(Duration claimTtl) {
    this.claimTtl = claimTtl;
  }

  public LedgerMode getLedgerMode() {
    return ledgerMode;
  }

  public void setLedgerMode(LedgerMode ledgerMode) {
    this.ledgerMode = ledgerMode;
  }

  public String getLedgerZkPath() {
    return ledgerZkPath;
  }

  public void setLedgerZkPath(String ledgerZkPath) {
    this.ledgerZkPath = ledgerZkPath;
  }

  public Duration getLedgerRetention() {
    return ledgerRetention;
  }

  public void setLedgerRetention(Duration ledgerRetention) {
    this.ledgerRetention = ledgerRetention;
  }

  public String getWorkerId() {
    if (workerId == null) {
      workerId = UUID.randomUUID().toString();
    }
    return workerId;
  }

  public void setWorkerId(@Nullable String workerId) {
    this.workerId = workerId;
  }
}
