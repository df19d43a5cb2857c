package io.openanomaly.core.config;

import io.openanomaly.core.controller.coordinator.LockMode;
import java.time.Duration;
import java.util.UUID;
import javax.annotation.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Leadership lease configurations. */
@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorConfiguration {

  // Backend for the lease record.
  // Default to ZK so that redundant schedulers never both run by accident.
  private LockMode mode = LockMode.ZK;

  private Duration ttl = Duration.ofSeconds(15);

  // Defaults to ttl / 3 when unset.
  @Nullable private Duration renewInterval = null;

  // Subtracted from the local lease deadline to absorb clock drift and request latency.
  // Defaults to ttl / 10 when unset.
  @Nullable private Duration safetyMargin = null;

  // Znode holding the lease record.
  private String zkPath = "/leader";

  // Identity written into the lease. Defaults to a random id per process.
  @Nullable private String holderId = null;

  public LockMode getMode() {
    return mode;
  }

  public void setMode(LockMode mode) {
    this.mode = mode;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public Duration getRenewInterval() {
    return renewInterval != null ? renewInterval : ttl.dividedBy(3);
  }

  public void setRenewInterval(@Nullable Duration renewInterval) {
    this.renewInterval = renewInterval;
  }

  public Duration getSafetyMargin() {
    return safetyMargin != null ? safetyMargin : ttl.dividedBy(10);
  }

  public void setSafetyMargin(@Nullable Duration safetyMargin) {
    this.safetyMargin = safetyMargin;
  }

  public String getZkPath() {
    return zkPath;
  }

  public void setZkPath(String zkPath) {
    this.zkPath = zkPath;
  }

  public String getHolderId() {
    if (holderId == null) {
      holderId = UUID.randomUUID().toString();
    }
    return holderId;
  }

  public void setHolderId(@Nullable String holderId) {
    this.holderId = holderId;
  }
}
