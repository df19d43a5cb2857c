package io.openanomaly.core.config;

import java.time.Duration;
import java.time.ZoneId;
import javax.annotation.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Scheduler evaluation loop configurations. */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerConfiguration {

  // Delay between two evaluations of the registry.
  private Duration evaluationInterval = Duration.ofSeconds(1);

  // Ticks due within the grace period of now are current. Defaults to two evaluation intervals.
  @Nullable private Duration grace = null;

  // When enabled, the latest missed tick of each pipeline and kind within the catch-up window is
  // enqueued after a leadership change. The other missed ticks are discarded.
  private boolean catchUpEnabled = true;

  private Duration catchUpWindow = Duration.ofHours(1);

  // Time zone cron expressions are evaluated in.
  private ZoneId zone = ZoneId.of("UTC");

  public Duration getEvaluationInterval() {
    return evaluationInterval;
  }

  public void setEvaluationInterval(Duration evaluationInterval) {
    this.evaluationInterval = evaluationInterval;
  }

  public Duration getGrace() {
    return grace != null ? grace : evaluationInterval.multipliedBy(2);
  }

  public void setGrace(@Nullable Duration grace) {
    this.grace = grace;
  }

  public boolean isCatchUpEnabled() {
    return catchUpEnabled;
  }

  public void setCatchUpEnabled(boolean catchUpEnabled) {
    this.catchUpEnabled = catchUpEnabled;
  }

  public Duration getCatchUpWindow() {
    return catchUpWindow;
  }

  public void setCatchUpWindow(Duration catchUpWindow) {
    this.catchUpWindow = catchUpWindow;
  }

  public ZoneId getZone() {
    return zone;
  }

  public void setZone(ZoneId zone) {
    this.zone = zone;
  }
}
