package io.openanomaly.core.config;

import io.openanomaly.core.queue.QueueMode;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Job queue configurations. */
@ConfigurationProperties(prefix = "queue")
public class QueueConfiguration {

  // Backend for the queue. LOCAL only works when scheduler and workers share the process.
  private QueueMode mode = QueueMode.LOCAL;

  // A consumed job that is neither completed nor failed is redelivered after this timeout.
  // Keep it above worker.taskTimeout.
  private Duration visibilityTimeout = Duration.ofMinutes(10);

  private String redisUri = "redis://localhost:6379/0";

  // Redis command timeout.
  private Duration redisTimeout = Duration.ofSeconds(5);

  private String keyPrefix = "openanomaly:queue:";

  // Interval between two polls of a blocking consume.
  private Duration pollInterval = Duration.ofMillis(200);

  public QueueMode getMode() {
    return mode;
  }

  public void setMode(QueueMode mode) {
    this.mode = mode;
  }

  public Duration getVisibilityTimeout() {
    return visibilityTimeout;
  }

  public void setVisibilityTimeout(Duration visibilityTimeout) {
    this.visibilityTimeout = visibilityTimeout;
  }

  public String getRedisUri() {
    return redisUri;
  }

  public void setRedisUri(String redisUri) {
    this.redisUri = redisUri;
  }

  public Duration getRedisTimeout() {
    return redisTimeout;
  }

  public void setRedisTimeout(Duration redisTimeout) {
    this.redisTimeout = redisTimeout;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }
}
