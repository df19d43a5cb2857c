package io.openanomaly.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Model engine configurations shared by all pipelines. */
@ConfigurationProperties(prefix = "model")
public class ModelConfiguration {

  // Connect timeout of remote inference servers. The request timeout is per pipeline.
  private Duration connectTimeout = Duration.ofSeconds(5);

  // Sent with every remote inference request, e.g. for authentication.
  private Map<String, String> headers = new LinkedHashMap<>();

  // Minimum share of the expected context points a forecast needs.
  private double minContextRatio = 0.5;

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public void setHeaders(Map<String, String> headers) {
    this.headers = headers;
  }

  public double getMinContextRatio() {
    return minContextRatio;
  }

  public void setMinContextRatio(double minContextRatio) {
    this.minContextRatio = minContextRatio;
  }
}
