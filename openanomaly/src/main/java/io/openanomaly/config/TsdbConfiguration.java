package io.openanomaly.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** TSDB client configurations. Pipelines may override both urls. */
@ConfigurationProperties(prefix = "tsdb")
public class TsdbConfiguration {

  // Base url of the Prometheus-compatible query API.
  private String url = "http://localhost:9090";

  // Remote write endpoint. Defaults to {url}/api/v1/write.
  @Nullable private String writeUrl = null;

  private Duration connectTimeout = Duration.ofSeconds(5);

  private Duration queryTimeout = Duration.ofSeconds(30);

  // Per attempt.
  private Duration writeTimeout = Duration.ofSeconds(30);

  // Retries of a failed remote write, after the first attempt.
  private int writeMaxRetries = 3;

  private Duration writeRetryBackoff = Duration.ofMillis(200);

  private Duration writeRetryMaxBackoff = Duration.ofSeconds(5);

  // Sent with every request, e.g. for tenancy headers.
  private Map<String, String> headers = new LinkedHashMap<>();

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  @Nullable
  public String getWriteUrl() {
    return writeUrl;
  }

  public void setWriteUrl(@Nullable String writeUrl) {
    this.writeUrl = writeUrl;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  public Duration getWriteTimeout() {
    return writeTimeout;
  }

  public void setWriteTimeout(Duration writeTimeout) {
    this.writeTimeout = writeTimeout;
  }

  public int getWriteMaxRetries() {
    return writeMaxRetries;
  }

  public void setWriteMaxRetries(int writeMaxRetries) {
    this.writeMaxRetries = writeMaxRetries;
  }

  public Duration getWriteRetryBackoff() {
    return writeRetryBackoff;
  }

  public void setWriteRetryBackoff(Duration writeRetryBackoff) {
    this.writeRetryBackoff = writeRetryBackoff;
  }

  public Duration getWriteRetryMaxBackoff() {
    return writeRetryMaxBackoff;
  }

  public void setWriteRetryMaxBackoff(Duration writeRetryMaxBackoff) {
    this.writeRetryMaxBackoff = writeRetryMaxBackoff;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public void setHeaders(Map<String, String> headers) {
    this.headers = headers;
  }
}
