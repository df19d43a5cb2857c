package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OutputConfig {
  public static final String DEFAULT_METRIC_PREFIX = "openanomaly_";

  private boolean writeForecast = true;
  private boolean writeAnomalyScore = true;
  private String metricPrefix = DEFAULT_METRIC_PREFIX;

  public boolean isWriteForecast() {
    return writeForecast;
  }

  public void setWriteForecast(boolean writeForecast) {
    this.writeForecast = writeForecast;
  }

  public boolean isWriteAnomalyScore() {
    return writeAnomalyScore;
  }

  public void setWriteAnomalyScore(boolean writeAnomalyScore) {
    this.writeAnomalyScore = writeAnomalyScore;
  }

  public String getMetricPrefix() {
    return metricPrefix;
  }

  public void setMetricPrefix(String metricPrefix) {
    this.metricPrefix = metricPrefix;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    OutputConfig that = (OutputConfig) o;
    return writeForecast == that.writeForecast
        && writeAnomalyScore == that.writeAnomalyScore
        && Objects.equals(metricPrefix, that.metricPrefix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(writeForecast, writeAnomalyScore, metricPrefix);
  }
}
