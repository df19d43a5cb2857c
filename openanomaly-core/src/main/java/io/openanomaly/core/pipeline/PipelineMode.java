package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Which task kinds a pipeline runs. */
public enum PipelineMode {
  @JsonProperty("forecast_only")
  FORECAST_ONLY,
  @JsonProperty("anomaly_only")
  ANOMALY_ONLY,
  @JsonProperty("forecast_and_anomaly")
  FORECAST_AND_ANOMALY;

  public boolean forecasts() {
    return this != ANOMALY_ONLY;
  }

  public boolean detectsAnomalies() {
    return this != FORECAST_ONLY;
  }
}
