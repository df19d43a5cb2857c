package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AnomalyTechnique {
  @JsonProperty("confidence_interval")
  CONFIDENCE_INTERVAL,
  @JsonProperty("z_score")
  Z_SCORE,
  @JsonProperty("iqr")
  IQR,
  @JsonProperty("isolation_forest")
  ISOLATION_FOREST;

  public String tag() {
    return name().toLowerCase();
  }
}
