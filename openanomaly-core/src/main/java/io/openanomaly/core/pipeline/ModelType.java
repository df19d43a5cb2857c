package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Where the forecasting backend runs. */
public enum ModelType {
  @JsonProperty("local")
  LOCAL,
  @JsonProperty("remote")
  REMOTE
}
