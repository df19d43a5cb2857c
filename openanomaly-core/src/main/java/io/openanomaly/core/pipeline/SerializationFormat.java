package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body encoding used with a remote model endpoint. */
public enum SerializationFormat {
  @JsonProperty("json")
  JSON,
  /** Arrow IPC stream. */
  @JsonProperty("arrow")
  ARROW
}
