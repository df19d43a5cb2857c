package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The kind of work a scheduled job performs. */
public enum JobKind {
  @JsonProperty("forecast")
  FORECAST,
  @JsonProperty("anomaly")
  ANOMALY,
  @JsonProperty("train")
  TRAIN;

  public String tag() {
    return name().toLowerCase();
  }

  public static JobKind fromTag(String tag) {
    for (JobKind kind : values()) {
      if (kind.tag().equalsIgnoreCase(tag)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown job kind " + tag);
  }
}
