package io.openanomaly.core.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/** Reference to a model produced by a training run. */
public final class TrainingArtifact {
  private final String pipelineName;
  private final String modelId;
  private final Instant trainedAt;
  private final Instant windowStart;
  private final Instant windowEnd;

  @JsonCreator
  public TrainingArtifact(
      @JsonProperty("pipeline_name") String pipelineName,
      @JsonProperty("model_id") String modelId,
      @JsonProperty("trained_at") Instant trainedAt,
      @JsonProperty("window_start") Instant windowStart,
      @JsonProperty("window_end") Instant windowEnd) {
    this.pipelineName = pipelineName;
    this.modelId = modelId;
    this.trainedAt = trainedAt;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
  }

  @JsonProperty("pipeline_name")
  public String getPipelineName() {
    return pipelineName;
  }

  @JsonProperty("model_id")
  public String getModelId() {
    return modelId;
  }

  @JsonProperty("trained_at")
  public Instant getTrainedAt() {
    return trainedAt;
  }

  @JsonProperty("window_start")
  public Instant getWindowStart() {
    return windowStart;
  }

  @JsonProperty("window_end")
  public Instant getWindowEnd() {
    return windowEnd;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TrainingArtifact that = (TrainingArtifact) o;
    return pipelineName.equals(that.pipelineName)
        && modelId.equals(that.modelId)
        && trainedAt.equals(that.trainedAt)
        && windowStart.equals(that.windowStart)
        && windowEnd.equals(that.windowEnd);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pipelineName, modelId, trainedAt, windowStart, windowEnd);
  }

  @Override
  public String toString() {
    return "TrainingArtifact{pipeline=" + pipelineName + ", modelId=" + modelId + "}";
  }
}
