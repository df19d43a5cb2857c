package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;
import javax.annotation.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyConfig {
  private AnomalyTechnique technique = AnomalyTechnique.CONFIDENCE_INTERVAL;
  private double confidenceLevel = 0.95;
  private double threshold = 3.0;
  // null means the technique's own minimum
  @Nullable private Integer minHistory;

  public AnomalyTechnique getTechnique() {
    return technique;
  }

  public void setTechnique(AnomalyTechnique technique) {
    this.technique = technique;
  }

  public double getConfidenceLevel() {
    return confidenceLevel;
  }

  public void setConfidenceLevel(double confidenceLevel) {
    this.confidenceLevel = confidenceLevel;
  }

  public double getThreshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    this.threshold = threshold;
  }

  @Nullable
  public Integer getMinHistory() {
    return minHistory;
  }

  public void setMinHistory(@Nullable Integer minHistory) {
    this.minHistory = minHistory;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnomalyConfig that = (AnomalyConfig) o;
    return Double.compare(that.confidenceLevel, confidenceLevel) == 0
        && Double.compare(that.threshold, threshold) == 0
        && technique == that.technique
        && Objects.equals(minHistory, that.minHistory);
  }

  @Override
  public int hashCode() {
    return Objects.hash(technique, confidenceLevel, threshold, minHistory);
  }
}
