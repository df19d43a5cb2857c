package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Objects;

/** The outcome of scoring one actual value. */
public final class AnomalyScore {
  private final double score;
  private final boolean anomaly;
  private final boolean insufficientHistory;
  private final AnomalyTechnique technique;

  public AnomalyScore(
      double score, boolean anomaly, boolean insufficientHistory, AnomalyTechnique technique) {
    this.score = score;
    this.anomaly = anomaly;
    this.insufficientHistory = insufficientHistory;
    this.technique = technique;
  }

  /** Score 0, not anomalous, flagged as lacking history. */
  public static AnomalyScore insufficientHistory(AnomalyTechnique technique) {
    return new AnomalyScore(0, false, true, technique);
  }

  public double getScore() {
    return score;
  }

  public boolean isAnomaly() {
    return anomaly;
  }

  public boolean isInsufficientHistory() {
    return insufficientHistory;
  }

  public AnomalyTechnique getTechnique() {
    return technique;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnomalyScore that = (AnomalyScore) o;
    return Double.compare(that.score, score) == 0
        && anomaly == that.anomaly
        && insufficientHistory == that.insufficientHistory
        && technique == that.technique;
  }

  @Override
  public int hashCode() {
    return Objects.hash(score, anomaly, insufficientHistory, technique);
  }

  @Override
  public String toString() {
    return "AnomalyScore{score="
        + score
        + ", anomaly="
        + anomaly
        + ", insufficientHistory="
        + insufficientHistory
        + ", technique="
        + technique.tag()
        + "}";
  }
}
