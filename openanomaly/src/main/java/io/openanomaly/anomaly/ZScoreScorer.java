package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Map;

/** Scores the residual in standard deviations of the residual history. */
public final class ZScoreScorer implements AnomalyScorer {
  static final int DEFAULT_MIN_HISTORY = 2;

  private final double threshold;
  private final int minHistory;

  public ZScoreScorer(double threshold, int minHistory) {
    this.threshold = threshold;
    this.minHistory = minHistory;
  }

  @Override
  public AnomalyScore score(
      double actual, double forecast, Map<Double, Double> quantiles, double[] history) {
    if (history.length < minHistory) {
      return AnomalyScore.insufficientHistory(technique());
    }
    double stddev = Stats.stddev(history);
    if (!(stddev > 0)) {
      stddev = 1;
    }
    double score = Math.abs(forecast - actual) / stddev;
    return new AnomalyScore(score, score > threshold, false, technique());
  }

  @Override
  public AnomalyTechnique technique() {
    return AnomalyTechnique.Z_SCORE;
  }

  @Override
  public int minHistory() {
    return minHistory;
  }
}
