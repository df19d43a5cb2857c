package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Map;

/** Scores how far the residual falls outside the Tukey fences of the residual history. */
public final class IqrScorer implements AnomalyScorer {
  static final int DEFAULT_MIN_HISTORY = 4;
  private static final double FENCE = 1.5;

  private final int minHistory;

  public IqrScorer(int minHistory) {
    this.minHistory = minHistory;
  }

  @Override
  public AnomalyScore score(
      double actual, double forecast, Map<Double, Double> quantiles, double[] history) {
    if (history.length < minHistory) {
      return AnomalyScore.insufficientHistory(technique());
    }
    double q1 = Stats.percentile(history, 25);
    double q3 = Stats.percentile(history, 75);
    double iqr = q3 - q1;
    double low = q1 - FENCE * iqr;
    double high = q3 + FENCE * iqr;
    double residual = forecast - actual;
    double score;
    if (residual < low) {
      score = low - residual;
    } else if (residual > high) {
      score = residual - high;
    } else {
      score = 0;
    }
    return new AnomalyScore(score, score > 0, false, technique());
  }

  @Override
  public AnomalyTechnique technique() {
    return AnomalyTechnique.IQR;
  }

  @Override
  public int minHistory() {
    return minHistory;
  }
}
