package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyTechnique;
import io.openanomaly.model.Quantiles;
import java.util.HashMap;
import java.util.Map;

/**
 * Flags actual values outside the central prediction band at the confidence level.
 *
 * <p>The band comes from the forecast quantiles {@code (1 - cl) / 2} and {@code 1 - (1 - cl) /
 * 2}. Without them it is {@code forecast +/- z(cl) * stddev(history)}. A value on a bound is
 * inside the band. The score is the distance beyond the nearest bound in band widths.
 */
public final class ConfidenceIntervalScorer implements AnomalyScorer {
  static final int DEFAULT_MIN_HISTORY = 2;

  private final double confidenceLevel;
  private final int minHistory;

  public ConfidenceIntervalScorer(double confidenceLevel, int minHistory) {
    this.confidenceLevel = confidenceLevel;
    this.minHistory = minHistory;
  }

  @Override
  public AnomalyScore score(
      double actual, double forecast, Map<Double, Double> quantiles, double[] history) {
    double[] band = Quantiles.confidenceBand(confidenceLevel);
    Map<Double, Double> normalized = new HashMap<>();
    quantiles.forEach((q, v) -> normalized.put(Quantiles.normalize(q), v));
    Double lower = normalized.get(band[0]);
    Double upper = normalized.get(band[1]);
    if (lower == null || upper == null) {
      if (history.length < minHistory) {
        return AnomalyScore.insufficientHistory(technique());
      }
      double halfWidth = Stats.twoSidedZ(confidenceLevel) * Stats.stddev(history);
      lower = forecast - halfWidth;
      upper = forecast + halfWidth;
    }
    double distance;
    if (actual < lower) {
      distance = lower - actual;
    } else if (actual > upper) {
      distance = actual - upper;
    } else {
      distance = 0;
    }
    double width = upper - lower;
    if (!(width > 0)) {
      width = 1;
    }
    return new AnomalyScore(distance / width, distance > 0, false, technique());
  }

  @Override
  public AnomalyTechnique technique() {
    return AnomalyTechnique.CONFIDENCE_INTERVAL;
  }

  @Override
  public int minHistory() {
    return minHistory;
  }
}
