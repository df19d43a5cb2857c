package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Map;

/**
 * AnomalyScorer compares an actual value with its forecast.
 *
 * <p>Residuals are {@code forecast - actual}.
 */
public interface AnomalyScorer {

  /**
   * Scores the actual value.
   *
   * @param actual the observed value.
   * @param forecast the predicted mean for the same timestamp.
   * @param quantiles predicted quantile values for the same timestamp, keyed by level.
   * @param history residuals of earlier timestamps, oldest first.
   * @return the score. When history is too short the score is 0, not anomalous and flagged.
   */
  AnomalyScore score(
      double actual, double forecast, Map<Double, Double> quantiles, double[] history);

  AnomalyTechnique technique();

  /** Residual history points required before scoring. */
  int minHistory();
}
