package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyConfig;

/** Builds the scorer of an anomaly configuration. */
public final class AnomalyScorers {

  private AnomalyScorers() {}

  public static AnomalyScorer forConfig(AnomalyConfig config) {
    Integer minHistory = config.getMinHistory();
    switch (config.getTechnique()) {
      case Z_SCORE:
        return new ZScoreScorer(
            config.getThreshold(), orDefault(minHistory, ZScoreScorer.DEFAULT_MIN_HISTORY));
      case IQR:
        return new IqrScorer(orDefault(minHistory, IqrScorer.DEFAULT_MIN_HISTORY));
      case ISOLATION_FOREST:
        return new IsolationForestScorer(
            config.getThreshold(),
            orDefault(minHistory, IsolationForestScorer.DEFAULT_MIN_HISTORY));
      case CONFIDENCE_INTERVAL:
      default:
        return new ConfidenceIntervalScorer(
            config.getConfidenceLevel(),
            orDefault(minHistory, ConfidenceIntervalScorer.DEFAULT_MIN_HISTORY));
    }
  }

  private static int orDefault(Integer minHistory, int defaultValue) {
    return minHistory == null ? defaultValue : minHistory;
  }
}
