package io.openanomaly.anomaly;

import com.amazon.randomcutforest.RandomCutForest;
import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Map;

/**
 * Scores the residual with a random cut forest built over the residual history.
 *
 * <p>The forest is rebuilt for every call with a fixed seed, so the same inputs yield the same
 * score.
 */
public final class IsolationForestScorer implements AnomalyScorer {
  static final int DEFAULT_MIN_HISTORY = 16;
  static final int SAMPLE_SIZE = 256;
  static final int NUMBER_OF_TREES = 50;
  static final long SEED = 42L;

  private final double threshold;
  private final int minHistory;

  public IsolationForestScorer(double threshold, int minHistory) {
    this.threshold = threshold;
    this.minHistory = minHistory;
  }

  @Override
  public AnomalyScore score(
      double actual, double forecast, Map<Double, Double> quantiles, double[] history) {
    if (history.length < minHistory) {
      return AnomalyScore.insufficientHistory(technique());
    }
    RandomCutForest forest =
        RandomCutForest.builder()
            .dimensions(1)
            .sampleSize(SAMPLE_SIZE)
            .numberOfTrees(NUMBER_OF_TREES)
            .outputAfter(Math.max(1, Math.min(minHistory, SAMPLE_SIZE) / 2))
            .randomSeed(SEED)
            .parallelExecutionEnabled(false)
            .build();
    for (double residual : history) {
      forest.update(new double[] {residual});
    }
    double score = forest.getAnomalyScore(new double[] {forecast - actual});
    return new AnomalyScore(score, score > threshold, false, technique());
  }

  @Override
  public AnomalyTechnique technique() {
    return AnomalyTechnique.ISOLATION_FOREST;
  }

  @Override
  public int minHistory() {
    return minHistory;
  }
}
