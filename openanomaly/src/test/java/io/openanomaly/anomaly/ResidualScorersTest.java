package io.openanomaly.anomaly;

import io.openanomaly.core.pipeline.AnomalyConfig;
import io.openanomaly.core.pipeline.AnomalyTechnique;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ResidualScorersTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testZScore() {
    ZScoreScorer scorer = new ZScoreScorer(3.0, 2);
    double[] history = {1, -1, 1, -1};
    AnomalyScore score = scorer.score(14, 10, Map.of(), history);
    Assertions.assertEquals(4 / Math.sqrt(4.0 / 3), score.getScore(), DELTA);
    Assertions.assertTrue(score.isAnomaly());
    Assertions.assertFalse(scorer.score(12, 10, Map.of(), history).isAnomaly());

    // a flat history scores the raw distance
    Assertions.assertEquals(2, scorer.score(12, 10, Map.of(), new double[] {0, 0}).getScore());
    Assertions.assertTrue(
        scorer.score(12, 10, Map.of(), new double[] {1}).isInsufficientHistory());
  }

  @Test
  public void testIqr() {
    IqrScorer scorer = new IqrScorer(4);
    double[] history = {-1, 0, 1, 0, -1, 1, 0, 0};
    // quartiles -0.25 and 0.25, fences at -1 and 1
    AnomalyScore high = scorer.score(7, 10, Map.of(), history);
    Assertions.assertTrue(high.isAnomaly());
    Assertions.assertEquals(2, high.getScore(), DELTA);
    AnomalyScore low = scorer.score(12.5, 10, Map.of(), history);
    Assertions.assertTrue(low.isAnomaly());
    Assertions.assertEquals(1.5, low.getScore(), DELTA);
    Assertions.assertFalse(scorer.score(10.5, 10, Map.of(), history).isAnomaly());
    Assertions.assertTrue(
        scorer.score(7, 10, Map.of(), new double[] {0, 1, 2}).isInsufficientHistory());
  }

  @Test
  public void testIsolationForest() {
    IsolationForestScorer scorer = new IsolationForestScorer(1.0, 16);
    double[] history = new double[64];
    for (int i = 0; i < history.length; i++) {
      history[i] = Math.sin(i / 3.0);
    }
    AnomalyScore usual = scorer.score(10, 10, Map.of(), history);
    AnomalyScore outlier = scorer.score(-90, 10, Map.of(), history);
    Assertions.assertTrue(outlier.getScore() > usual.getScore());
    Assertions.assertTrue(outlier.isAnomaly(), outlier.toString());
    Assertions.assertEquals(AnomalyTechnique.ISOLATION_FOREST, outlier.getTechnique());
    // seeded, so the same input scores the same
    Assertions.assertEquals(outlier, scorer.score(-90, 10, Map.of(), history));

    Assertions.assertTrue(
        scorer.score(10, 10, Map.of(), new double[8]).isInsufficientHistory());
  }

  @Test
  public void testForConfig() {
    AnomalyConfig config = new AnomalyConfig();
    AnomalyScorer interval = AnomalyScorers.forConfig(config);
    Assertions.assertTrue(interval instanceof ConfidenceIntervalScorer);
    Assertions.assertEquals(ConfidenceIntervalScorer.DEFAULT_MIN_HISTORY, interval.minHistory());

    config.setTechnique(AnomalyTechnique.Z_SCORE);
    Assertions.assertEquals(AnomalyTechnique.Z_SCORE, AnomalyScorers.forConfig(config).technique());
    config.setTechnique(AnomalyTechnique.IQR);
    Assertions.assertEquals(
        IqrScorer.DEFAULT_MIN_HISTORY, AnomalyScorers.forConfig(config).minHistory());
    config.setTechnique(AnomalyTechnique.ISOLATION_FOREST);
    config.setMinHistory(32);
    AnomalyScorer forest = AnomalyScorers.forConfig(config);
    Assertions.assertTrue(forest instanceof IsolationForestScorer);
    Assertions.assertEquals(32, forest.minHistory());
  }
}
