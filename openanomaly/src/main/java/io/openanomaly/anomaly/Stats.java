package io.openanomaly.anomaly;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

final class Stats {
  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

  private Stats() {}

  /** Sample standard deviation, 0 for fewer than two values. */
  static double stddev(double[] values) {
    if (values.length < 2) {
      return 0;
    }
    return new StandardDeviation(true).evaluate(values);
  }

  /** Linear interpolation between closest ranks, as numpy computes percentiles. */
  static double percentile(double[] values, double p) {
    return new Percentile()
        .withEstimationType(Percentile.EstimationType.R_7)
        .evaluate(values, p);
  }

  /** Two sided z value of the confidence level, e.g. 1.96 for 0.95. */
  static double twoSidedZ(double confidenceLevel) {
    if (confidenceLevel <= 0) {
      return 0;
    }
    if (confidenceLevel >= 1) {
      return Double.POSITIVE_INFINITY;
    }
    return STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - confidenceLevel) / 2);
  }
}
