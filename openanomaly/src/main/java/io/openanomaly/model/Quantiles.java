package io.openanomaly.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Helpers for quantile levels. */
public final class Quantiles {

  private Quantiles() {}

  /** Rounds the level to six decimals so that levels derived by arithmetic compare equal. */
  public static double normalize(double q) {
    return BigDecimal.valueOf(q).setScale(6, RoundingMode.HALF_UP).doubleValue();
  }

  /** Formats the level as a label value, e.g. {@code 0.1} or {@code 0.025}. */
  public static String format(double q) {
    return BigDecimal.valueOf(normalize(q)).stripTrailingZeros().toPlainString();
  }

  /** Parses a level formatted by {@link #format} or by a remote model. */
  public static double parse(String q) {
    return normalize(Double.parseDouble(q.trim()));
  }

  /**
   * Returns the lower and upper quantile level of the central band at the confidence level. A
   * level of 1 yields the degenerate band {@code [0, 1]}.
   */
  public static double[] confidenceBand(double confidenceLevel) {
    double tail = (1 - confidenceLevel) / 2;
    return new double[] {normalize(tail), normalize(1 - tail)};
  }
}
