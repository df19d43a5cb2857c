package io.openanomaly.model;

import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.errors.InferenceException;
import io.openanomaly.core.errors.TaskException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The forecasting algorithms that run in process.
 *
 * <p>Each backend produces a point path and the root mean squared one-step error of its in-sample
 * fit. {@link LocalModelEngine} derives quantile paths from the two.
 */
public enum LocalBackend {
  /** Repeats the last value. */
  NAIVE(false) {
    @Override
    Fit fit(double[] y, Duration step, Map<String, Object> parameters, int horizon) {
      return seasonal(y, 1, horizon);
    }
  },

  /** Repeats the last season. Falls back to naive while the context is shorter than a season. */
  SEASONAL_NAIVE(false) {
    @Override
    Fit fit(double[] y, Duration step, Map<String, Object> parameters, int horizon)
        throws TaskException {
      long daily = Math.max(1, Duration.ofDays(1).toMillis() / Math.max(1, step.toMillis()));
      int season = intParam(parameters, SEASON_LENGTH, (int) Math.min(Integer.MAX_VALUE, daily));
      if (season < 1) {
        throw new ConfigValidationException(SEASON_LENGTH + " must be positive");
      }
      return seasonal(y, y.length > season ? season : 1, horizon);
    }
  },

  /** Repeats the mean of the trailing window. */
  MOVING_AVERAGE(false) {
    @Override
    Fit fit(double[] y, Duration step, Map<String, Object> parameters, int horizon)
        throws TaskException {
      int window = intParam(parameters, WINDOW, DEFAULT_WINDOW);
      if (window < 1) {
        throw new ConfigValidationException(WINDOW + " must be positive");
      }
      int w = Math.min(window, y.length);
      double sumSquares = 0;
      int errors = 0;
      for (int i = w; i < y.length; i++) {
        double e = y[i] - mean(y, i - w, i);
        sumSquares += e * e;
        errors++;
      }
      double level = mean(y, y.length - w, y.length);
      double[] point = new double[horizon];
      double[] spread = new double[horizon];
      for (int h = 0; h < horizon; h++) {
        point[h] = level;
        spread[h] = Math.sqrt(h + 1);
      }
      return new Fit(point, rmse(sumSquares, errors), spread);
    }
  },

  /** Double exponential smoothing with level and trend. Training fits both factors. */
  HOLT(true) {
    @Override
    Fit fit(double[] y, Duration step, Map<String, Object> parameters, int horizon)
        throws TaskException {
      double alpha = fractionParam(parameters, ALPHA, DEFAULT_ALPHA);
      double beta = fractionParam(parameters, BETA, DEFAULT_BETA);
      if (y.length < 2) {
        return seasonal(y, 1, horizon);
      }
      Smoothing s = smooth(y, alpha, beta);
      double[] point = new double[horizon];
      double[] spread = new double[horizon];
      for (int h = 0; h < horizon; h++) {
        point[h] = s.level + (h + 1) * s.trend;
        spread[h] = Math.sqrt(h + 1);
      }
      return new Fit(point, rmse(s.sse, y.length - 1), spread);
    }

    @Override
    String train(double[] y, Map<String, Object> parameters) throws TaskException {
      if (y.length < 3) {
        throw new InferenceException(
            "holt needs at least 3 points to train, got " + y.length);
      }
      double bestAlpha = DEFAULT_ALPHA;
      double bestBeta = DEFAULT_BETA;
      double bestSse = Double.POSITIVE_INFINITY;
      for (int a = 1; a <= 9; a++) {
        for (double beta : BETA_GRID) {
          double alpha = a / 10.0;
          double sse = smooth(y, alpha, beta).sse;
          if (sse < bestSse) {
            bestSse = sse;
            bestAlpha = alpha;
            bestBeta = beta;
          }
        }
      }
      return modelId(bestAlpha, bestBeta);
    }

    @Override
    Map<String, Object> parametersOf(@Nullable String modelId, Map<String, Object> parameters)
        throws TaskException {
      if (modelId == null || !modelId.startsWith(id() + ":")) {
        return parameters;
      }
      Map<String, Object> merged = new LinkedHashMap<>(parameters);
      for (String pair : modelId.substring(id().length() + 1).split(",")) {
        String[] kv = pair.split("=", 2);
        if (kv.length != 2) {
          throw new ConfigValidationException("malformed model id " + modelId);
        }
        merged.put(kv[0].trim(), kv[1].trim());
      }
      return merged;
    }
  };

  static final String SEASON_LENGTH = "season_length";
  static final String WINDOW = "window";
  static final String ALPHA = "alpha";
  static final String BETA = "beta";
  static final int DEFAULT_WINDOW = 10;
  static final double DEFAULT_ALPHA = 0.5;
  static final double DEFAULT_BETA = 0.1;
  private static final double[] BETA_GRID = {0.01, 0.05, 0.1, 0.2, 0.3, 0.5};

  private final boolean trainable;

  LocalBackend(boolean trainable) {
    this.trainable = trainable;
  }

  /** The identifier used in pipeline definitions, e.g. {@code seasonal_naive}. */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTrainable() {
    return trainable;
  }

  public static Optional<LocalBackend> fromId(@Nullable String id) {
    if (id == null) {
      return Optional.empty();
    }
    for (LocalBackend backend : values()) {
      if (backend.id().equals(id.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(backend);
      }
    }
    return Optional.empty();
  }

  abstract Fit fit(double[] y, Duration step, Map<String, Object> parameters, int horizon)
      throws TaskException;

  /** Fits the backend and returns the id of the resulting artifact. */
  String train(double[] y, Map<String, Object> parameters) throws TaskException {
    throw new InferenceException(id() + " is not trainable");
  }

  /** Merges the parameters encoded in a trained model id over the configured ones. */
  Map<String, Object> parametersOf(@Nullable String modelId, Map<String, Object> parameters)
      throws TaskException {
    return parameters;
  }

  String modelId(double alpha, double beta) {
    return id() + ":" + ALPHA + "=" + plain(alpha) + "," + BETA + "=" + plain(beta);
  }

  private static Fit seasonal(double[] y, int season, int horizon) {
    int n = y.length;
    double sumSquares = 0;
    int errors = 0;
    for (int i = season; i < n; i++) {
      double e = y[i] - y[i - season];
      sumSquares += e * e;
      errors++;
    }
    double[] point = new double[horizon];
    double[] spread = new double[horizon];
    for (int h = 0; h < horizon; h++) {
      point[h] = y[n - season + (h % season)];
      spread[h] = Math.sqrt(h / season + 1);
    }
    return new Fit(point, rmse(sumSquares, errors), spread);
  }

  private static Smoothing smooth(double[] y, double alpha, double beta) {
    double level = y[0];
    double trend = y[1] - y[0];
    double sse = 0;
    for (int t = 1; t < y.length; t++) {
      double e = y[t] - (level + trend);
      sse += e * e;
      double previous = level;
      level = alpha * y[t] + (1 - alpha) * (level + trend);
      trend = beta * (level - previous) + (1 - beta) * trend;
    }
    return new Smoothing(level, trend, sse);
  }

  private static double mean(double[] y, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += y[i];
    }
    return sum / (to - from);
  }

  private static double rmse(double sumSquares, int count) {
    return count == 0 ? 0 : Math.sqrt(sumSquares / count);
  }

  private static String plain(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  static int intParam(Map<String, Object> parameters, String key, int defaultValue)
      throws ConfigValidationException {
    Object value = parameters.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigValidationException(key + " must be an integer, got " + value, e);
    }
  }

  static double fractionParam(Map<String, Object> parameters, String key, double defaultValue)
      throws ConfigValidationException {
    Object value = parameters.get(key);
    double parsed;
    if (value == null) {
      parsed = defaultValue;
    } else if (value instanceof Number) {
      parsed = ((Number) value).doubleValue();
    } else {
      try {
        parsed = Double.parseDouble(value.toString().trim());
      } catch (NumberFormatException e) {
        throw new ConfigValidationException(key + " must be a number, got " + value, e);
      }
    }
    if (!(parsed > 0 && parsed <= 1)) {
      throw new ConfigValidationException(key + " must be in (0, 1], got " + parsed);
    }
    return parsed;
  }

  /** The point path, the one-step error scale and the per-step growth of that scale. */
  static final class Fit {
    final double[] point;
    final double sigma;
    final double[] spread;

    Fit(double[] point, double sigma, double[] spread) {
      this.point = point;
      this.sigma = sigma;
      this.spread = spread;
    }
  }

  private static final class Smoothing {
    final double level;
    final double trend;
    final double sse;

    Smoothing(double level, double trend, double sse) {
      this.level = level;
      this.trend = trend;
      this.sse = sse;
    }
  }
}
