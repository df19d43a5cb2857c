package io.openanomaly.model;

import io.openanomaly.core.errors.InsufficientDataException;
import io.openanomaly.core.errors.TaskException;
import io.openanomaly.tsdb.Sample;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * LocalModelEngine runs a {@link LocalBackend} in process.
 *
 * <p>Quantile paths assume normally distributed one-step errors: {@code point + z(q) * sigma *
 * spread}, where spread grows with the horizon as the backend defines.
 */
public final class LocalModelEngine implements ModelEngine {
  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

  private final LocalBackend backend;
  private final Map<String, Object> defaults;

  public LocalModelEngine(LocalBackend backend, Map<String, Object> defaults) {
    this.backend = backend;
    this.defaults = new LinkedHashMap<>(defaults);
  }

  public LocalModelEngine(LocalBackend backend) {
    this(backend, Map.of());
  }

  public LocalBackend getBackend() {
    return backend;
  }

  @Override
  public Forecast predict(List<Sample> context, Duration step, ForecastRequest request)
      throws TaskException {
    if (context.isEmpty()) {
      throw new InsufficientDataException(0, 1);
    }
    Map<String, Object> parameters = new LinkedHashMap<>(defaults);
    parameters.putAll(request.getParameters());
    parameters = backend.parametersOf(request.getModelId(), parameters);

    int horizon = request.getPredictionLength();
    LocalBackend.Fit fit = backend.fit(values(context), step, parameters, horizon);
    List<Double> mean = new ArrayList<>(horizon);
    for (double p : fit.point) {
      mean.add(p);
    }
    Map<Double, List<Double>> quantiles = new LinkedHashMap<>();
    for (double q : request.getQuantiles()) {
      double z = STANDARD_NORMAL.inverseCumulativeProbability(q);
      List<Double> path = new ArrayList<>(horizon);
      for (int h = 0; h < horizon; h++) {
        path.add(fit.point[h] + z * fit.sigma * fit.spread[h]);
      }
      quantiles.put(q, path);
    }
    return new Forecast(mean, quantiles);
  }

  @Override
  public String train(
      List<Sample> history, Duration step, Duration window, Map<String, Object> parameters)
      throws TaskException {
    Map<String, Object> merged = new LinkedHashMap<>(defaults);
    merged.putAll(parameters);
    return backend.train(values(history), merged);
  }

  @Override
  public boolean isTrainable() {
    return backend.isTrainable();
  }

  private static double[] values(List<Sample> samples) {
    double[] values = new double[samples.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = samples.get(i).getValue();
    }
    return values;
  }
}
