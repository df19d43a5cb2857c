package io.openanomaly.model;

import io.openanomaly.core.errors.TaskException;
import io.openanomaly.tsdb.Sample;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * ModelEngine produces forecasts from a context window and optionally trains artifacts.
 *
 * <p>Implementations are stateless across calls and safe to share between worker threads.
 */
public interface ModelEngine {

  /**
   * Predicts the steps following the last sample of the context.
   *
   * @param context the samples, oldest first, at the pipeline step.
   * @param step the spacing of the samples.
   * @param request the horizon, quantile levels and parameters.
   * @return the forecast with {@code request.getPredictionLength()} values per path.
   * @throws TaskException classified failure: inference, serialization or timeout.
   */
  Forecast predict(List<Sample> context, Duration step, ForecastRequest request)
      throws TaskException;

  /**
   * Trains on the history and returns the model id of the new artifact.
   *
   * @throws TaskException when training fails or the engine cannot train.
   */
  String train(
      List<Sample> history, Duration step, Duration window, Map<String, Object> parameters)
      throws TaskException;

  /** Whether {@link #train} is supported. */
  boolean isTrainable();
}
