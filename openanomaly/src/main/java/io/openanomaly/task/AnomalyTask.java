package io.openanomaly.task;

import io.openanomaly.anomaly.AnomalyScore;
import io.openanomaly.anomaly.AnomalyScorer;
import io.openanomaly.anomaly.AnomalyScorers;
import io.openanomaly.common.StructuredLogging;
import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.ForecastUnavailableException;
import io.openanomaly.core.errors.InsufficientDataException;
import io.openanomaly.core.errors.TaskException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineMode;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.model.Forecast;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.model.Quantiles;
import io.openanomaly.tsdb.Sample;
import io.openanomaly.tsdb.TimeSeries;
import io.openanomaly.tsdb.TsdbClient;
import io.openanomaly.tsdb.TsdbClientFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AnomalyTask scores the latest actual value of each source series against its forecast.
 *
 * <p>The scored timestamp T is the due time aligned down to the step. The actual is the latest
 * sample in {@code (T - step, T]}. The forecast for T is read back from the stored forecast
 * series. When there is none, {@code anomaly_only} pipelines forecast one step inline from the
 * context ending at {@code T - step}, while {@code forecast_and_anomaly} pipelines fail with
 * {@link ForecastUnavailableException}. The residual history is {@code forecast - actual} at the
 * earlier timestamps of the context window where both exist.
 */
public class AnomalyTask {
  private static final Logger logger = LoggerFactory.getLogger(AnomalyTask.class);

  private final TsdbClientFactory tsdbClientFactory;
  private final ModelEngineFactory modelEngineFactory;
  private final PipelineRegistry registry;
  private final ModelConfiguration config;
  private final CoreInfra infra;

  public AnomalyTask(
      TsdbClientFactory tsdbClientFactory,
      ModelEngineFactory modelEngineFactory,
      PipelineRegistry registry,
      ModelConfiguration config,
      CoreInfra infra) {
    this.tsdbClientFactory = tsdbClientFactory;
    this.modelEngineFactory = modelEngineFactory;
    this.registry = registry;
    this.config = config;
    this.infra = infra;
  }

  /**
   * Scores the actuals at the due time.
   *
   * @return the score and flag series, written or not.
   */
  public List<TimeSeries> run(Pipeline pipeline, Instant dueTime) throws TaskException {
    PipelineMode mode = pipeline.getMode();
    if (mode == null || !mode.detectsAnomalies()) {
      throw new ConfigValidationException(
          "pipeline " + pipeline.getName() + " does not detect anomalies");
    }
    Duration step = pipeline.getStep();
    Instant t = TaskSupport.alignDown(dueTime, step);
    Instant start = t.minus(pipeline.getContextWindow());
    TsdbClient tsdb = tsdbClientFactory.get(pipeline);

    List<TimeSeries> actuals = tsdb.queryRange(pipeline.getQuery(), start, t, step);
    Map<Map<String, String>, TimeSeries> means = new HashMap<>();
    Map<Map<String, String>, Map<Double, TimeSeries>> quantiles = new HashMap<>();
    if (mode.forecasts()) {
      String forecastQuery =
          ResultSeries.selector(ResultSeries.forecastMetric(pipeline), pipeline);
      for (TimeSeries series : tsdb.queryRange(forecastQuery, start, t, step)) {
        means.put(ResultSeries.seriesKey(series.getLabels()), series);
      }
      String quantileQuery =
          ResultSeries.selector(ResultSeries.quantileMetric(pipeline), pipeline);
      for (TimeSeries series : tsdb.queryRange(quantileQuery, start, t, step)) {
        String level = series.getLabels().get(ResultSeries.QUANTILE_LABEL);
        if (level == null) {
          continue;
        }
        quantiles
            .computeIfAbsent(ResultSeries.seriesKey(series.getLabels()), k -> new HashMap<>())
            .put(Quantiles.parse(level), series);
      }
    }

    AnomalyScorer scorer = AnomalyScorers.forConfig(pipeline.getAnomaly());
    List<TimeSeries> results = new ArrayList<>();
    int missingForecast = 0;
    for (TimeSeries series : actuals) {
      Optional<Sample> actual = series.latestIn(t.minus(step), t);
      if (actual.isEmpty()) {
        continue;
      }
      Map<String, String> key = ResultSeries.seriesKey(series.getLabels());
      TimeSeries mean = means.get(key);
      Optional<Sample> predicted =
          mean == null ? Optional.empty() : mean.latestIn(t.minus(step), t);

      double forecast;
      Map<Double, Double> bands = new HashMap<>();
      double[] history;
      if (predicted.isPresent()) {
        forecast = predicted.get().getValue();
        Map<Double, TimeSeries> levels = quantiles.getOrDefault(key, Map.of());
        for (Map.Entry<Double, TimeSeries> entry : levels.entrySet()) {
          entry
              .getValue()
              .latestIn(t.minus(step), t)
              .ifPresent(s -> bands.put(entry.getKey(), s.getValue()));
        }
        history = residuals(series, mean, t.minus(step));
      } else if (mode == PipelineMode.ANOMALY_ONLY) {
        Forecast inline = forecastInline(pipeline, series, t.minus(step));
        forecast = inline.getMean().get(0);
        inline.getQuantiles().forEach((q, values) -> bands.put(q, values.get(0)));
        history = new double[0];
      } else {
        missingForecast++;
        continue;
      }

      AnomalyScore score = scorer.score(actual.get().getValue(), forecast, bands, history);
      if (score.isInsufficientHistory()) {
        logger.debug(
            "task.anomaly.history.insufficient",
            StructuredLogging.pipeline(pipeline.getName()),
            StructuredLogging.technique(score.getTechnique().tag()),
            StructuredLogging.count(history.length));
      }
      if (score.isAnomaly()) {
        infra.scope().counter("task.anomaly.detected").inc(1);
        logger.info(
            "task.anomaly.detected",
            StructuredLogging.pipeline(pipeline.getName()),
            StructuredLogging.technique(score.getTechnique().tag()),
            StructuredLogging.timestamp(t),
            StructuredLogging.score(score.getScore()));
      }
      results.addAll(ResultSeries.anomaly(pipeline, series.getLabels(), score, t));
    }

    if (results.isEmpty()) {
      if (missingForecast > 0) {
        throw new ForecastUnavailableException(
            "no stored forecast for " + t + " in pipeline " + pipeline.getName());
      }
      throw new DataUnavailableException(
          "no actual value in (" + t.minus(step) + ", " + t + "] for " + pipeline.getName());
    }
    if (pipeline.getOutput().isWriteAnomalyScore()) {
      tsdb.write(results);
      logger.info(
          "task.anomaly.written",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.timestamp(t),
          StructuredLogging.series(results.size()));
    }
    return results;
  }

  private Forecast forecastInline(Pipeline pipeline, TimeSeries series, Instant end)
      throws TaskException {
    List<Sample> context = series.upTo(end);
    int required = TaskSupport.requiredPoints(pipeline, config.getMinContextRatio());
    if (context.size() < required) {
      throw new InsufficientDataException(context.size(), required);
    }
    return modelEngineFactory
        .get(pipeline)
        .predict(
            context,
            pipeline.getStep(),
            TaskSupport.request(pipeline, 1, TaskSupport.latestModelId(registry, pipeline)));
  }

  /** Residuals at the timestamps up to {@code end} where both the actual and forecast exist. */
  private static double[] residuals(TimeSeries actuals, TimeSeries forecasts, Instant end) {
    List<Double> residuals = new ArrayList<>();
    for (Sample actual : actuals.upTo(end)) {
      forecasts
          .at(actual.getTimestamp())
          .ifPresent(f -> residuals.add(f.getValue() - actual.getValue()));
    }
    double[] history = new double[residuals.size()];
    for (int i = 0; i < history.length; i++) {
      history[i] = residuals.get(i);
    }
    return history;
  }
}
