package io.openanomaly.task;

import io.openanomaly.common.StructuredLogging;
import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.InsufficientDataException;
import io.openanomaly.core.errors.TaskException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.model.Forecast;
import io.openanomaly.model.ForecastRequest;
import io.openanomaly.model.ModelEngine;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.tsdb.TimeSeries;
import io.openanomaly.tsdb.TsdbClient;
import io.openanomaly.tsdb.TsdbClientFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ForecastTask predicts the prediction horizon after the due time and writes the mean and
 * quantile paths.
 *
 * <p>Each source series returned by the pipeline query is forecast on its own. Series with fewer
 * context points than required are skipped; when no series has enough the task fails with
 * {@link InsufficientDataException}. The prediction always runs, the write only when the pipeline
 * writes forecasts.
 */
public class ForecastTask {
  private static final Logger logger = LoggerFactory.getLogger(ForecastTask.class);

  private final TsdbClientFactory tsdbClientFactory;
  private final ModelEngineFactory modelEngineFactory;
  private final PipelineRegistry registry;
  private final ModelConfiguration config;
  private final CoreInfra infra;

  public ForecastTask(
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
   * Forecasts from the context window ending at the due time.
   *
   * @return the result series, written or not.
   */
  public List<TimeSeries> run(Pipeline pipeline, Instant dueTime) throws TaskException {
    TsdbClient tsdb = tsdbClientFactory.get(pipeline);
    List<TimeSeries> context =
        tsdb.queryRange(
            pipeline.getQuery(),
            dueTime.minus(pipeline.getContextWindow()),
            dueTime,
            pipeline.getStep());
    int required = TaskSupport.requiredPoints(pipeline, config.getMinContextRatio());
    ModelEngine engine = modelEngineFactory.get(pipeline);
    ForecastRequest request =
        TaskSupport.request(
            pipeline,
            TaskSupport.predictionLength(pipeline),
            TaskSupport.latestModelId(registry, pipeline));

    List<TimeSeries> results = new ArrayList<>();
    int mostPoints = 0;
    for (TimeSeries series : context) {
      int points = series.getSamples().size();
      mostPoints = Math.max(mostPoints, points);
      if (points < required) {
        logger.debug(
            "task.forecast.series.skipped",
            StructuredLogging.pipeline(pipeline.getName()),
            StructuredLogging.points(points),
            StructuredLogging.count(required));
        continue;
      }
      Forecast forecast = engine.predict(series.getSamples(), pipeline.getStep(), request);
      results.addAll(
          ResultSeries.forecast(
              pipeline, series.getLabels(), forecast, dueTime, pipeline.getStep()));
    }
    if (results.isEmpty()) {
      throw new InsufficientDataException(mostPoints, required);
    }

    if (pipeline.getOutput().isWriteForecast()) {
      tsdb.write(results);
      infra.scope().counter("task.forecast.series.written").inc(results.size());
      logger.info(
          "task.forecast.written",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.dueTime(dueTime),
          StructuredLogging.series(results.size()));
    } else {
      logger.debug(
          "task.forecast.write.disabled",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.dueTime(dueTime));
    }
    return results;
  }
}
