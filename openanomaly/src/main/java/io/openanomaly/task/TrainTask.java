package io.openanomaly.task;

import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.TrainingConfig;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.TrainingArtifact;
import io.openanomaly.model.ModelEngine;
import io.openanomaly.model.ModelEngineFactory;
import io.openanomaly.tsdb.TimeSeries;
import io.openanomaly.tsdb.TsdbClientFactory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TrainTask fits the pipeline's model on the training window ending at the due time and records
 * the resulting artifact in the registry.
 *
 * <p>When the query returns several series the one with the most samples is used.
 */
public class TrainTask {
  private static final Logger logger = LoggerFactory.getLogger(TrainTask.class);

  private final TsdbClientFactory tsdbClientFactory;
  private final ModelEngineFactory modelEngineFactory;
  private final PipelineRegistry registry;
  private final TrainingEventPublisher publisher;
  private final Clock clock;
  private final CoreInfra infra;

  public TrainTask(
      TsdbClientFactory tsdbClientFactory,
      ModelEngineFactory modelEngineFactory,
      PipelineRegistry registry,
      TrainingEventPublisher publisher,
      Clock clock,
      CoreInfra infra) {
    this.tsdbClientFactory = tsdbClientFactory;
    this.modelEngineFactory = modelEngineFactory;
    this.registry = registry;
    this.publisher = publisher;
    this.clock = clock;
    this.infra = infra;
  }

  /**
   * Trains and saves the artifact.
   *
   * @return the saved artifact.
   * @throws Exception a classified task failure, or the registry failure when the artifact
   *     cannot be saved.
   */
  public TrainingArtifact run(Pipeline pipeline, Instant dueTime) throws Exception {
    TrainingConfig training = pipeline.getTraining();
    if (training == null || !training.isEnabled()) {
      throw new ConfigValidationException(
          "pipeline " + pipeline.getName() + " does not enable training");
    }
    ModelEngine engine = modelEngineFactory.get(pipeline);
    if (!engine.isTrainable()) {
      throw new ConfigValidationException(
          "model of pipeline " + pipeline.getName() + " is not trainable");
    }
    Duration window = training.getWindow();
    Map<String, Object> started = new LinkedHashMap<>();
    started.put("model_id", pipeline.getModel().getId());
    started.put("training_window", window);
    publisher.publish(pipeline, TrainingEventPublisher.TRAINING_STARTED, started, false);

    Instant startedAt = clock.instant();
    try {
      Instant windowStart = dueTime.minus(window);
      List<TimeSeries> history =
          tsdbClientFactory
              .get(pipeline)
              .queryRange(pipeline.getQuery(), windowStart, dueTime, pipeline.getStep());
      TimeSeries series =
          history.stream()
              .max(Comparator.comparingInt(s -> s.getSamples().size()))
              .filter(s -> !s.getSamples().isEmpty())
              .orElseThrow(
                  () ->
                      new DataUnavailableException(
                          "no training data for pipeline " + pipeline.getName()));

      String modelId =
          engine.train(series.getSamples(), pipeline.getStep(), window, training.getParameters());
      TrainingArtifact artifact =
          new TrainingArtifact(pipeline.getName(), modelId, clock.instant(), windowStart, dueTime);
      registry.saveArtifact(artifact);
      infra.scope().counter("task.train.artifact.saved").inc(1);
      logger.info(
          "task.train.completed",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.modelId(modelId),
          StructuredLogging.points(series.getSamples().size()));

      Map<String, Object> completed = new LinkedHashMap<>();
      completed.put("model_id", modelId);
      completed.put("training_window", window);
      completed.put("status", "success");
      completed.put("duration_seconds", seconds(startedAt));
      publisher.publish(pipeline, TrainingEventPublisher.TRAINING_COMPLETED, completed, true);
      return artifact;
    } catch (Exception e) {
      Map<String, Object> failed = new LinkedHashMap<>();
      failed.put("model_id", pipeline.getModel().getId());
      failed.put("training_window", window);
      failed.put("status", "failed");
      failed.put("duration_seconds", seconds(startedAt));
      failed.put("error", String.valueOf(e.getMessage()));
      publisher.publish(pipeline, TrainingEventPublisher.TRAINING_FAILED, failed, true);
      throw e;
    }
  }

  private double seconds(Instant since) {
    long millis = Duration.between(since, clock.instant()).toMillis();
    return BigDecimal.valueOf(millis, 3).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
