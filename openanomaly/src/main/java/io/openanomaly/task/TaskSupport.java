package io.openanomaly.task;

import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.pipeline.AnomalyConfig;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.registry.PipelineRegistry;
import io.openanomaly.core.registry.TrainingArtifact;
import io.openanomaly.model.ForecastRequest;
import io.openanomaly.model.Quantiles;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rules shared by the forecast and anomaly tasks. */
final class TaskSupport {
  private static final Logger logger = LoggerFactory.getLogger(TaskSupport.class);

  private TaskSupport() {}

  /** Fewest context points to predict from: {@code ceil(window / step * ratio)}, at least 2. */
  static int requiredPoints(Pipeline pipeline, double minContextRatio) {
    double expected =
        (double) pipeline.getContextWindow().toMillis() / pipeline.getStep().toMillis();
    return Math.max(2, (int) Math.ceil(expected * minContextRatio));
  }

  static int predictionLength(Pipeline pipeline) {
    return (int)
        Math.max(1, pipeline.getPredictionHorizon().toMillis() / pipeline.getStep().toMillis());
  }

  /** Truncates the instant to a multiple of the step since the epoch. */
  static Instant alignDown(Instant instant, Duration step) {
    long stepMs = step.toMillis();
    long ms = instant.toEpochMilli();
    return Instant.ofEpochMilli(ms - Math.floorMod(ms, stepMs));
  }

  /** The configured quantiles plus the confidence band of the anomaly configuration. */
  static Set<Double> quantiles(Pipeline pipeline) {
    Set<Double> levels = new LinkedHashSet<>(pipeline.getModel().getQuantiles());
    AnomalyConfig anomaly = pipeline.getAnomaly();
    if (anomaly != null && pipeline.getMode() != null && pipeline.getMode().detectsAnomalies()) {
      for (double q : Quantiles.confidenceBand(anomaly.getConfidenceLevel())) {
        if (q > 0 && q < 1) {
          levels.add(q);
        }
      }
    }
    return levels;
  }

  static ForecastRequest request(Pipeline pipeline, int length, @Nullable String modelId) {
    return new ForecastRequest(
        length, quantiles(pipeline), pipeline.getModel().getParameters(), modelId);
  }

  /**
   * The model id of the latest training artifact, when the pipeline trains. A registry failure
   * falls back to the untrained model.
   */
  @Nullable
  static String latestModelId(PipelineRegistry registry, Pipeline pipeline) {
    if (!pipeline.isTrainingEnabled()) {
      return null;
    }
    try {
      Optional<TrainingArtifact> artifact = registry.latestArtifact(pipeline.getName());
      return artifact.map(TrainingArtifact::getModelId).orElse(null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (Exception e) {
      logger.warn(
          "task.artifact.lookup.failure",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.reason(e.getMessage()));
      return null;
    }
  }
}
