package io.openanomaly.core.pipeline;

import io.openanomaly.core.controller.scheduler.CronSchedule;
import io.openanomaly.core.errors.ConfigValidationException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * PipelineValidator rejects out-of-range or inconsistent pipeline definitions at load time.
 *
 * <p>Unknown fields are rejected earlier, by {@link PipelineCodec}.
 */
public final class PipelineValidator {
  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.\\-]*");
  private static final Pattern METRIC_PREFIX = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");

  private final ModelReferenceChecker modelReferenceChecker;

  public PipelineValidator() {
    this(ModelReferenceChecker.ANY);
  }

  public PipelineValidator(ModelReferenceChecker modelReferenceChecker) {
    this.modelReferenceChecker = modelReferenceChecker;
  }

  public void validate(Pipeline pipeline) throws ConfigValidationException {
    List<String> violations = violations(pipeline);
    if (!violations.isEmpty()) {
      throw new ConfigValidationException(violations);
    }
  }

  public List<String> violations(Pipeline pipeline) {
    List<String> violations = new ArrayList<>();
    if (pipeline.getName() == null || !NAME.matcher(pipeline.getName()).matches()) {
      violations.add("name must match " + NAME.pattern());
    }
    if (pipeline.getQuery() == null || pipeline.getQuery().isBlank()) {
      violations.add("query must not be empty");
    }
    if (!positive(pipeline.getStep())) {
      violations.add("step must be positive");
    } else {
      if (pipeline.getContextWindow() == null
          || pipeline.getContextWindow().compareTo(pipeline.getStep()) < 0) {
        violations.add("context_window must be at least one step");
      }
      if (pipeline.getPredictionHorizon() == null
          || pipeline.getPredictionHorizon().compareTo(pipeline.getStep()) < 0) {
        violations.add("prediction_horizon must be at least one step");
      }
    }
    if (pipeline.getMode() == null) {
      violations.add("mode is required");
    } else {
      if (pipeline.getMode().forecasts()) {
        checkCron(violations, "forecast_schedule", pipeline.getForecastSchedule());
      }
      if (pipeline.getMode().detectsAnomalies()) {
        checkCron(violations, "anomaly_schedule", pipeline.getAnomalySchedule());
        checkAnomaly(violations, pipeline.getAnomaly());
      }
    }
    checkModel(violations, pipeline.getModel());
    checkOutput(violations, pipeline.getOutput());
    TrainingConfig training = pipeline.getTraining();
    if (training != null && training.isEnabled()) {
      checkCron(violations, "training.schedule", training.getSchedule());
      if (!positive(training.getWindow())
          || (positive(pipeline.getStep())
              && training.getWindow().compareTo(pipeline.getStep()) < 0)) {
        violations.add("training.window must be at least one step");
      }
      if (training.getEndpoint() != null) {
        checkUrl(violations, "training.endpoint", training.getEndpoint());
      }
      if (training.isKafkaEnabled()) {
        if (isBlank(training.getKafkaBootstrapServers())) {
          violations.add("training.kafka_bootstrap_servers is required when kafka is enabled");
        }
        if (isBlank(training.getKafkaTopic())) {
          violations.add("training.kafka_topic is required when kafka is enabled");
        }
      }
    }
    if (pipeline.getModel() != null) {
      violations.addAll(
          modelReferenceChecker.check(pipeline.getModel(), pipeline.isTrainingEnabled()));
    }
    if (pipeline.getPrometheusUrl() != null) {
      checkUrl(violations, "prometheus_url", pipeline.getPrometheusUrl());
    }
    if (pipeline.getPrometheusWriteUrl() != null) {
      checkUrl(violations, "prometheus_write_url", pipeline.getPrometheusWriteUrl());
    }
    return violations;
  }

  private static void checkAnomaly(List<String> violations, AnomalyConfig anomaly) {
    if (anomaly == null) {
      violations.add("anomaly is required when mode includes anomaly detection");
      return;
    }
    if (anomaly.getTechnique() == null) {
      violations.add("anomaly.technique is required");
    }
    double cl = anomaly.getConfidenceLevel();
    if (Double.isNaN(cl) || cl < 0 || cl > 1) {
      violations.add("anomaly.confidence_level must be in [0, 1]");
    }
    if (!(anomaly.getThreshold() > 0)) {
      violations.add("anomaly.threshold must be positive");
    }
    if (anomaly.getMinHistory() != null && anomaly.getMinHistory() < 1) {
      violations.add("anomaly.min_history must be at least 1");
    }
  }

  private static void checkModel(List<String> violations, ModelConfig model) {
    if (model == null) {
      violations.add("model is required");
      return;
    }
    if (model.getType() == null) {
      violations.add("model.type is required");
    } else if (model.getType() == ModelType.REMOTE) {
      if (isBlank(model.getEndpoint())) {
        violations.add("model.endpoint is required for remote models");
      } else {
        checkUrl(violations, "model.endpoint", model.getEndpoint());
      }
    } else if (isBlank(model.getId())) {
      violations.add("model.id is required for local models");
    }
    if (model.getSerializationFormat() == null) {
      violations.add("model.serialization_format is required");
    }
    if (!positive(model.getTimeout())) {
      violations.add("model.timeout must be positive");
    }
    if (model.getQuantiles() == null) {
      violations.add("model.quantiles must not be null");
    } else {
      for (Double q : model.getQuantiles()) {
        if (q == null || !(q > 0 && q < 1)) {
          violations.add("model.quantiles must be in (0, 1), got " + q);
        }
      }
    }
  }

  private static void checkOutput(List<String> violations, OutputConfig output) {
    if (output == null) {
      violations.add("output is required");
      return;
    }
    if (output.getMetricPrefix() == null
        || !METRIC_PREFIX.matcher(output.getMetricPrefix()).matches()) {
      violations.add("output.metric_prefix must be a valid metric name prefix");
    }
  }

  private static void checkCron(List<String> violations, String field, String expression) {
    try {
      CronSchedule.parse(expression);
    } catch (IllegalArgumentException e) {
      violations.add(field + " is not a valid cron expression: " + expression);
    }
  }

  private static void checkUrl(List<String> violations, String field, String url) {
    try {
      URI uri = URI.create(url);
      if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
        violations.add(field + " must be an http(s) url");
      } else if (uri.getHost() == null) {
        violations.add(field + " must have a host");
      }
    } catch (IllegalArgumentException e) {
      violations.add(field + " is not a valid url");
    }
  }

  private static boolean positive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
