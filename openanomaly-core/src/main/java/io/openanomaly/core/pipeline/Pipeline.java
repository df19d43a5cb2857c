package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.openanomaly.core.common.JsonMappers;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Pipeline is the definition of one monitored query: what to read, how to forecast it, how to
 * score anomalies and where to write results.
 *
 * <p>Pipelines are identified by name and are read-only to the scheduling core. Jobs carry a
 * {@link #copy()} taken at enqueue time.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "name",
  "description",
  "enabled",
  "query",
  "step",
  "context_window",
  "prediction_horizon",
  "mode",
  "forecast_schedule",
  "anomaly_schedule",
  "model",
  "training",
  "anomaly",
  "output",
  "prometheus_url",
  "prometheus_write_url"
})
public class Pipeline {
  private String name = "";
  private String description = "";
  private boolean enabled = true;
  private String query = "";
  private Duration step = Duration.ofMinutes(1);
  private Duration contextWindow = Duration.ofHours(1);
  private Duration predictionHorizon = Duration.ofMinutes(15);
  private PipelineMode mode = PipelineMode.FORECAST_AND_ANOMALY;
  private String forecastSchedule = "*/5 * * * *";
  private String anomalySchedule = "*/1 * * * *";
  private ModelConfig model = new ModelConfig();
  @Nullable private TrainingConfig training;
  private AnomalyConfig anomaly = new AnomalyConfig();
  private OutputConfig output = new OutputConfig();
  // per pipeline TSDB overrides
  @Nullable private String prometheusUrl;
  @Nullable private String prometheusWriteUrl;

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getQuery() {
    return query;
  }

  public void setQuery(String query) {
    this.query = query;
  }

  public Duration getStep() {
    return step;
  }

  public void setStep(Duration step) {
    this.step = step;
  }

  public Duration getContextWindow() {
    return contextWindow;
  }

  public void setContextWindow(Duration contextWindow) {
    this.contextWindow = contextWindow;
  }

  public Duration getPredictionHorizon() {
    return predictionHorizon;
  }

  public void setPredictionHorizon(Duration predictionHorizon) {
    this.predictionHorizon = predictionHorizon;
  }

  public PipelineMode getMode() {
    return mode;
  }

  public void setMode(PipelineMode mode) {
    this.mode = mode;
  }

  public String getForecastSchedule() {
    return forecastSchedule;
  }

  public void setForecastSchedule(String forecastSchedule) {
    this.forecastSchedule = forecastSchedule;
  }

  public String getAnomalySchedule() {
    return anomalySchedule;
  }

  public void setAnomalySchedule(String anomalySchedule) {
    this.anomalySchedule = anomalySchedule;
  }

  public ModelConfig getModel() {
    return model;
  }

  public void setModel(ModelConfig model) {
    this.model = model;
  }

  @Nullable
  public TrainingConfig getTraining() {
    return training;
  }

  public void setTraining(@Nullable TrainingConfig training) {
    this.training = training;
  }

  public AnomalyConfig getAnomaly() {
    return anomaly;
  }

  public void setAnomaly(AnomalyConfig anomaly) {
    this.anomaly = anomaly;
  }

  public OutputConfig getOutput() {
    return output;
  }

  public void setOutput(OutputConfig output) {
    this.output = output;
  }

  @Nullable
  public String getPrometheusUrl() {
    return prometheusUrl;
  }

  public void setPrometheusUrl(@Nullable String prometheusUrl) {
    this.prometheusUrl = prometheusUrl;
  }

  @Nullable
  public String getPrometheusWriteUrl() {
    return prometheusWriteUrl;
  }

  public void setPrometheusWriteUrl(@Nullable String prometheusWriteUrl) {
    this.prometheusWriteUrl = prometheusWriteUrl;
  }

  /** Returns true if retraining is configured and switched on. */
  @JsonIgnore
  public boolean isTrainingEnabled() {
    return training != null && training.isEnabled();
  }

  /** Returns the job kinds this pipeline schedules. forecast_only ignores anomaly settings. */
  @JsonIgnore
  public Set<JobKind> getScheduledKinds() {
    Set<JobKind> kinds = EnumSet.noneOf(JobKind.class);
    if (mode.forecasts()) {
      kinds.add(JobKind.FORECAST);
    }
    if (mode.detectsAnomalies()) {
      kinds.add(JobKind.ANOMALY);
    }
    if (isTrainingEnabled()) {
      kinds.add(JobKind.TRAIN);
    }
    return kinds;
  }

  /** Returns the cron expression driving the given kind. */
  public String scheduleFor(JobKind kind) {
    switch (kind) {
      case FORECAST:
        return forecastSchedule;
      case ANOMALY:
        return anomalySchedule;
      case TRAIN:
        return Objects.requireNonNull(training, "training").getSchedule();
      default:
        throw new IllegalArgumentException("unknown job kind " + kind);
    }
  }

  /** Returns a deep copy that shares no mutable state with this pipeline. */
  public Pipeline copy() {
    try {
      return JsonMappers.lenient()
          .readValue(JsonMappers.lenient().writeValueAsBytes(this), Pipeline.class);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Pipeline that = (Pipeline) o;
    return enabled == that.enabled
        && Objects.equals(name, that.name)
        && Objects.equals(description, that.description)
        && Objects.equals(query, that.query)
        && Objects.equals(step, that.step)
        && Objects.equals(contextWindow, that.contextWindow)
        && Objects.equals(predictionHorizon, that.predictionHorizon)
        && mode == that.mode
        && Objects.equals(forecastSchedule, that.forecastSchedule)
        && Objects.equals(anomalySchedule, that.anomalySchedule)
        && Objects.equals(model, that.model)
        && Objects.equals(training, that.training)
        && Objects.equals(anomaly, that.anomaly)
        && Objects.equals(output, that.output)
        && Objects.equals(prometheusUrl, that.prometheusUrl)
        && Objects.equals(prometheusWriteUrl, that.prometheusWriteUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name,
        description,
        enabled,
        query,
        step,
        contextWindow,
        predictionHorizon,
        mode,
        forecastSchedule,
        anomalySchedule,
        model,
        training,
        anomaly,
        output,
        prometheusUrl,
        prometheusWriteUrl);
  }

  @Override
  public String toString() {
    return "Pipeline{name=" + name + ", mode=" + mode + ", query=" + query + "}";
  }
}
