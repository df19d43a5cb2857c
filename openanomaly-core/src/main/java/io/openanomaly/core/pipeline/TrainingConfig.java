package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/** Retraining sub-configuration, including the optional Kafka training event stream. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingConfig {
  private boolean enabled = true;
  private String schedule = "0 0 * * *";
  private Duration window = Duration.ofDays(30);
  // full training url, overrides {model.endpoint}/train
  @Nullable private String endpoint;
  private Map<String, Object> parameters = new LinkedHashMap<>();

  private boolean kafkaEnabled = false;
  @Nullable private String kafkaBootstrapServers;
  @Nullable private String kafkaTopic;
  private String kafkaMessageKey = "{pipeline_name}";
  // values may reference {event_type}, {pipeline_name} and any event field
  private Map<String, Object> kafkaMessageTemplate = new LinkedHashMap<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getSchedule() {
    return schedule;
  }

  public void setSchedule(String schedule) {
    this.schedule = schedule;
  }

  public Duration getWindow() {
    return window;
  }

  public void setWindow(Duration window) {
    this.window = window;
  }

  @Nullable
  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(@Nullable String endpoint) {
    this.endpoint = endpoint;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public void setParameters(Map<String, Object> parameters) {
    this.parameters = parameters;
  }

  public boolean isKafkaEnabled() {
    return kafkaEnabled;
  }

  public void setKafkaEnabled(boolean kafkaEnabled) {
    this.kafkaEnabled = kafkaEnabled;
  }

  @Nullable
  public String getKafkaBootstrapServers() {
    return kafkaBootstrapServers;
  }

  public void setKafkaBootstrapServers(@Nullable String kafkaBootstrapServers) {
    this.kafkaBootstrapServers = kafkaBootstrapServers;
  }

  @Nullable
  public String getKafkaTopic() {
    return kafkaTopic;
  }

  public void setKafkaTopic(@Nullable String kafkaTopic) {
    this.kafkaTopic = kafkaTopic;
  }

  public String getKafkaMessageKey() {
    return kafkaMessageKey;
  }

  public void setKafkaMessageKey(String kafkaMessageKey) {
    this.kafkaMessageKey = kafkaMessageKey;
  }

  public Map<String, Object> getKafkaMessageTemplate() {
    return kafkaMessageTemplate;
  }

  public void setKafkaMessageTemplate(Map<String, Object> kafkaMessageTemplate) {
    this.kafkaMessageTemplate = kafkaMessageTemplate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TrainingConfig that = (TrainingConfig) o;
    return enabled == that.enabled
        && kafkaEnabled == that.kafkaEnabled
        && Objects.equals(schedule, that.schedule)
        && Objects.equals(window, that.window)
        && Objects.equals(endpoint, that.endpoint)
        && Objects.equals(parameters, that.parameters)
        && Objects.equals(kafkaBootstrapServers, that.kafkaBootstrapServers)
        && Objects.equals(kafkaTopic, that.kafkaTopic)
        && Objects.equals(kafkaMessageKey, that.kafkaMessageKey)
        && Objects.equals(kafkaMessageTemplate, that.kafkaMessageTemplate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        enabled,
        schedule,
        window,
        endpoint,
        parameters,
        kafkaEnabled,
        kafkaBootstrapServers,
        kafkaTopic,
        kafkaMessageKey,
        kafkaMessageTemplate);
  }
}
