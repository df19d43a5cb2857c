package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/** Reference to the forecasting backend of a pipeline. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelConfig {
  private ModelType type = ModelType.LOCAL;
  // local backend identifier
  @Nullable private String id = "seasonal_naive";
  // remote base url
  @Nullable private String endpoint;
  private SerializationFormat serializationFormat = SerializationFormat.JSON;
  private Duration timeout = Duration.ofSeconds(30);
  private List<Double> quantiles = new ArrayList<>(List.of(0.1, 0.5, 0.9));
  private Map<String, Object> parameters = new LinkedHashMap<>();

  public ModelType getType() {
    return type;
  }

  public void setType(ModelType type) {
    this.type = type;
  }

  @Nullable
  public String getId() {
    return id;
  }

  public void setId(@Nullable String id) {
    this.id = id;
  }

  @Nullable
  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(@Nullable String endpoint) {
    this.endpoint = endpoint;
  }

  public SerializationFormat getSerializationFormat() {
    return serializationFormat;
  }

  public void setSerializationFormat(SerializationFormat serializationFormat) {
    this.serializationFormat = serializationFormat;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public List<Double> getQuantiles() {
    return quantiles;
  }

  public void setQuantiles(List<Double> quantiles) {
    this.quantiles = quantiles;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public void setParameters(Map<String, Object> parameters) {
    this.parameters = parameters;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ModelConfig that = (ModelConfig) o;
    return type == that.type
        && Objects.equals(id, that.id)
        && Objects.equals(endpoint, that.endpoint)
        && serializationFormat == that.serializationFormat
        && Objects.equals(timeout, that.timeout)
        && Objects.equals(quantiles, that.quantiles)
        && Objects.equals(parameters, that.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, id, endpoint, serializationFormat, timeout, quantiles, parameters);
  }
}
