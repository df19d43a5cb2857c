package io.openanomaly.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import javax.annotation.Nullable;

/** What to predict: horizon in steps, quantile levels and backend parameters. */
public final class ForecastRequest {
  private final int predictionLength;
  private final ImmutableList<Double> quantiles;
  private final ImmutableMap<String, Object> parameters;
  @Nullable private final String modelId;

  public ForecastRequest(
      int predictionLength,
      Collection<Double> quantiles,
      Map<String, Object> parameters,
      @Nullable String modelId) {
    Preconditions.checkArgument(predictionLength > 0, "prediction length must be positive");
    this.predictionLength = predictionLength;
    TreeSet<Double> levels = new TreeSet<>();
    for (Double q : quantiles) {
      levels.add(Quantiles.normalize(q));
    }
    this.quantiles = ImmutableList.copyOf(levels);
    this.parameters = ImmutableMap.copyOf(parameters);
    this.modelId = modelId;
  }

  public int getPredictionLength() {
    return predictionLength;
  }

  /** Distinct levels in ascending order. */
  public ImmutableList<Double> getQuantiles() {
    return quantiles;
  }

  public ImmutableMap<String, Object> getParameters() {
    return parameters;
  }

  /** The trained artifact to predict with, if any. */
  @Nullable
  public String getModelId() {
    return modelId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ForecastRequest that = (ForecastRequest) o;
    return predictionLength == that.predictionLength
        && quantiles.equals(that.quantiles)
        && parameters.equals(that.parameters)
        && Objects.equals(modelId, that.modelId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(predictionLength, quantiles, parameters, modelId);
  }

  @Override
  public String toString() {
    return "ForecastRequest{length="
        + predictionLength
        + ", quantiles="
        + quantiles
        + ", modelId="
        + modelId
        + "}";
  }
}
