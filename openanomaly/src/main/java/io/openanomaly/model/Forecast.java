package io.openanomaly.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Forecast holds the predicted mean and quantile paths, one value per step after the end of the
 * context.
 */
public final class Forecast {
  private final ImmutableList<Double> mean;
  private final ImmutableSortedMap<Double, ImmutableList<Double>> quantiles;

  public Forecast(List<Double> mean, Map<Double, List<Double>> quantiles) {
    this.mean = ImmutableList.copyOf(mean);
    Map<Double, ImmutableList<Double>> normalized = new TreeMap<>();
    quantiles.forEach(
        (q, values) -> {
          Preconditions.checkArgument(
              values.size() == mean.size(),
              "quantile %s has %s values, mean has %s",
              q,
              values.size(),
              mean.size());
          normalized.put(Quantiles.normalize(q), ImmutableList.copyOf(values));
        });
    this.quantiles = ImmutableSortedMap.copyOf(normalized);
  }

  public ImmutableList<Double> getMean() {
    return mean;
  }

  public ImmutableSortedMap<Double, ImmutableList<Double>> getQuantiles() {
    return quantiles;
  }

  public int length() {
    return mean.size();
  }

  /** Returns the path of the quantile level, tolerating rounding of the level. */
  public Optional<ImmutableList<Double>> quantile(double q) {
    return Optional.ofNullable(quantiles.get(Quantiles.normalize(q)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Forecast that = (Forecast) o;
    return mean.equals(that.mean) && quantiles.equals(that.quantiles);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mean, quantiles);
  }

  @Override
  public String toString() {
    return "Forecast{mean=" + mean + ", quantiles=" + quantiles + "}";
  }
}
