package io.openanomaly.tsdb;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * TimeSeries is one labelled series with its samples ordered by timestamp.
 *
 * <p>The metric name, when present, is the {@value #NAME_LABEL} label.
 */
public final class TimeSeries {
  public static final String NAME_LABEL = "__name__";

  private final ImmutableSortedMap<String, String> labels;
  private final ImmutableList<Sample> samples;

  public TimeSeries(Map<String, String> labels, List<Sample> samples) {
    this.labels = ImmutableSortedMap.copyOf(labels);
    this.samples =
        ImmutableList.sortedCopyOf(Comparator.comparing(Sample::getTimestamp), samples);
  }

  /** Returns a series named {@code metricName} with the given labels. */
  public static TimeSeries named(
      String metricName, Map<String, String> labels, List<Sample> samples) {
    Map<String, String> named = new TreeMap<>(labels);
    named.put(NAME_LABEL, metricName);
    return new TimeSeries(named, samples);
  }

  public ImmutableSortedMap<String, String> getLabels() {
    return labels;
  }

  public ImmutableList<Sample> getSamples() {
    return samples;
  }

  @Nullable
  public String getMetricName() {
    return labels.get(NAME_LABEL);
  }

  /** Returns the labels without the metric name. */
  public ImmutableSortedMap<String, String> seriesLabels() {
    Map<String, String> series = new TreeMap<>(labels);
    series.remove(NAME_LABEL);
    return ImmutableSortedMap.copyOf(series);
  }

  /** Returns the sample at exactly the timestamp. */
  public Optional<Sample> at(Instant timestamp) {
    for (Sample sample : samples) {
      if (sample.getTimestamp().equals(timestamp)) {
        return Optional.of(sample);
      }
    }
    return Optional.empty();
  }

  /** Returns the latest sample in {@code (fromExclusive, toInclusive]}. */
  public Optional<Sample> latestIn(Instant fromExclusive, Instant toInclusive) {
    for (Sample sample : samples.reverse()) {
      Instant ts = sample.getTimestamp();
      if (ts.isAfter(toInclusive)) {
        continue;
      }
      return ts.isAfter(fromExclusive) ? Optional.of(sample) : Optional.empty();
    }
    return Optional.empty();
  }

  /** Returns the samples at or before the timestamp. */
  public ImmutableList<Sample> upTo(Instant toInclusive) {
    return samples.stream()
        .filter(s -> !s.getTimestamp().isAfter(toInclusive))
        .collect(ImmutableList.toImmutableList());
  }

  public double[] values() {
    double[] values = new double[samples.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = samples.get(i).getValue();
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TimeSeries that = (TimeSeries) o;
    return labels.equals(that.labels) && samples.equals(that.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, samples);
  }

  @Override
  public String toString() {
    return labels + " " + samples.size() + " samples";
  }
}
