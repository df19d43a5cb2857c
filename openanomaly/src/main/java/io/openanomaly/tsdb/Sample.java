package io.openanomaly.tsdb;

import java.time.Instant;
import java.util.Objects;

/** One value of a series at a timestamp. */
public final class Sample {
  private final Instant timestamp;
  private final double value;

  public Sample(Instant timestamp, double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Sample sample = (Sample) o;
    return Double.compare(sample.value, value) == 0 && timestamp.equals(sample.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timestamp, value);
  }

  @Override
  public String toString() {
    return timestamp + "=" + value;
  }
}
