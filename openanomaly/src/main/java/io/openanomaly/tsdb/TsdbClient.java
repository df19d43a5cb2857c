package io.openanomaly.tsdb;

import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.WriteException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * TsdbClient reads ranges from and writes results to a Prometheus-compatible TSDB.
 *
 * <p>An interrupted call restores the interrupt flag and fails with its usual exception.
 */
public interface TsdbClient {

  /**
   * Evaluates the query over {@code [start, end]} at the step.
   *
   * @return the result series, each labelled as returned by the TSDB. Empty if nothing matched.
   * @throws DataUnavailableException if the TSDB could not be queried or answered with an error.
   */
  List<TimeSeries> queryRange(String query, Instant start, Instant end, Duration step)
      throws DataUnavailableException;

  /**
   * Writes the series. Every series must carry a metric name.
   *
   * @throws WriteException once the client's own retries are exhausted.
   */
  void write(List<TimeSeries> series) throws WriteException;
}
