package io.openanomaly.tsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.openanomaly.common.StructuredLogging;
import io.openanomaly.config.TsdbConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.PromDurations;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.WriteException;
import io.openanomaly.instrumentation.Instrumentation;
import io.openanomaly.tsdb.prompb.Remote;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xerial.snappy.Snappy;

/**
 * PrometheusTsdbClient talks to the Prometheus HTTP API for reads and to the remote write
 * endpoint for writes.
 *
 * <p>Reads use {@code GET /api/v1/query_range}. A read that fails on a connection error, 5xx or
 * 429 raises an unreachable {@link DataUnavailableException} so the job is redelivered; other
 * failures skip the tick. Writes send a snappy compressed protobuf {@code WriteRequest} and are
 * retried with exponential backoff on connection failures, 5xx and 429. Other 4xx responses are
 * not retried.
 */
public final class PrometheusTsdbClient implements TsdbClient {
  private static final Logger logger = LoggerFactory.getLogger(PrometheusTsdbClient.class);
  @VisibleForTesting static final String QUERY_RANGE_PATH = "/api/v1/query_range";
  @VisibleForTesting static final String WRITE_PATH = "/api/v1/write";
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpClient httpClient;
  private final String readUrl;
  @Nullable private final String writeUrl;
  private final TsdbConfiguration config;
  private final CoreInfra infra;
  private final RetryPolicy<Object> writeRetryPolicy;

  public PrometheusTsdbClient(
      HttpClient httpClient,
      String readUrl,
      @Nullable String writeUrl,
      TsdbConfiguration config,
      CoreInfra infra) {
    this.httpClient = httpClient;
    this.readUrl = trimSlash(readUrl);
    this.writeUrl = writeUrl == null ? null : trimSlash(writeUrl);
    this.config = config;
    this.infra = infra;
    this.writeRetryPolicy = writeRetryPolicy(config, infra);
  }

  public String getReadUrl() {
    return readUrl;
  }

  @Nullable
  public String getWriteUrl() {
    return writeUrl;
  }

  @Override
  public List<TimeSeries> queryRange(String query, Instant start, Instant end, Duration step)
      throws DataUnavailableException {
    return Instrumentation.instrument.withException(
        logger,
        infra.scope(),
        infra.tracer(),
        () -> doQueryRange(query, start, end, step),
        "tsdb.query_range");
  }

  private List<TimeSeries> doQueryRange(String query, Instant start, Instant end, Duration step)
      throws DataUnavailableException {
    URI uri =
        URI.create(
            readUrl
                + QUERY_RANGE_PATH
                + "?query="
                + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&start="
                + epochSeconds(start)
                + "&end="
                + epochSeconds(end)
                + "&step="
                + PromDurations.format(step));
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri)
            .timeout(config.getQueryTimeout())
            .header("Accept", "application/json")
            .GET();
    config.getHeaders().forEach(builder::header);
    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw DataUnavailableException.unreachable("query_range to " + readUrl + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw DataUnavailableException.unreachable("query_range interrupted", e);
    }
    int status = response.statusCode();
    if (status / 100 != 2) {
      logger.warn(
          "tsdb.query_range.status",
          StructuredLogging.uri(readUrl),
          StructuredLogging.statusCode(status));
      String message = "query_range returned status " + status;
      if (isServerSide(status)) {
        throw DataUnavailableException.unreachable(message);
      }
      throw new DataUnavailableException(message);
    }
    return parseMatrix(response.body());
  }

  @VisibleForTesting
  static List<TimeSeries> parseMatrix(byte[] body) throws DataUnavailableException {
    JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (IOException e) {
      throw new DataUnavailableException("query_range response is not json", e);
    }
    if (root == null || !"success".equals(root.path("status").asText())) {
      throw new DataUnavailableException(
          "query_range failed: " + (root == null ? "empty body" : root.path("error").asText()));
    }
    JsonNode data = root.path("data");
    if (!"matrix".equals(data.path("resultType").asText())) {
      throw new DataUnavailableException(
          "query_range returned " + data.path("resultType").asText() + ", expected matrix");
    }
    List<TimeSeries> series = new ArrayList<>();
    for (JsonNode result : data.path("result")) {
      Map<String, String> labels = new TreeMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = result.path("metric").fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        labels.put(field.getKey(), field.getValue().asText());
      }
      List<Sample> samples = new ArrayList<>();
      for (JsonNode pair : result.path("values")) {
        double value = parseValue(pair.path(1).asText());
        // gaps and infinities carry no information for a forecast
        if (!Double.isFinite(value)) {
          continue;
        }
        long millis = Math.round(pair.path(0).asDouble() * 1000);
        samples.add(new Sample(Instant.ofEpochMilli(millis), value));
      }
      series.add(new TimeSeries(labels, samples));
    }
    return series;
  }

  private static double parseValue(String text) {
    switch (text) {
      case "+Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      case "NaN":
        return Double.NaN;
      default:
        try {
          return Double.parseDouble(text);
        } catch (NumberFormatException e) {
          return Double.NaN;
        }
    }
  }

  @Override
  public void write(List<TimeSeries> series) throws WriteException {
    if (series.isEmpty()) {
      return;
    }
    if (writeUrl == null) {
      throw new WriteException("no remote write url configured");
    }
    byte[] body;
    try {
      body = Snappy.compress(encode(series).toByteArray());
    } catch (IOException e) {
      throw new WriteException("failed to compress write request", e);
    }
    Instrumentation.instrument.returnVoidWithException(
        logger, infra.scope(), infra.tracer(), () -> send(body), "tsdb.write");
  }

  @VisibleForTesting
  static Remote.WriteRequest encode(List<TimeSeries> series) {
    Remote.WriteRequest.Builder request = Remote.WriteRequest.newBuilder();
    for (TimeSeries ts : series) {
      Preconditions.checkArgument(ts.getMetricName() != null, "series without metric name");
      Remote.TimeSeries.Builder builder = Remote.TimeSeries.newBuilder();
      // labels are already sorted by name
      ts.getLabels()
          .forEach(
              (name, value) ->
                  builder.addLabels(Remote.Label.newBuilder().setName(name).setValue(value)));
      for (Sample sample : ts.getSamples()) {
        builder.addSamples(
            Remote.Sample.newBuilder()
                .setValue(sample.getValue())
                .setTimestamp(sample.getTimestamp().toEpochMilli()));
      }
      request.addTimeseries(builder);
    }
    return request.build();
  }

  private void send(byte[] body) throws WriteException {
    try {
      Failsafe.with(writeRetryPolicy).run(() -> post(body));
    } catch (FailsafeException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new WriteException("remote write to " + writeUrl + " failed", cause);
    }
  }

  private void post(byte[] body) throws IOException, InterruptedException, WriteStatusException {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(URI.create(writeUrl))
            .timeout(config.getWriteTimeout())
            .header("Content-Type", "application/x-protobuf")
            .header("Content-Encoding", "snappy")
            .header("X-Prometheus-Remote-Write-Version", "0.1.0")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));
    config.getHeaders().forEach(builder::header);
    HttpResponse<String> response =
        httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    if (status / 100 != 2) {
      throw new WriteStatusException(status);
    }
  }

  private static RetryPolicy<Object> writeRetryPolicy(TsdbConfiguration config, CoreInfra infra) {
    long delayMs = Math.max(1, config.getWriteRetryBackoff().toMillis());
    long maxDelayMs = Math.max(delayMs + 1, config.getWriteRetryMaxBackoff().toMillis());
    return new RetryPolicy<>()
        .handle(IOException.class)
        .handleIf(
            failure ->
                failure instanceof WriteStatusException
                    && ((WriteStatusException) failure).isRetryable())
        .withMaxRetries(config.getWriteMaxRetries())
        .withBackoff(delayMs, maxDelayMs, ChronoUnit.MILLIS)
        .onRetry(
            e -> {
              infra.scope().counter("tsdb.write.retry").inc(1);
              logger.warn(
                  "tsdb.write.retry",
                  StructuredLogging.attempt(e.getAttemptCount()),
                  StructuredLogging.reason(String.valueOf(e.getLastFailure())));
            })
        .onRetriesExceeded(
            e -> {
              infra
                  .scope()
                  .tagged(ImmutableMap.of(StructuredLogging.REASON, "retries_exceeded"))
                  .counter("tsdb.write.abandoned")
                  .inc(1);
              logger.error(
                  "tsdb.write.retries.exceeded",
                  StructuredLogging.attempt(e.getAttemptCount()),
                  StructuredLogging.reason(String.valueOf(e.getFailure())));
            });
  }

  private static boolean isServerSide(int status) {
    return status == 429 || status / 100 == 5;
  }

  private static String epochSeconds(Instant instant) {
    return BigDecimal.valueOf(instant.toEpochMilli(), 3).toPlainString();
  }

  private static String trimSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  /** The remote write endpoint answered with a non 2xx status. */
  @VisibleForTesting
  static final class WriteStatusException extends Exception {
    private final int status;

    WriteStatusException(int status) {
      super("remote write returned status " + status);
      this.status = status;
    }

    int getStatus() {
      return status;
    }

    boolean isRetryable() {
      return isServerSide(status);
    }
  }
}
