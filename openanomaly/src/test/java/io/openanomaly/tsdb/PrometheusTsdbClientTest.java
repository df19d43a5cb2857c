package io.openanomaly.tsdb;

import io.openanomaly.config.TsdbConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.ErrorClass;
import io.openanomaly.core.errors.ErrorClassifier;
import io.openanomaly.core.errors.WriteException;
import io.openanomaly.tsdb.prompb.Remote;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

public class PrometheusTsdbClientTest {
  private static final Instant START = Instant.parse("2024-01-01T11:00:00Z");
  private static final Instant END = Instant.parse("2024-01-01T12:00:00Z");
  private static final String MATRIX =
      "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
          + "{\"metric\":{\"__name__\":\"up\",\"job\":\"a\"},"
          + "\"values\":[[1704106800,\"1\"],[1704106860.5,\"NaN\"],[1704106920,\"2.5\"]]},"
          + "{\"metric\":{\"job\":\"b\"},\"values\":[[1704106800,\"+Inf\"]]}]}}";

  private HttpClient httpClient;
  private TsdbConfiguration config;
  private PrometheusTsdbClient client;

  @BeforeEach
  public void setup() {
    httpClient = Mockito.mock(HttpClient.class);
    config = new TsdbConfiguration();
    config.setWriteMaxRetries(2);
    config.setWriteRetryBackoff(Duration.ofMillis(1));
    config.setWriteRetryMaxBackoff(Duration.ofMillis(2));
    config.setHeaders(Map.of("X-Scope-OrgID", "tenant"));
    client =
        new PrometheusTsdbClient(
            httpClient,
            "http://prometheus:9090/",
            "http://prometheus:9090/api/v1/write",
            config,
            CoreInfra.NOOP);
  }

  @SuppressWarnings("unchecked")
  private static <T> HttpResponse<T> response(int status, T body) {
    HttpResponse<T> response = Mockito.mock(HttpResponse.class);
    Mockito.when(response.statusCode()).thenReturn(status);
    Mockito.when(response.body()).thenReturn(body);
    return response;
  }

  private static List<TimeSeries> series() {
    return List.of(
        TimeSeries.named(
            "openanomaly_forecast",
            Map.of("pipeline", "cpu", "instance", "a"),
            List.of(new Sample(END, 10), new Sample(END.plusSeconds(60), 11))));
  }

  @Test
  public void testQueryRange() throws Exception {
    Mockito.doReturn(response(200, MATRIX.getBytes(StandardCharsets.UTF_8)))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());

    List<TimeSeries> result =
        client.queryRange("up{job=\"a\"}", START, END, Duration.ofMinutes(1));

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    Mockito.verify(httpClient).send(request.capture(), Mockito.any());
    String uri = request.getValue().uri().toString();
    Assertions.assertTrue(
        uri.startsWith("http://prometheus:9090/api/v1/query_range?query=up%7Bjob%3D%22a%22%7D"),
        uri);
    Assertions.assertTrue(uri.contains("&start=1704106800.000&end=1704110400.000&step="), uri);
    Assertions.assertEquals(
        "tenant", request.getValue().headers().firstValue("X-Scope-OrgID").orElse(null));

    Assertions.assertEquals(2, result.size());
    TimeSeries first = result.get(0);
    Assertions.assertEquals("up", first.getMetricName());
    Assertions.assertEquals("a", first.getLabels().get("job"));
    // NaN is dropped
    Assertions.assertEquals(
        List.of(
            new Sample(Instant.ofEpochSecond(1704106800), 1),
            new Sample(Instant.ofEpochSecond(1704106920), 2.5)),
        first.getSamples());
    // +Inf is dropped as well
    Assertions.assertTrue(result.get(1).getSamples().isEmpty());
  }

  @Test
  public void testQueryRangeServerErrorIsRedelivered() throws Exception {
    Mockito.doReturn(response(503, new byte[0]))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());
    DataUnavailableException e =
        Assertions.assertThrows(
            DataUnavailableException.class,
            () -> client.queryRange("up", START, END, Duration.ofMinutes(1)));
    Assertions.assertTrue(e.isUnreachable());
    Assertions.assertTrue(ErrorClassifier.isRetryable(e));
    Assertions.assertEquals(ErrorClass.DATA_UNAVAILABLE, e.errorClass());
  }

  @Test
  public void testQueryRangeClientErrorSkipsTick() throws Exception {
    Mockito.doReturn(response(400, new byte[0]))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());
    DataUnavailableException e =
        Assertions.assertThrows(
            DataUnavailableException.class,
            () -> client.queryRange("up", START, END, Duration.ofMinutes(1)));
    Assertions.assertFalse(e.isUnreachable());
    Assertions.assertFalse(ErrorClassifier.isRetryable(e));
  }

  @Test
  public void testQueryRangeConnectionFailure() throws Exception {
    Mockito.doThrow(new IOException("connection refused"))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());
    DataUnavailableException e =
        Assertions.assertThrows(
            DataUnavailableException.class,
            () -> client.queryRange("up", START, END, Duration.ofMinutes(1)));
    Assertions.assertTrue(ErrorClassifier.isRetryable(e));
  }

  @Test
  public void testParseMatrixRejectsErrorsAndOtherTypes() {
    Assertions.assertThrows(
        DataUnavailableException.class,
        () ->
            PrometheusTsdbClient.parseMatrix(
                "{\"status\":\"error\",\"error\":\"bad query\"}".getBytes(StandardCharsets.UTF_8)));
    Assertions.assertThrows(
        DataUnavailableException.class,
        () ->
            PrometheusTsdbClient.parseMatrix(
                "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}"
                    .getBytes(StandardCharsets.UTF_8)));
    Assertions.assertThrows(
        DataUnavailableException.class,
        () -> PrometheusTsdbClient.parseMatrix("<html>".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testEncode() {
    Remote.WriteRequest request = PrometheusTsdbClient.encode(series());
    Assertions.assertEquals(1, request.getTimeseriesCount());
    Remote.TimeSeries ts = request.getTimeseries(0);
    Assertions.assertEquals("__name__", ts.getLabels(0).getName());
    Assertions.assertEquals("openanomaly_forecast", ts.getLabels(0).getValue());
    Assertions.assertEquals("instance", ts.getLabels(1).getName());
    Assertions.assertEquals("pipeline", ts.getLabels(2).getName());
    Assertions.assertEquals(2, ts.getSamplesCount());
    Assertions.assertEquals(END.toEpochMilli(), ts.getSamples(0).getTimestamp());
    Assertions.assertEquals(11, ts.getSamples(1).getValue());

    Assertions.assertThrows(
        IllegalArgumentException.class,
        () ->
            PrometheusTsdbClient.encode(
                List.of(new TimeSeries(Map.of("job", "a"), List.of(new Sample(END, 1))))));
  }

  @Test
  public void testWrite() throws Exception {
    Mockito.doReturn(response(204, "")).when(httpClient).send(Mockito.any(), Mockito.any());

    client.write(series());

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    Mockito.verify(httpClient).send(request.capture(), Mockito.any());
    HttpRequest sent = request.getValue();
    Assertions.assertEquals("POST", sent.method());
    Assertions.assertEquals("http://prometheus:9090/api/v1/write", sent.uri().toString());
    Assertions.assertEquals("snappy", sent.headers().firstValue("Content-Encoding").get());
    Assertions.assertEquals(
        "application/x-protobuf", sent.headers().firstValue("Content-Type").get());
    Assertions.assertEquals(
        "0.1.0", sent.headers().firstValue("X-Prometheus-Remote-Write-Version").get());
    Assertions.assertEquals("tenant", sent.headers().firstValue("X-Scope-OrgID").get());
  }

  @Test
  public void testWriteRetriesServerErrors() throws Exception {
    Mockito.doReturn(response(503, ""), response(429, ""), response(200, ""))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());

    client.write(series());

    Mockito.verify(httpClient, Mockito.times(3)).send(Mockito.any(), Mockito.any());
  }

  @Test
  public void testWriteRetriesConnectionFailures() throws Exception {
    HttpResponse<String> ok = response(200, "");
    Mockito.doThrow(new IOException("reset"))
        .doReturn(ok)
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());

    client.write(series());

    Mockito.verify(httpClient, Mockito.times(2)).send(Mockito.any(), Mockito.any());
  }

  @Test
  public void testWriteGivesUpAfterMaxRetries() throws Exception {
    Mockito.doReturn(response(500, "")).when(httpClient).send(Mockito.any(), Mockito.any());

    Assertions.assertThrows(WriteException.class, () -> client.write(series()));
    // one attempt plus two retries
    Mockito.verify(httpClient, Mockito.times(3)).send(Mockito.any(), Mockito.any());
  }

  @Test
  public void testWriteDoesNotRetryClientErrors() throws Exception {
    Mockito.doReturn(response(400, "out of order sample"))
        .when(httpClient)
        .send(Mockito.any(), Mockito.any());

    Assertions.assertThrows(WriteException.class, () -> client.write(series()));
    Mockito.verify(httpClient, Mockito.times(1)).send(Mockito.any(), Mockito.any());
  }

  @Test
  public void testWriteNothing() throws Exception {
    client.write(List.of());
    Mockito.verifyNoInteractions(httpClient);
  }

  @Test
  public void testWriteWithoutWriteUrl() {
    PrometheusTsdbClient readOnly =
        new PrometheusTsdbClient(
            httpClient, "http://prometheus:9090", null, config, CoreInfra.NOOP);
    Assertions.assertEquals("http://prometheus:9090", readOnly.getReadUrl());
    Assertions.assertThrows(WriteException.class, () -> readOnly.write(series()));
  }
}
