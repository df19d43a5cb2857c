package io.openanomaly.model;

import com.google.common.annotations.VisibleForTesting;
import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.InferenceException;
import io.openanomaly.core.errors.TaskException;
import io.openanomaly.core.pipeline.SerializationFormat;
import io.openanomaly.instrumentation.Instrumentation;
import io.openanomaly.tsdb.Sample;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RemoteModelEngine calls an inference server over HTTP.
 *
 * <p>Responses that cannot be decoded fail with a serialization error and are not retried;
 * connection failures, timeouts and non 2xx statuses fail with an inference error. There is no
 * retry inside the engine.
 */
public final class RemoteModelEngine implements ModelEngine {
  private static final Logger logger = LoggerFactory.getLogger(RemoteModelEngine.class);
  @VisibleForTesting static final String PREDICT_PATH = "/predict";
  @VisibleForTesting static final String TRAIN_PATH = "/train";

  private final HttpClient httpClient;
  private final URI predictUri;
  private final URI trainUri;
  private final Duration timeout;
  private final RemoteCodec codec;
  private final Map<String, String> headers;
  private final CoreInfra infra;

  public RemoteModelEngine(
      HttpClient httpClient,
      String endpoint,
      String trainingEndpoint,
      SerializationFormat format,
      Duration timeout,
      Map<String, String> headers,
      CoreInfra infra) {
    this.httpClient = httpClient;
    this.predictUri = URI.create(stripSlash(endpoint) + PREDICT_PATH);
    this.trainUri = URI.create(stripSlash(trainingEndpoint));
    this.timeout = timeout;
    this.codec = RemoteCodec.of(format);
    this.headers = Map.copyOf(headers);
    this.infra = infra;
  }

  /** Default training endpoint of a server at the base url. */
  public static String defaultTrainingEndpoint(String endpoint) {
    return stripSlash(endpoint) + TRAIN_PATH;
  }

  @Override
  public Forecast predict(List<Sample> context, Duration step, ForecastRequest request)
      throws TaskException {
    byte[] body = codec.encodePredict(context, request);
    byte[] response =
        Instrumentation.instrument.withException(
            logger, infra.scope(), infra.tracer(), () -> post(predictUri, body), "model.predict");
    return codec.decodePredict(response, request);
  }

  @Override
  public String train(
      List<Sample> history, Duration step, Duration window, Map<String, Object> parameters)
      throws TaskException {
    byte[] body = codec.encodeTrain(history, parameters);
    byte[] response =
        Instrumentation.instrument.withException(
            logger, infra.scope(), infra.tracer(), () -> post(trainUri, body), "model.train");
    return codec.decodeTrain(response);
  }

  @Override
  public boolean isTrainable() {
    return true;
  }

  private byte[] post(URI uri, byte[] body) throws InferenceException {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Content-Type", codec.contentType())
            .header("Accept", codec.contentType())
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));
    headers.forEach(builder::header);
    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    } catch (HttpTimeoutException e) {
      throw new InferenceException(uri + " timed out after " + timeout, e);
    } catch (IOException e) {
      throw new InferenceException("request to " + uri + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InferenceException("request to " + uri + " interrupted", e);
    }
    if (response.statusCode() / 100 != 2) {
      logger.warn(
          "model.remote.status",
          StructuredLogging.uri(uri.toString()),
          StructuredLogging.statusCode(response.statusCode()));
      throw new InferenceException(uri + " returned status " + response.statusCode());
    }
    return response.body();
  }

  private static String stripSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
