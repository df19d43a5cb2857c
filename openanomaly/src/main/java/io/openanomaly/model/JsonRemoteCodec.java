package io.openanomaly.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.openanomaly.core.common.JsonMappers;
import io.openanomaly.core.errors.SerializationException;
import io.openanomaly.tsdb.Sample;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON bodies.
 *
 * <pre>
 * predict: {context, prediction_length, quantiles, parameters, model_id?}
 *       -> {forecast | mean, quantiles: {"0.1": [...], ...}}
 * train:   {data: [{timestamp, value}], parameters} -> {model_id}
 * </pre>
 */
final class JsonRemoteCodec implements RemoteCodec {
  private static final ObjectMapper MAPPER = JsonMappers.lenient();

  @Override
  public String contentType() {
    return "application/json";
  }

  @Override
  public byte[] encodePredict(List<Sample> context, ForecastRequest request)
      throws SerializationException {
    ObjectNode body = MAPPER.createObjectNode();
    ArrayNode values = body.putArray("context");
    context.forEach(s -> values.add(s.getValue()));
    body.put("prediction_length", request.getPredictionLength());
    ArrayNode quantiles = body.putArray("quantiles");
    request.getQuantiles().forEach(quantiles::add);
    body.set("parameters", MAPPER.valueToTree(request.getParameters()));
    if (request.getModelId() != null) {
      body.put("model_id", request.getModelId());
    }
    return write(body);
  }

  @Override
  public Forecast decodePredict(byte[] body, ForecastRequest request)
      throws SerializationException {
    JsonNode root = read(body);
    JsonNode mean = root.has("mean") ? root.get("mean") : root.path("forecast");
    if (!mean.isArray() || mean.isEmpty()) {
      throw new SerializationException("response has no forecast");
    }
    int length = request.getPredictionLength();
    List<Double> meanPath = RemoteCodec.truncate("forecast", doubles("forecast", mean), length);
    Map<Double, List<Double>> quantiles = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.path("quantiles").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      double q;
      try {
        q = Quantiles.parse(field.getKey());
      } catch (NumberFormatException e) {
        throw new SerializationException("bad quantile key " + field.getKey(), e);
      }
      String path = "quantile " + field.getKey();
      quantiles.put(q, RemoteCodec.truncate(path, doubles(path, field.getValue()), length));
    }
    return new Forecast(meanPath, quantiles);
  }

  @Override
  public byte[] encodeTrain(List<Sample> history, Map<String, Object> parameters)
      throws SerializationException {
    ObjectNode body = MAPPER.createObjectNode();
    ArrayNode data = body.putArray("data");
    for (Sample sample : history) {
      data.addObject()
          .put("timestamp", sample.getTimestamp().toString())
          .put("value", sample.getValue());
    }
    body.set("parameters", MAPPER.valueToTree(parameters));
    return write(body);
  }

  @Override
  public String decodeTrain(byte[] body) throws SerializationException {
    JsonNode modelId = read(body).path("model_id");
    if (!modelId.isTextual() || modelId.asText().isBlank()) {
      throw new SerializationException("response has no model_id");
    }
    return modelId.asText();
  }

  private static List<Double> doubles(String path, JsonNode array)
      throws SerializationException {
    if (!array.isArray()) {
      throw new SerializationException(path + " is not an array");
    }
    List<Double> values = new ArrayList<>(array.size());
    for (JsonNode value : array) {
      if (!value.isNumber()) {
        throw new SerializationException(path + " contains " + value);
      }
      values.add(value.doubleValue());
    }
    return values;
  }

  private static byte[] write(JsonNode body) throws SerializationException {
    try {
      return MAPPER.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new SerializationException("failed to encode request", e);
    }
  }

  private static JsonNode read(byte[] body) throws SerializationException {
    try {
      JsonNode root = MAPPER.readTree(body);
      if (root == null || !root.isObject()) {
        throw new SerializationException("response is not a json object");
      }
      return root;
    } catch (IOException e) {
      throw new SerializationException("response is not json", e);
    }
  }
}
