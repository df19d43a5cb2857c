package io.openanomaly.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openanomaly.core.common.JsonMappers;
import io.openanomaly.core.errors.SerializationException;
import io.openanomaly.tsdb.Sample;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Arrow IPC stream bodies.
 *
 * <p>Predict sends one {@code context} column and carries {@code prediction_length}, {@code
 * quantiles}, {@code parameters} and {@code model_id} as schema metadata; the response has a
 * {@code mean} column and one {@code q_<level>} column per quantile. Train sends {@code
 * timestamp} (epoch millis) and {@code value} columns and expects a {@code model_id} column back.
 */
final class ArrowRemoteCodec implements RemoteCodec {
  static final String CONTENT_TYPE = "application/vnd.apache.arrow.stream";
  static final String QUANTILE_PREFIX = "q_";
  private static final ObjectMapper MAPPER = JsonMappers.lenient();
  private static final ArrowType FLOAT8 =
      new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);

  @Override
  public String contentType() {
    return CONTENT_TYPE;
  }

  @Override
  public byte[] encodePredict(List<Sample> context, ForecastRequest request)
      throws SerializationException {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("prediction_length", Integer.toString(request.getPredictionLength()));
    metadata.put("quantiles", json(request.getQuantiles()));
    metadata.put("parameters", json(request.getParameters()));
    if (request.getModelId() != null) {
      metadata.put("model_id", request.getModelId());
    }
    Schema schema = new Schema(List.of(Field.nullable("context", FLOAT8)), metadata);
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator)) {
      Float8Vector values = (Float8Vector) root.getVector("context");
      values.allocateNew(context.size());
      for (int i = 0; i < context.size(); i++) {
        values.set(i, context.get(i).getValue());
      }
      root.setRowCount(context.size());
      return write(root);
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("failed to encode arrow request", e);
    }
  }

  @Override
  public Forecast decodePredict(byte[] body, ForecastRequest request)
      throws SerializationException {
    List<Double> mean = new ArrayList<>();
    Map<Double, List<Double>> quantiles = new LinkedHashMap<>();
    try (BufferAllocator allocator = new RootAllocator();
        ArrowStreamReader reader =
            new ArrowStreamReader(new ByteArrayInputStream(body), allocator)) {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      if (root.getVector("mean") == null) {
        throw new SerializationException("arrow response has no mean column");
      }
      while (reader.loadNextBatch()) {
        for (FieldVector vector : root.getFieldVectors()) {
          String name = vector.getName();
          if (name.equals("mean")) {
            mean.addAll(doubles(vector, root.getRowCount()));
          } else if (name.startsWith(QUANTILE_PREFIX)) {
            double q = Quantiles.parse(name.substring(QUANTILE_PREFIX.length()));
            quantiles
                .computeIfAbsent(q, k -> new ArrayList<>())
                .addAll(doubles(vector, root.getRowCount()));
          }
        }
      }
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("undecodable arrow response", e);
    }
    if (mean.isEmpty()) {
      throw new SerializationException("arrow response has no forecast");
    }
    int length = request.getPredictionLength();
    Map<Double, List<Double>> truncated = new LinkedHashMap<>();
    for (Map.Entry<Double, List<Double>> entry : quantiles.entrySet()) {
      String path = "quantile " + Quantiles.format(entry.getKey());
      truncated.put(entry.getKey(), RemoteCodec.truncate(path, entry.getValue(), length));
    }
    return new Forecast(RemoteCodec.truncate("mean", mean, length), truncated);
  }

  @Override
  public byte[] encodeTrain(List<Sample> history, Map<String, Object> parameters)
      throws SerializationException {
    Schema schema =
        new Schema(
            List.of(
                Field.nullable("timestamp", new ArrowType.Int(64, true)),
                Field.nullable("value", FLOAT8)),
            Map.of("parameters", json(parameters)));
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator)) {
      BigIntVector timestamps = (BigIntVector) root.getVector("timestamp");
      Float8Vector values = (Float8Vector) root.getVector("value");
      timestamps.allocateNew(history.size());
      values.allocateNew(history.size());
      for (int i = 0; i < history.size(); i++) {
        timestamps.set(i, history.get(i).getTimestamp().toEpochMilli());
        values.set(i, history.get(i).getValue());
      }
      root.setRowCount(history.size());
      return write(root);
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("failed to encode arrow request", e);
    }
  }

  @Override
  public String decodeTrain(byte[] body) throws SerializationException {
    try (BufferAllocator allocator = new RootAllocator();
        ArrowStreamReader reader =
            new ArrowStreamReader(new ByteArrayInputStream(body), allocator)) {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      while (reader.loadNextBatch()) {
        FieldVector modelId = root.getVector("model_id");
        if (modelId != null && root.getRowCount() > 0 && !modelId.isNull(0)) {
          return modelId.getObject(0).toString();
        }
      }
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("undecodable arrow response", e);
    }
    throw new SerializationException("arrow response has no model_id");
  }

  private static List<Double> doubles(FieldVector vector, int rows) {
    List<Double> values = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      Object value = vector.getObject(i);
      if (!(value instanceof Number)) {
        throw new IllegalStateException(vector.getName() + "[" + i + "] is " + value);
      }
      values.add(((Number) value).doubleValue());
    }
    return values;
  }

  private static byte[] write(VectorSchemaRoot root) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, Channels.newChannel(out))) {
      writer.start();
      writer.writeBatch();
      writer.end();
    }
    return out.toByteArray();
  }

  private static String json(Object value) throws SerializationException {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("failed to encode metadata", e);
    }
  }
}
