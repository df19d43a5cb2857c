package io.openanomaly.core.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * JsonSerializationFactory serializes objects to and from json bytes.
 *
 * @implNote We use JSON as the data format because it is easily consumed by human consumption.
 *     Unknown fields are ignored on read so that newer writers stay readable by older readers.
 */
public final class JsonSerializationFactory<T> {
  private final ObjectMapper objectMapper;
  private final Class<T> type;

  /**
   * Create a new JsonSerializationFactory for type T.
   *
   * @param type of the object that should be serialized and deserialized.
   */
  public JsonSerializationFactory(Class<T> type) {
    this(type, JsonMappers.lenient());
  }

  public JsonSerializationFactory(Class<T> type, ObjectMapper objectMapper) {
    this.type = type;
    this.objectMapper = objectMapper;
  }

  /**
   * Serialize object as json bytes.
   *
   * @param t is the object to serialize.
   * @return bytes[] of serialized object
   */
  public byte[] serialize(T t) {
    try {
      return objectMapper.writeValueAsBytes(t);
    } catch (IOException e) {
      throw new IllegalArgumentException("failed to serialize " + type.getSimpleName(), e);
    }
  }

  /**
   * Deserialize object from json bytes.
   *
   * @param bytes to deserialize.
   * @return Object that was deserialized from the bytes.
   * @throws IOException on deserialization error.
   */
  public T deserialize(byte[] bytes) throws IOException {
    return objectMapper.readValue(bytes, type);
  }

  public String serializeToString(T t) {
    try {
      return objectMapper.writeValueAsString(t);
    } catch (IOException e) {
      throw new IllegalArgumentException("failed to serialize " + type.getSimpleName(), e);
    }
  }

  public T deserialize(String json) throws IOException {
    return objectMapper.readValue(json, type);
  }
}
