package io.openanomaly.model;

import io.openanomaly.core.errors.SerializationException;
import io.openanomaly.core.pipeline.SerializationFormat;
import io.openanomaly.tsdb.Sample;
import java.util.List;
import java.util.Map;

/** Wire format of the remote inference contract. */
interface RemoteCodec {

  String contentType();

  byte[] encodePredict(List<Sample> context, ForecastRequest request)
      throws SerializationException;

  /**
   * Decodes a forecast response. Paths longer than the requested horizon are truncated, shorter
   * ones are rejected.
   */
  Forecast decodePredict(byte[] body, ForecastRequest request) throws SerializationException;

  byte[] encodeTrain(List<Sample> history, Map<String, Object> parameters)
      throws SerializationException;

  String decodeTrain(byte[] body) throws SerializationException;

  static RemoteCodec of(SerializationFormat format) {
    switch (format) {
      case ARROW:
        return new ArrowRemoteCodec();
      case JSON:
      default:
        return new JsonRemoteCodec();
    }
  }

  static List<Double> truncate(String path, List<Double> values, int length)
      throws SerializationException {
    if (values.size() < length) {
      throw new SerializationException(
          path + " has " + values.size() + " values, expected " + length);
    }
    return values.subList(0, length);
  }
}
