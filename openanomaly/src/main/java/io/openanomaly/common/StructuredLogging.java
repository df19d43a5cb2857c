package io.openanomaly.common;

import java.time.Instant;
import net.logstash.logback.argument.StructuredArgument;
import net.logstash.logback.argument.StructuredArguments;

/**
 * StructuredLogging utility for generating logback KeyValue pairs for structured logging.
 *
 * <p>We extend StructuredLogging from the core for consistency of logging key-value pairs.
 */
public class StructuredLogging extends io.openanomaly.core.common.StructuredLogging {

  public static final String STATUS_CODE = "status_code";
  public static final String KAFKA_TOPIC = "kafka_topic";
  public static final String EVENT_TYPE = "event_type";
  public static final String MODEL_ID = "model_id";
  public static final String BACKEND = "backend";

  private static final String POINTS = "points";
  private static final String SCORE = "score";
  private static final String IS_ANOMALY = "is_anomaly";
  private static final String TIMESTAMP = "timestamp";

  public static StructuredArgument statusCode(int statusCode) {
    return StructuredArguments.keyValue(STATUS_CODE, statusCode);
  }

  public static StructuredArgument kafkaTopic(String topic) {
    return StructuredArguments.keyValue(KAFKA_TOPIC, topic);
  }

  public static StructuredArgument eventType(String eventType) {
    return StructuredArguments.keyValue(EVENT_TYPE, eventType);
  }

  public static StructuredArgument modelId(String modelId) {
    return StructuredArguments.keyValue(MODEL_ID, modelId);
  }

  public static StructuredArgument backend(String backend) {
    return StructuredArguments.keyValue(BACKEND, backend);
  }

  public static StructuredArgument points(int points) {
    return StructuredArguments.keyValue(POINTS, points);
  }

  public static StructuredArgument score(double score) {
    return StructuredArguments.keyValue(SCORE, score);
  }

  public static StructuredArgument isAnomaly(boolean isAnomaly) {
    return StructuredArguments.keyValue(IS_ANOMALY, isAnomaly);
  }

  public static StructuredArgument timestamp(Instant timestamp) {
    return StructuredArguments.keyValue(TIMESTAMP, timestamp.toString());
  }
}
