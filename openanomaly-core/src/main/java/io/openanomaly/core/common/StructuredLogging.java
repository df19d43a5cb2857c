package io.openanomaly.core.common;

import java.time.Duration;
import java.time.Instant;
import net.logstash.logback.argument.StructuredArgument;
import net.logstash.logback.argument.StructuredArguments;

/**
 * StructuredLogging utility for generating logback StructuredArgument pairs for structured logging.
 *
 * <p>We use static methods so that we can use the Java type system to ensure that the key-value
 * pairs have consistent type and therefore will not collide during log ingestion.
 */
public class StructuredLogging extends StructuredFields {

  public static final String REASON = "reason";
  public static final String ACTION = "action";

  private static final String ZK_PATH = "zk_path";
  private static final String COUNT = "count";
  private static final String ATTEMPT = "attempt";
  private static final String DURATION_MS = "duration_ms";
  private static final String EXPIRES_AT = "expires_at";
  private static final String PATH = "path";
  private static final String SERIES = "series";
  private static final String EXIT_CODE = "exit_code";

  public static StructuredArgument pipeline(String pipeline) {
    return StructuredArguments.keyValue(PIPELINE, pipeline);
  }

  public static StructuredArgument jobKind(Object kind) {
    return StructuredArguments.keyValue(JOB_KIND, String.valueOf(kind));
  }

  public static StructuredArgument jobId(String jobId) {
    return StructuredArguments.keyValue(JOB_ID, jobId);
  }

  public static StructuredArgument dueTime(Instant dueTime) {
    return StructuredArguments.keyValue(DUE_TIME, dueTime.toString());
  }

  public static StructuredArgument idempotencyKey(String key) {
    return StructuredArguments.keyValue(IDEMPOTENCY_KEY, key);
  }

  public static StructuredArgument fencingToken(long token) {
    return StructuredArguments.keyValue(FENCING_TOKEN, token);
  }

  public static StructuredArgument holderId(String holderId) {
    return StructuredArguments.keyValue(HOLDER_ID, holderId);
  }

  public static StructuredArgument errorClass(Object errorClass) {
    return StructuredArguments.keyValue(ERROR_CLASS, String.valueOf(errorClass));
  }

  public static StructuredArgument technique(Object technique) {
    return StructuredArguments.keyValue(TECHNIQUE, String.valueOf(technique));
  }

  public static StructuredArgument modelType(Object modelType) {
    return StructuredArguments.keyValue(MODEL_TYPE, String.valueOf(modelType));
  }

  public static StructuredArgument state(Object state) {
    return StructuredArguments.keyValue(STATE, String.valueOf(state));
  }

  public static StructuredArgument uri(String uri) {
    return StructuredArguments.keyValue(URI, uri);
  }

  public static StructuredArgument reason(String reason) {
    return StructuredArguments.keyValue(REASON, reason);
  }

  public static StructuredArgument action(String action) {
    return StructuredArguments.keyValue(ACTION, action);
  }

  public static StructuredArgument zkPath(String zkPath) {
    return StructuredArguments.keyValue(ZK_PATH, zkPath);
  }

  public static StructuredArgument path(String path) {
    return StructuredArguments.keyValue(PATH, path);
  }

  public static StructuredArgument count(int count) {
    return StructuredArguments.keyValue(COUNT, count);
  }

  public static StructuredArgument series(int series) {
    return StructuredArguments.keyValue(SERIES, series);
  }

  public static StructuredArgument attempt(int attempt) {
    return StructuredArguments.keyValue(ATTEMPT, attempt);
  }

  public static StructuredArgument duration(Duration duration) {
    return StructuredArguments.keyValue(DURATION_MS, duration.toMillis());
  }

  public static StructuredArgument expiresAt(Instant expiresAt) {
    return StructuredArguments.keyValue(EXPIRES_AT, expiresAt.toString());
  }

  public static StructuredArgument exitCode(int exitCode) {
    return StructuredArguments.keyValue(EXIT_CODE, exitCode);
  }
}
