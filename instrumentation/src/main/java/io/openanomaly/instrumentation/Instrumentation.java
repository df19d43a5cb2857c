package io.openanomaly.instrumentation;

import com.uber.m3.tally.Buckets;
import com.uber.m3.tally.DurationBuckets;
import com.uber.m3.tally.Scope;
import com.uber.m3.util.Duration;
import io.opentracing.Span;
import io.opentracing.Tracer;
import java.io.Closeable;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;
import net.logstash.logback.argument.StructuredArguments;
import org.slf4j.Logger;

/**
 * Instrumentation is the {@link Instrument} implementation backed by SLF4J structured logging,
 * tally metrics and OpenTracing.
 *
 * <p>Logs:
 *
 * <ol>
 *   <li>Success: {name: "$name", "result": "success"} at debug level
 *   <li>Failure: {name: "$name", "result": "failure", "reason": "exceptionSimpleName"} at warn
 *       level, with the stacktrace only at debug level
 * </ol>
 *
 * Metrics:
 *
 * <ol>
 *   <li>Success: name:$name result:success
 *   <li>Failure: name:$name result:failure reason:exceptionSimpleName
 *   <li>Latency: name:$name.latency
 * </ol>
 */
public enum Instrumentation implements Instrument {
  instrument;

  private static final Closeable NOOP_CLOSEABLE = new NoopClosable();
  private static final Buckets BUCKETS =
      new DurationBuckets(
          new Duration[] {
            Duration.ZERO,
            Duration.ofMillis(1),
            Duration.ofMillis(2),
            Duration.ofMillis(5),
            Duration.ofMillis(10),
            Duration.ofMillis(20),
            Duration.ofMillis(50),
            Duration.ofMillis(100),
            Duration.ofMillis(200),
            Duration.ofMillis(500),
            Duration.ofMillis(1000),
            Duration.ofMillis(2000),
            Duration.ofMillis(5000),
            Duration.ofSeconds(10),
            Duration.ofSeconds(20),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofSeconds(120),
            Duration.ofSeconds(300)
          });

  @Override
  public <T, E extends Exception> T withException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      String name,
      String... tags)
      throws E {
    @Nullable Span span = startSpan(tracer, name);
    Closeable tracingScope = getTracingScope(tracer, span);
    long startNs = System.nanoTime();
    boolean isFailure = false;
    try {
      return supplier.get();
    } catch (RuntimeException | Error e) {
      isFailure = true;
      logAndMetricsFailure(logger, scope, e, System.nanoTime() - startNs, name, tags);
      throw e;
    } catch (Exception ex) {
      isFailure = true;
      // supplier can only throw E as a checked exception so the cast is safe.
      @SuppressWarnings("unchecked")
      E e = (E) ex;
      logAndMetricsFailure(logger, scope, e, System.nanoTime() - startNs, name, tags);
      throw e;
    } finally {
      if (!isFailure) {
        logAndMetricsSuccess(logger, scope, System.nanoTime() - startNs, name, tags);
      }
      safeClose(tracingScope);
      if (span != null) {
        span.finish();
      }
    }
  }

  /** Starts a child span of the active span, or returns null when there is nothing to attach to. */
  @Nullable
  private static Span startSpan(@Nullable Tracer tracer, String name) {
    if (tracer == null) {
      return null;
    }
    Span parent = tracer.activeSpan();
    if (parent == null) {
      return null;
    }
    return tracer.buildSpan(name).asChildOf(parent).start();
  }

  private static Closeable getTracingScope(@Nullable Tracer tracer, @Nullable Span span) {
    if (tracer == null || span == null) {
      return NOOP_CLOSEABLE;
    }
    return tracer.scopeManager().activate(span);
  }

  private static void logAndMetricsFailure(
      Logger logger,
      Scope scope,
      Throwable throwable,
      long durationNs,
      String name,
      String... tags) {
    String reason = reason(throwable);
    logger.warn(name, loggingTags(reason, tags));
    if (logger.isDebugEnabled()) {
      logger.debug(name, StructuredArguments.keyValue(Tags.Key.reason, reason), throwable);
    }
    Map<String, String> metricsTags = metricsTags(Tags.Value.failure, tags);
    metricsTags.put(Tags.Key.reason, reason);
    reportCountAndLatency(scope.tagged(metricsTags), name, durationNs);
  }

  private static void logAndMetricsSuccess(
      Logger logger, Scope scope, long durationNs, String name, String... tags) {
    if (logger.isDebugEnabled()) {
      logger.debug(name, loggingTags(null, tags));
    }
    reportCountAndLatency(scope.tagged(metricsTags(Tags.Value.success, tags)), name, durationNs);
  }

  private static void reportCountAndLatency(Scope taggedScope, String name, long durationNs) {
    taggedScope.counter(name).inc(1);
    taggedScope.histogram(name + ".latency", BUCKETS).recordDuration(Duration.ofNanos(durationNs));
  }

  /**
   * Returns the simple class name of the root failure, looking through the wrappers added by
   * futures.
   */
  static String reason(Throwable throwable) {
    Throwable t = throwable;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t.getClass().getSimpleName();
  }

  private static Map<String, String> metricsTags(String resultValue, String... tags) {
    Map<String, String> map = new HashMap<>();
    Tags.copyTags(map, tags);
    map.put(Tags.Key.result, resultValue);
    return map;
  }

  private static Object[] loggingTags(@Nullable String reason, String... tags) {
    int pairs = tags.length / 2;
    Object[] keyValues = new Object[pairs + (reason == null ? 1 : 2)];
    for (int i = 0; i < pairs; i++) {
      keyValues[i] = StructuredArguments.keyValue(tags[2 * i], tags[2 * i + 1]);
    }
    keyValues[pairs] =
        StructuredArguments.keyValue(
            Tags.Key.result, reason == null ? Tags.Value.success : Tags.Value.failure);
    if (reason != null) {
      keyValues[pairs + 1] = StructuredArguments.keyValue(Tags.Key.reason, reason);
    }
    return keyValues;
  }

  static void safeClose(Closeable closeable) {
    try {
      closeable.close();
    } catch (IOException e) {
      // tracer scopes never throw on close
    }
  }
}
