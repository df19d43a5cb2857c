package io.openanomaly.instrumentation;

import com.uber.m3.tally.Scope;
import io.opentracing.Tracer;
import javax.annotation.Nullable;
import org.slf4j.Logger;

/**
 * Instrument decorates a call with logs, metrics and tracing.
 *
 * <p>Every instrumented call emits:
 *
 * <ol>
 *   <li>a debug log on success and a warn log naming the failure reason, keyed by the call name
 *   <li>a counter and a latency histogram tagged with {@code result} and, on failure, {@code
 *       reason}
 *   <li>a child span when the tracer has an active span
 * </ol>
 *
 * Additional tags are passed as "key, value, key, value, ..." varargs.
 */
public interface Instrument {

  /**
   * Executes the supplier and rethrows any checked exception after instrumenting it.
   *
   * <pre>
   *   Lease lease = Instrumentation.instrument.withException(
   *       logger, scope, tracer, () -> lock.acquire(holder, ttl), "lock.acquire",
   *       "holder", holder);
   * </pre>
   *
   * @param logger to write logs to.
   * @param scope to emit metrics on.
   * @param tracer for distributed tracing, may be null.
   * @param supplier to execute.
   * @param name of the call.
   * @param tags to add to logs and metrics.
   * @param <T> the type returned by the supplier.
   * @param <E> the checked exception thrown by the supplier.
   * @return the value returned by the supplier.
   * @throws E when thrown by the supplier.
   */
  <T, E extends Exception> T withException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      String name,
      String... tags)
      throws E;

  /**
   * Executes the supplier, wrapping checked exceptions into {@link RuntimeException}.
   *
   * @see #withException(Logger, Scope, Tracer, ThrowingSupplier, String, String...)
   */
  default <T, E extends Exception> T withRuntimeException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      String name,
      String... tags) {
    try {
      return withException(logger, scope, tracer, supplier, name, tags);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  /** Void variant of {@link #withException}. */
  default <E extends Exception> void returnVoidWithException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingRunnable<E> runnable,
      String name,
      String... tags)
      throws E {
    withException(
        logger,
        scope,
        tracer,
        () -> {
          runnable.run();
          return null;
        },
        name,
        tags);
  }
}
