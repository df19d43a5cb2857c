package io.openanomaly.instrumentation;

/**
 * ThrowingRunnable is an alternative to the standard Java {@code Runnable} that throws a checked
 * exception.
 *
 * @param <E> checked exception that may be thrown.
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {
  void run() throws E;
}
