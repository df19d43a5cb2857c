package io.openanomaly.core.common;

import org.springframework.context.Lifecycle;

/**
 * Spring {@link Lifecycle} for backends that have nothing to open or close, such as the in-memory
 * queue, lock, ledger and registry. Backends holding connections override the methods they need.
 */
public interface RunningLifecycle extends Lifecycle {

  /** Does nothing by default. */
  @Override
  default void start() {}

  /** Always running by default. */
  @Override
  default boolean isRunning() {
    return true;
  }

  /** Does nothing by default. */
  @Override
  default void stop() {}
}
