package io.openanomaly.instrumentation;

import java.io.Closeable;
import javax.annotation.concurrent.Immutable;

/** Closeable that does nothing, used when there is no active span to deactivate. */
@Immutable
final class NoopClosable implements Closeable {
  @Override
  public void close() {}
}
