package io.openanomaly.core.common;

import com.google.common.base.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

public final class TestUtils {

  private TestUtils() {}

  public static class TestTicker extends Ticker {
    AtomicLong currentNano = new AtomicLong();

    @Override
    public long read() {
      return currentNano.get();
    }

    public void add(Duration d) {
      currentNano.addAndGet(d.toNanos());
    }
  }

  /** A wall clock that only moves when told to. */
  public static class TestClock extends Clock {
    private final AtomicReference<Instant> now;

    public TestClock(Instant start) {
      this.now = new AtomicReference<>(start);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now.get();
    }

    public void add(Duration d) {
      now.updateAndGet(i -> i.plus(d));
    }

    public void set(Instant instant) {
      now.set(instant);
    }
  }
}
