package io.openanomaly.core.controller.coordinator;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.TestUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Mutual exclusion and failover of the lease under injected network delay and partitions. */
public class LeaseSafetyTest {
  private static final Duration TTL = Duration.ofMillis(300);
  private static final Duration RENEW = Duration.ofMillis(100);
  private static final Duration MARGIN = Duration.ofMillis(30);

  private TestUtils.TestClock clock;
  private TestUtils.TestTicker ticker;
  private LocalDistributedLock backend;

  @BeforeEach
  public void setup() {
    clock = new TestUtils.TestClock(Instant.parse("2024-01-01T12:00:00Z"));
    ticker = new TestUtils.TestTicker();
    backend = new LocalDistributedLock(clock);
  }

  private void advance(Duration duration) {
    clock.add(duration);
    ticker.add(duration);
  }

  /** Every instance that believes it leads must hold the current, unexpired record. */
  private void assertSafe(List<LeaderSelector> selectors) throws Exception {
    int leaders = 0;
    for (LeaderSelector selector : selectors) {
      Optional<Lease> lease = selector.currentLease();
      if (lease.isEmpty()) {
        continue;
      }
      leaders++;
      Lease record = backend.current().orElseThrow();
      Assertions.assertTrue(record.sameTenure(lease.get()), "stale leader " + lease.get());
      Assertions.assertFalse(record.isExpired(clock.instant()), "leader past record expiry");
    }
    Assertions.assertTrue(leaders <= 1, "more than one leader");
  }

  @Test
  public void testMutualExclusionUnderInjectedDelay() throws Exception {
    Random random = new Random(42);
    List<FlakyLock> locks = new ArrayList<>();
    List<LeaderSelector> selectors = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      FlakyLock lock = new FlakyLock(backend, random);
      locks.add(lock);
      selectors.add(
          new LeaderSelector(lock, "holder-" + i, TTL, RENEW, MARGIN, ticker, CoreInfra.NOOP));
    }
    long previousToken = 0;
    for (int step = 0; step < 5000; step++) {
      int i = random.nextInt(selectors.size());
      FlakyLock lock = locks.get(i);
      // occasionally partition or heal an instance
      if (random.nextInt(50) == 0) {
        lock.partitioned = !lock.partitioned;
      }
      selectors.get(i).keepLease();
      assertSafe(selectors);
      advance(Duration.ofMillis(random.nextInt(40)));
      assertSafe(selectors);
      Optional<Lease> record = backend.current();
      if (record.isPresent()) {
        Assertions.assertTrue(record.get().getFencingToken() >= previousToken);
        previousToken = record.get().getFencingToken();
      }
    }
    Assertions.assertTrue(previousToken > 1, "leadership never changed hands");
  }

  @Test
  public void testFailoverWithinTtlPlusRenewInterval() throws Exception {
    LeaderSelector a =
        new LeaderSelector(backend, "a", TTL, RENEW, MARGIN, ticker, CoreInfra.NOOP);
    LeaderSelector b =
        new LeaderSelector(backend, "b", TTL, RENEW, MARGIN, ticker, CoreInfra.NOOP);
    a.keepLease();
    b.keepLease();
    advance(Duration.ofMillis(40));
    for (int i = 0; i < 3; i++) {
      advance(RENEW);
      a.keepLease();
      b.keepLease();
    }
    Assertions.assertTrue(a.isLeader());
    long crashedToken = a.currentLease().get().getFencingToken();
    // a crashes right after its last renewal; b keeps its renewal cadence
    Duration sinceCrash = Duration.ZERO;
    while (!b.isLeader()) {
      advance(RENEW);
      sinceCrash = sinceCrash.plus(RENEW);
      b.keepLease();
      Assertions.assertTrue(sinceCrash.compareTo(TTL.plus(RENEW)) <= 0, "failover too slow");
    }
    Assertions.assertTrue(b.currentLease().get().getFencingToken() > crashedToken);
  }

  @Test
  @Timeout(value = 20, unit = TimeUnit.SECONDS)
  public void testFailoverWithRealThreads() throws Exception {
    Set<String> partitioned = ConcurrentHashMap.newKeySet();
    LocalDistributedLock shared = new LocalDistributedLock(java.time.Clock.systemUTC());
    LeaderSelector a =
        new LeaderSelector(
            partitionable(shared, "a", partitioned), "a", TTL, RENEW, MARGIN, CoreInfra.NOOP);
    LeaderSelector b =
        new LeaderSelector(
            partitionable(shared, "b", partitioned), "b", TTL, RENEW, MARGIN, CoreInfra.NOOP);
    a.start();
    Awaitility.await().atMost(5, TimeUnit.SECONDS).until(a::isLeader);
    b.start();
    try {
      long token = a.currentLease().get().getFencingToken();
      partitioned.add("a");
      long partitionedAt = System.nanoTime();
      Awaitility.await()
          .atMost(5, TimeUnit.SECONDS)
          .pollInterval(5, TimeUnit.MILLISECONDS)
          .until(b::isLeader);
      Duration failover = Duration.ofNanos(System.nanoTime() - partitionedAt);
      Assertions.assertFalse(a.isLeader());
      Assertions.assertTrue(b.currentLease().get().getFencingToken() > token);
      // generous bound for scheduling jitter on a loaded machine
      Assertions.assertTrue(
          failover.compareTo(TTL.plus(RENEW).plusSeconds(2)) < 0, "failover took " + failover);
    } finally {
      partitioned.clear();
      a.stop();
      b.stop();
    }
  }

  private static DistributedLock partitionable(
      DistributedLock delegate, String holderId, Set<String> partitioned) {
    return new DistributedLock() {
      private void check() {
        if (partitioned.contains(holderId)) {
          throw new IllegalStateException("partitioned");
        }
      }

      @Override
      public LeaseGrant acquire(String holder, Duration ttl) throws Exception {
        check();
        return delegate.acquire(holder, ttl);
      }

      @Override
      public boolean renew(Lease lease, Duration ttl) throws Exception {
        check();
        return delegate.renew(lease, ttl);
      }

      @Override
      public void release(Lease lease) throws Exception {
        check();
        delegate.release(lease);
      }

      @Override
      public Optional<Lease> current() throws Exception {
        check();
        return delegate.current();
      }
    };
  }

  /**
   * Delays requests on the way to the backend and responses on the way back by moving the shared
   * time forward, and drops calls while partitioned, possibly after the backend applied them.
   */
  private class FlakyLock implements DistributedLock {
    private final DistributedLock delegate;
    private final Random random;
    boolean partitioned;

    FlakyLock(DistributedLock delegate, Random random) {
      this.delegate = delegate;
      this.random = random;
    }

    private void requestDelay() {
      advance(Duration.ofMillis(random.nextInt(60)));
      if (partitioned && random.nextBoolean()) {
        throw new IllegalStateException("request lost");
      }
    }

    private void responseDelay() {
      advance(Duration.ofMillis(random.nextInt(60)));
      if (partitioned) {
        throw new IllegalStateException("response lost");
      }
    }

    @Override
    public LeaseGrant acquire(String holderId, Duration ttl) throws Exception {
      requestDelay();
      LeaseGrant grant = delegate.acquire(holderId, ttl);
      responseDelay();
      return grant;
    }

    @Override
    public boolean renew(Lease lease, Duration ttl) throws Exception {
      requestDelay();
      boolean renewed = delegate.renew(lease, ttl);
      responseDelay();
      return renewed;
    }

    @Override
    public void release(Lease lease) throws Exception {
      requestDelay();
      delegate.release(lease);
      responseDelay();
    }

    @Override
    public Optional<Lease> current() throws Exception {
      return delegate.current();
    }
  }
}
