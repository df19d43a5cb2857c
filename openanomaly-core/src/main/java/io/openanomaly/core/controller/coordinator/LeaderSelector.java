package io.openanomaly.core.controller.coordinator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.StructuredLogging;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * LeaderSelector keeps a leadership lease on a {@link DistributedLock} for this instance.
 *
 * <p>A keeper thread tries to acquire the lease while standing by and renews it while leading, at
 * an interval well below the TTL. Leadership is judged locally: on every successful acquire or
 * renew, a deadline of {@code sentAt + ttl - safetyMargin} is computed on a monotonic ticker,
 * where {@code sentAt} is taken before the request was sent. Once that deadline passes, {@link
 * #isLeader()} returns false immediately, whether or not the keeper thread or the backend has
 * noticed anything. Since the backend computes expiry from the time it applies the request, the
 * local deadline always ends before the record expires and no two instances believe they lead at
 * the same time.
 */
public class LeaderSelector implements SmartLifecycle {
  private static final Logger logger = LoggerFactory.getLogger(LeaderSelector.class);

  private final DistributedLock lock;
  private final String holderId;
  private final Duration ttl;
  private final Duration renewInterval;
  private final Duration safetyMargin;
  private final Ticker ticker;
  private final CoreInfra infra;
  private final AtomicBoolean running;

  @Nullable private volatile Tenure tenure;
  @Nullable private ScheduledExecutorService keeper;

  public LeaderSelector(
      DistributedLock lock,
      String holderId,
      Duration ttl,
      Duration renewInterval,
      Duration safetyMargin,
      CoreInfra infra) {
    this(lock, holderId, ttl, renewInterval, safetyMargin, Ticker.systemTicker(), infra);
  }

  @VisibleForTesting
  LeaderSelector(
      DistributedLock lock,
      String holderId,
      Duration ttl,
      Duration renewInterval,
      Duration safetyMargin,
      Ticker ticker,
      CoreInfra infra) {
    Preconditions.checkArgument(
        renewInterval.compareTo(ttl) < 0, "renew interval must be shorter than the lease ttl");
    Preconditions.checkArgument(
        safetyMargin.compareTo(ttl.minus(renewInterval)) < 0,
        "safety margin must leave room for at least one renewal");
    this.lock = lock;
    this.holderId = holderId;
    this.ttl = ttl;
    this.renewInterval = renewInterval;
    this.safetyMargin = safetyMargin;
    this.ticker = ticker;
    this.infra = infra;
    this.running = new AtomicBoolean(false);
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    lock.start();
    ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("openanomaly-lease-keeper-%d")
                .setDaemon(true)
                .build());
    executor.scheduleWithFixedDelay(
        this::keepLease, 0, renewInterval.toMillis(), TimeUnit.MILLISECONDS);
    keeper = executor;
    logger.info(
        "leader.selector.started",
        StructuredLogging.holderId(holderId),
        StructuredLogging.duration(ttl));
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    ScheduledExecutorService executor = keeper;
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(renewInterval.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    Tenure current = tenure;
    tenure = null;
    if (current != null) {
      try {
        lock.release(current.lease);
        logger.info(
            "leader.selector.lease.released",
            StructuredLogging.holderId(holderId),
            StructuredLogging.fencingToken(current.lease.getFencingToken()));
      } catch (Exception e) {
        // the lease will expire on its own
        logger.warn(
            "leader.selector.lease.release.failure", StructuredLogging.holderId(holderId), e);
      }
    }
    infra.scope().gauge(MetricsNames.IS_LEADER).update(0);
    lock.stop();
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  /**
   * Acquires or renews the lease once. Runs on the keeper thread.
   *
   * <p>Visible for tests that drive the lease without the keeper thread.
   */
  @VisibleForTesting
  synchronized void keepLease() {
    Tenure current = tenure;
    if (current != null && !current.hasLapsed(ticker.read())) {
      renew(current);
      return;
    }
    if (current != null) {
      stepDown(current, "lease.lapsed");
    }
    acquire();
  }

  private void acquire() {
    long sentAt = ticker.read();
    try {
      LeaseGrant grant = lock.acquire(holderId, ttl);
      if (!grant.isGranted()) {
        logger.debug(
            "leader.selector.lease.denied",
            StructuredLogging.holderId(holderId),
            StructuredLogging.reason(grant.getLease().map(Lease::toString).orElse("unknown")));
        return;
      }
      Lease lease = grant.getLease().orElseThrow();
      tenure = new Tenure(lease, deadline(sentAt));
      infra.scope().gauge(MetricsNames.IS_LEADER).update(1);
      infra.scope().counter(MetricsNames.ACQUIRED).inc(1);
      logger.info(
          "leader.selector.lease.acquired",
          StructuredLogging.holderId(holderId),
          StructuredLogging.fencingToken(lease.getFencingToken()),
          StructuredLogging.expiresAt(lease.getExpiresAt()));
    } catch (Exception e) {
      infra.scope().counter(MetricsNames.ACQUIRE_FAILED).inc(1);
      logger.warn("leader.selector.lease.acquire.failure", StructuredLogging.holderId(holderId), e);
    }
  }

  private void renew(Tenure current) {
    long sentAt = ticker.read();
    try {
      if (lock.renew(current.lease, ttl)) {
        Tenure renewed = new Tenure(current.lease, deadline(sentAt));
        // a concurrent stop() clears the tenure; don't resurrect it
        if (tenure == current) {
          tenure = renewed;
        }
        infra.scope().counter(MetricsNames.RENEWED).inc(1);
        logger.debug(
            "leader.selector.lease.renewed",
            StructuredLogging.holderId(holderId),
            StructuredLogging.fencingToken(current.lease.getFencingToken()));
      } else {
        stepDown(current, "lease.superseded");
      }
    } catch (Exception e) {
      // keep the current deadline; leadership lapses on its own if renewals keep failing
      infra.scope().counter(MetricsNames.RENEW_FAILED).inc(1);
      logger.warn("leader.selector.lease.renew.failure", StructuredLogging.holderId(holderId), e);
    }
  }

  private void stepDown(Tenure current, String reason) {
    if (tenure == current) {
      tenure = null;
    }
    infra.scope().gauge(MetricsNames.IS_LEADER).update(0);
    infra.scope().counter(MetricsNames.LOST).inc(1);
    logger.warn(
        "leader.selector.lease.lost",
        StructuredLogging.holderId(holderId),
        StructuredLogging.fencingToken(current.lease.getFencingToken()),
        StructuredLogging.reason(reason));
  }

  private long deadline(long sentAt) {
    return sentAt + ttl.toNanos() - safetyMargin.toNanos();
  }

  /**
   * Gets the boolean indicate current instance is leader or not
   *
   * <p>This is a local check against the lease deadline and never blocks on the lock backend.
   *
   * @return is leader nor not
   */
  public boolean isLeader() {
    Tenure current = tenure;
    return current != null && !current.hasLapsed(ticker.read());
  }

  /** Returns the lease while this instance leads. */
  public Optional<Lease> currentLease() {
    Tenure current = tenure;
    if (current == null || current.hasLapsed(ticker.read())) {
      return Optional.empty();
    }
    return Optional.of(current.lease);
  }

  public String getHolderId() {
    return holderId;
  }

  /** Runs the provided runnable on the leader. */
  public void runIfLeader(String runnableName, Runnable runnable) {
    if (!isLeader()) {
      String instrumentationName = "leader.selector.skip." + runnableName;
      logger.debug(instrumentationName);
      infra.scope().counter(instrumentationName).inc(1);
      return;
    }
    runnable.run();
  }

  @Scheduled(fixedDelayString = "${coordinator.metricsInterval:10000}")
  public void logAndMetrics() {
    if (isLeader()) {
      infra.scope().gauge(MetricsNames.IS_LEADER).update(1);
      logger.debug("leader.selector.leader", StructuredLogging.holderId(holderId));
    } else {
      infra.scope().gauge(MetricsNames.IS_LEADER).update(0);
      logger.debug("leader.selector.notLeader", StructuredLogging.holderId(holderId));
    }
  }

  private static final class Tenure {
    final Lease lease;
    final long deadlineNanos;

    Tenure(Lease lease, long deadlineNanos) {
      this.lease = lease;
      this.deadlineNanos = deadlineNanos;
    }

    boolean hasLapsed(long nowNanos) {
      return nowNanos - deadlineNanos >= 0;
    }
  }

  private static class MetricsNames {
    static final String IS_LEADER = "leader.selector.leader";
    static final String ACQUIRED = "leader.selector.lease.acquired";
    static final String ACQUIRE_FAILED = "leader.selector.lease.acquire.failed";
    static final String RENEWED = "leader.selector.lease.renewed";
    static final String RENEW_FAILED = "leader.selector.lease.renew.failed";
    static final String LOST = "leader.selector.lease.lost";
  }
}
