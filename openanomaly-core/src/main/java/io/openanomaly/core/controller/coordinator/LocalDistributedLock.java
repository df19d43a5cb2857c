package io.openanomaly.core.controller.coordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/** LocalDistributedLock keeps the lease record in memory. */
@ThreadSafe
public final class LocalDistributedLock implements DistributedLock {
  private final Clock clock;
  @Nullable private Lease record;

  public LocalDistributedLock(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized LeaseGrant acquire(String holderId, Duration ttl) {
    Instant now = clock.instant();
    if (record != null && !record.isExpired(now)) {
      return LeaseGrant.denied(record);
    }
    long token = record == null ? 1 : record.getFencingToken() + 1;
    record = new Lease(holderId, token, now.plus(ttl));
    return LeaseGrant.granted(record);
  }

  @Override
  public synchronized boolean renew(Lease lease, Duration ttl) {
    Instant now = clock.instant();
    if (record == null || !record.sameTenure(lease) || record.isExpired(now)) {
      return false;
    }
    record = record.withExpiry(now.plus(ttl));
    return true;
  }

  @Override
  public synchronized void release(Lease lease) {
    if (record != null && record.sameTenure(lease)) {
      record = record.withExpiry(clock.instant());
    }
  }

  @Override
  public synchronized Optional<Lease> current() {
    return Optional.ofNullable(record);
  }
}
