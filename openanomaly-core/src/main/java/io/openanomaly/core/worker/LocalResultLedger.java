package io.openanomaly.core.worker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/** LocalResultLedger keeps claims and commits in memory. */
@ThreadSafe
public final class LocalResultLedger implements ResultLedger {
  private final Clock clock;
  private final Map<String, Record> records = new HashMap<>();

  public LocalResultLedger(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized ClaimResult claim(
      String idempotencyKey, Instant dueTime, String owner, Duration ttl) {
    Instant now = clock.instant();
    Record record = records.get(idempotencyKey);
    if (record != null) {
      if (record.committedAt != null) {
        return ClaimResult.ALREADY_COMMITTED;
      }
      if (record.claimExpiresAt.isAfter(now) && !record.owner.equals(owner)) {
        return ClaimResult.IN_PROGRESS;
      }
    }
    records.put(idempotencyKey, new Record(owner, dueTime, now.plus(ttl)));
    return ClaimResult.CLAIMED;
  }

  @Override
  public synchronized void commit(String idempotencyKey, Instant dueTime, String owner) {
    Record record = records.get(idempotencyKey);
    if (record == null || !record.owner.equals(owner)) {
      throw new IllegalStateException("claim on " + idempotencyKey + " is not held by " + owner);
    }
    record.committedAt = clock.instant();
  }

  @Override
  public synchronized void abandon(String idempotencyKey, String owner) {
    Record record = records.get(idempotencyKey);
    if (record != null && record.committedAt == null && record.owner.equals(owner)) {
      records.remove(idempotencyKey);
    }
  }

  @Override
  public synchronized boolean isCommitted(String idempotencyKey, Instant dueTime) {
    Record record = records.get(idempotencyKey);
    return record != null && record.committedAt != null;
  }

  @Override
  public synchronized int purge(Instant dueBefore) {
    int purged = 0;
    Iterator<Record> it = records.values().iterator();
    while (it.hasNext()) {
      Record record = it.next();
      if (record.committedAt != null && record.dueTime.isBefore(dueBefore)) {
        it.remove();
        purged++;
      }
    }
    return purged;
  }

  private static final class Record {
    final String owner;
    final Instant dueTime;
    final Instant claimExpiresAt;
    @Nullable Instant committedAt;

    Record(String owner, Instant dueTime, Instant claimExpiresAt) {
      this.owner = owner;
      this.dueTime = dueTime;
      this.claimExpiresAt = claimExpiresAt;
    }
  }
}
