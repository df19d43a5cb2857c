package io.openanomaly.core.worker;

import io.openanomaly.core.common.RunningLifecycle;
import java.time.Duration;
import java.time.Instant;

/**
 * ResultLedger records which idempotency keys have had their result written, so that redundant
 * deliveries of the same job write once.
 *
 * <p>The first claim wins. A claim is either committed after the result is written, or abandoned
 * on failure so that a redelivery may claim it again. A claim whose owner vanished expires after
 * its ttl.
 *
 * <p>Keys are passed with the due time of their job so backends can group commits by time.
 */
public interface ResultLedger extends RunningLifecycle {

  ClaimResult claim(String idempotencyKey, Instant dueTime, String owner, Duration ttl)
      throws Exception;

  /** Marks the result as written. Only the claim owner may commit. */
  void commit(String idempotencyKey, Instant dueTime, String owner) throws Exception;

  /** Drops the claim so the key can be claimed again. No-op if the owner doesn't hold it. */
  void abandon(String idempotencyKey, String owner) throws Exception;

  boolean isCommitted(String idempotencyKey, Instant dueTime) throws Exception;

  /**
   * Forgets committed keys whose due time is before the cutoff. Backends that group commits may
   * keep a key until its whole group is past the cutoff.
   *
   * @return number of keys purged.
   */
  int purge(Instant dueBefore) throws Exception;
}
