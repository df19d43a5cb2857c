package io.openanomaly.core.controller.coordinator;

import io.openanomaly.core.common.RunningLifecycle;
import java.time.Duration;
import java.util.Optional;

/**
 * DistributedLock is a single leadership record updated with compare-and-swap.
 *
 * @implSpec At most one non-expired lease exists at any instant.
 * @implSpec Each successful {@link #acquire} issues a fencing token strictly greater than any
 *     token issued before, including tokens of released or expired leases.
 * @implSpec Expiry is decided by the lock backend at the time it applies the request. Callers
 *     that need a local view must compute a conservative deadline from the time they sent the
 *     request.
 */
public interface DistributedLock extends RunningLifecycle {

  /**
   * Tries to take the lease. Succeeds only if there is no lease or the current one is expired.
   *
   * @param holderId identity of the caller.
   * @param ttl lease duration.
   * @return the grant.
   */
  LeaseGrant acquire(String holderId, Duration ttl) throws Exception;

  /**
   * Extends an unexpired lease held by the caller.
   *
   * @return false if the lease is expired, released, or superseded.
   */
  boolean renew(Lease lease, Duration ttl) throws Exception;

  /** Expires the lease now if it is still the current one. The token counter is kept. */
  void release(Lease lease) throws Exception;

  /** Returns the current lease record, expired or not. */
  Optional<Lease> current() throws Exception;
}
