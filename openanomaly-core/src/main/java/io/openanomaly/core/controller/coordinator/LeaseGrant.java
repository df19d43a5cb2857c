package io.openanomaly.core.controller.coordinator;

import java.util.Optional;
import javax.annotation.Nullable;

/** Result of an acquire attempt: the new lease when granted, else the lease blocking it if any. */
public final class LeaseGrant {
  private final boolean granted;
  @Nullable private final Lease lease;

  private LeaseGrant(boolean granted, @Nullable Lease lease) {
    this.granted = granted;
    this.lease = lease;
  }

  public static LeaseGrant granted(Lease lease) {
    return new LeaseGrant(true, lease);
  }

  public static LeaseGrant denied(@Nullable Lease current) {
    return new LeaseGrant(false, current);
  }

  public boolean isGranted() {
    return granted;
  }

  /** The granted lease, or the current holder's lease when denied. */
  public Optional<Lease> getLease() {
    return Optional.ofNullable(lease);
  }
}
