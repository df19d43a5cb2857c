package io.openanomaly.core.controller.coordinator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Lease is the leadership record: who holds it, until when, and the fencing token issued at
 * acquisition.
 *
 * <p>Fencing tokens strictly increase across acquisitions, so a token identifies one tenure.
 */
public final class Lease {
  private final String holderId;
  private final long fencingToken;
  private final Instant expiresAt;

  @JsonCreator
  public Lease(
      @JsonProperty("holder_id") String holderId,
      @JsonProperty("fencing_token") long fencingToken,
      @JsonProperty("expires_at") Instant expiresAt) {
    this.holderId = holderId;
    this.fencingToken = fencingToken;
    this.expiresAt = expiresAt;
  }

  @JsonProperty("holder_id")
  public String getHolderId() {
    return holderId;
  }

  @JsonProperty("fencing_token")
  public long getFencingToken() {
    return fencingToken;
  }

  @JsonProperty("expires_at")
  public Instant getExpiresAt() {
    return expiresAt;
  }

  @JsonIgnore
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /** Returns true if the other lease is the same tenure, regardless of expiry. */
  public boolean sameTenure(Lease other) {
    return fencingToken == other.fencingToken && holderId.equals(other.holderId);
  }

  Lease withExpiry(Instant newExpiresAt) {
    return new Lease(holderId, fencingToken, newExpiresAt);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Lease lease = (Lease) o;
    return fencingToken == lease.fencingToken
        && holderId.equals(lease.holderId)
        && expiresAt.equals(lease.expiresAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(holderId, fencingToken, expiresAt);
  }

  @Override
  public String toString() {
    return "Lease{holder="
        + holderId
        + ", token="
        + fencingToken
        + ", expiresAt="
        + expiresAt
        + "}";
  }
}
