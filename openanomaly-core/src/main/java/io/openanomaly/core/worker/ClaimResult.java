package io.openanomaly.core.worker;

/** Outcome of claiming the right to produce the result of an idempotency key. */
public enum ClaimResult {
  /** The caller owns the claim and must commit or abandon it. */
  CLAIMED,
  /** A result was already written. The caller must not write again. */
  ALREADY_COMMITTED,
  /** Another worker holds an unexpired claim. */
  IN_PROGRESS
}
