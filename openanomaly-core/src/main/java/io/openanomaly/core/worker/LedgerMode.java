package io.openanomaly.core.worker;

/** Mode determines the backend for the result ledger */
public enum LedgerMode {
  // LOCAL ledger is in-memory. Duplicate suppression only spans one process.
  LOCAL,
  // ZK ledger is shared by all workers.
  ZK
}
