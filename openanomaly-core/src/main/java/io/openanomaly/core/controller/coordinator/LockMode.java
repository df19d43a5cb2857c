package io.openanomaly.core.controller.coordinator;

/** Backend of the leadership lock. */
public enum LockMode {
  // LOCAL lock is in-process, for single-node deployments and tests.
  LOCAL,
  // ZK lock keeps the lease record in a znode.
  ZK
}
