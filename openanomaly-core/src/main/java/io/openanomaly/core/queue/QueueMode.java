package io.openanomaly.core.queue;

/** Mode determines the backend for the job queue */
public enum QueueMode {
  // LOCAL queue is in-memory and only reachable from the same process.
  LOCAL,
  // REDIS queue is shared by every instance pointing at the same redis.
  REDIS
}
