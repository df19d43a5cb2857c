package io.openanomaly.core.queue;

import com.google.common.hash.Hashing;
import io.openanomaly.core.pipeline.JobKind;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** Derives the deterministic identity of a scheduled unit of work. */
public final class IdempotencyKeys {
  private IdempotencyKeys() {}

  /**
   * Returns the hex encoded SHA-256 of the pipeline name, job kind and due second.
   *
   * <p>Every enqueue of the same tick, from any leader, yields the same key.
   */
  public static String of(String pipelineName, JobKind kind, Instant dueTime) {
    return Hashing.sha256()
        .hashString(
            pipelineName + "|" + kind.tag() + "|" + dueTime.getEpochSecond(),
            StandardCharsets.UTF_8)
        .toString();
  }
}
