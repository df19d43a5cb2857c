package io.openanomaly.core.queue;

import io.openanomaly.core.common.RunningLifecycle;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * JobQueue hands jobs from the scheduler to workers with at-least-once delivery.
 *
 * @implSpec A consumed job that is neither completed nor failed becomes visible again once the
 *     visibility timeout passes, and its delivery count grows on every consume.
 * @implSpec Enqueue rejects a job whose fencing token is lower than the highest token seen.
 *     Unfenced jobs (token {@link Job#UNFENCED}) are never rejected.
 * @implSpec Enqueue of an idempotency key that is already queued or in flight is acknowledged
 *     without adding a second job.
 * @implSpec Acknowledgements carry the delivery they answer. One from a delivery that timed out
 *     and was handed out again is ignored.
 * @implSpec There is no ordering guarantee.
 */
public interface JobQueue extends RunningLifecycle {

  /**
   * Enqueues the job for immediate delivery.
   *
   * @return true if the job was added, false if a job with the same idempotency key was already
   *     queued or in flight. Both acknowledge the enqueue.
   * @throws StaleFencingTokenException if a newer leader has enqueued since.
   */
  default boolean enqueue(Job job) throws Exception {
    return enqueue(job, Duration.ZERO);
  }

  /** Enqueues the job, visible to consumers only after the delay. */
  boolean enqueue(Job job, Duration delay) throws Exception;

  /**
   * Blocks up to the timeout for a visible job.
   *
   * @return the delivery, or null when the timeout passes first.
   */
  @Nullable
  Delivery consume(Duration timeout) throws Exception;

  /** Acknowledges a delivery. The job and its idempotency key leave the queue. */
  void complete(Delivery delivery) throws Exception;

  /** Fails a delivery, requeueing it for immediate redelivery or dropping it. */
  default void fail(Delivery delivery, boolean requeue) throws Exception {
    fail(delivery, requeue, Duration.ZERO);
  }

  /** Fails a delivery, requeueing it after the delay or dropping it. */
  void fail(Delivery delivery, boolean requeue, Duration delay) throws Exception;

  /** Number of jobs queued or in flight. */
  long size() throws Exception;
}
