package io.openanomaly.core.queue;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * LocalJobQueue is an in-memory {@link JobQueue} for standalone deployments and tests.
 *
 * <p>Visibility is driven by the injected clock. Waiting in {@link #consume} uses real time, in
 * short slices, so that a test clock moved forward is noticed promptly.
 */
@ThreadSafe
public final class LocalJobQueue implements JobQueue {
  private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

  private final Clock clock;
  private final Duration visibilityTimeout;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final PriorityQueue<Entry> ready =
      new PriorityQueue<>(
          Comparator.comparing((Entry e) -> e.visibleAt)
              .thenComparing(e -> e.job.getDueTime()));
  // jobId -> entry, in flight
  private final Map<String, Entry> inflight = new HashMap<>();
  // jobId -> entry, queued or in flight
  private final Map<String, Entry> jobs = new HashMap<>();
  // idempotency key -> jobId
  private final Map<String, String> keys = new HashMap<>();
  private long highestFencingToken = Job.UNFENCED;

  public LocalJobQueue(Clock clock, Duration visibilityTimeout) {
    this.clock = clock;
    this.visibilityTimeout = visibilityTimeout;
  }

  @Override
  public boolean enqueue(Job job, Duration delay) throws StaleFencingTokenException {
    lock.lock();
    try {
      if (job.getFencingToken() != Job.UNFENCED) {
        if (job.getFencingToken() < highestFencingToken) {
          throw new StaleFencingTokenException(job.getFencingToken(), highestFencingToken);
        }
        highestFencingToken = job.getFencingToken();
      }
      if (keys.containsKey(job.getIdempotencyKey())) {
        return false;
      }
      Entry entry = new Entry(job, clock.instant().plus(delay));
      jobs.put(job.getJobId(), entry);
      keys.put(job.getIdempotencyKey(), job.getJobId());
      ready.add(entry);
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  @Nullable
  public Delivery consume(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    lock.lock();
    try {
      while (true) {
        Instant now = clock.instant();
        reclaimExpired(now);
        Entry head = ready.peek();
        if (head != null && !head.visibleAt.isAfter(now)) {
          ready.poll();
          head.deliveries++;
          head.visibleAt = now.plus(visibilityTimeout);
          inflight.put(head.job.getJobId(), head);
          return new Delivery(head.job, head.deliveries);
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return null;
        }
        changed.awaitNanos(Math.min(remaining, WAIT_SLICE_NANOS));
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void complete(Delivery delivery) {
    lock.lock();
    try {
      Entry entry = removeInflight(delivery);
      if (entry != null) {
        forget(entry);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void fail(Delivery delivery, boolean requeue, Duration delay) {
    lock.lock();
    try {
      Entry entry = removeInflight(delivery);
      if (entry == null) {
        return;
      }
      if (requeue) {
        entry.visibleAt = clock.instant().plus(delay);
        ready.add(entry);
        changed.signalAll();
      } else {
        forget(entry);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long size() {
    lock.lock();
    try {
      return jobs.size();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  long highestFencingToken() {
    lock.lock();
    try {
      return highestFencingToken;
    } finally {
      lock.unlock();
    }
  }

  private void reclaimExpired(Instant now) {
    Iterator<Entry> it = inflight.values().iterator();
    while (it.hasNext()) {
      Entry entry = it.next();
      if (!entry.visibleAt.isAfter(now)) {
        it.remove();
        ready.add(entry);
      }
    }
  }

  /** Takes the entry out of flight unless a later delivery of it has been handed out. */
  @Nullable
  private Entry removeInflight(Delivery delivery) {
    String jobId = delivery.getJob().getJobId();
    Entry entry = inflight.get(jobId);
    if (entry == null || entry.deliveries != delivery.getDeliveryCount()) {
      return null;
    }
    return inflight.remove(jobId);
  }

  private void forget(Entry entry) {
    jobs.remove(entry.job.getJobId());
    keys.remove(entry.job.getIdempotencyKey(), entry.job.getJobId());
  }

  private static final class Entry {
    final Job job;
    // ready: when the job becomes visible. in flight: when the delivery times out.
    Instant visibleAt;
    int deliveries;

    Entry(Job job, Instant visibleAt) {
      this.job = job;
      this.visibleAt = visibleAt;
    }
  }
}
