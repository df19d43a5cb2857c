package io.openanomaly.core.worker;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.TestUtils;
import io.openanomaly.core.config.WorkerConfiguration;
import io.openanomaly.core.errors.DataUnavailableException;
import io.openanomaly.core.errors.InferenceException;
import io.openanomaly.core.errors.SerializationException;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.PipelineFixtures;
import io.openanomaly.core.queue.Delivery;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.queue.LocalJobQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WorkerRuntimeTest {
  private static final Instant DUE = Instant.parse("2024-01-01T12:05:00Z");
  private static final Duration VISIBILITY = Duration.ofMinutes(10);

  private TestUtils.TestClock clock;
  private LocalJobQueue queue;
  private LocalResultLedger ledger;
  private WorkerConfiguration config;
  private List<Job> written;

  @BeforeEach
  public void setup() {
    clock = new TestUtils.TestClock(DUE.plusMillis(200));
    queue = new LocalJobQueue(clock, VISIBILITY);
    ledger = new LocalResultLedger(clock);
    config = new WorkerConfiguration();
    config.setWorkerId("worker-1");
    config.setMaxAttempts(3);
    config.setRetryBackoff(Duration.ZERO);
    config.setPollTimeout(Duration.ofMillis(50));
    written = new CopyOnWriteArrayList<>();
  }

  private WorkerRuntime runtime(TaskExecutor executor) {
    return new WorkerRuntime(queue, ledger, executor, config, clock, CoreInfra.NOOP);
  }

  private Job enqueue(Instant due) throws Exception {
    Job job =
        Job.create(
            PipelineFixtures.forecastOnly("cpu", "*/5 * * * *"),
            JobKind.FORECAST,
            due,
            clock.instant(),
            1);
    queue.enqueue(job);
    return job;
  }

  @Test
  public void testRedeliveredForecastWritesOnce() throws Exception {
    WorkerRuntime runtime = runtime(written::add);
    enqueue(DUE);
    Delivery first = queue.consume(Duration.ZERO);
    // the first worker stalls past the visibility timeout and the job is delivered again
    clock.add(VISIBILITY);
    Delivery second = queue.consume(Duration.ZERO);
    Assertions.assertTrue(second.isRedelivery());

    Assertions.assertEquals(WorkerRuntime.Outcome.SUCCEEDED, runtime.process(second));
    Assertions.assertEquals(WorkerRuntime.Outcome.SUPPRESSED, runtime.process(first));
    Assertions.assertEquals(1, written.size());
    Assertions.assertEquals(0, queue.size());
    Assertions.assertTrue(
        ledger.isCommitted(first.getJob().getIdempotencyKey(), first.getJob().getDueTime()));
  }

  @Test
  public void testSameTickFromAnotherLeaderIsSuppressed() throws Exception {
    WorkerRuntime runtime = runtime(written::add);
    enqueue(DUE);
    runtime.process(queue.consume(Duration.ZERO));
    // a new leader enqueues the same tick again after it was completed
    enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.SUPPRESSED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(1, written.size());
  }

  @Test
  public void testClaimHeldElsewhereIsDeferred() throws Exception {
    WorkerRuntime runtime = runtime(written::add);
    Job job = enqueue(DUE);
    ledger.claim(
        job.getIdempotencyKey(), job.getDueTime(), "worker-2/other/1", Duration.ofMinutes(10));
    Assertions.assertEquals(
        WorkerRuntime.Outcome.DEFERRED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertTrue(written.isEmpty());
    Assertions.assertEquals(1, queue.size());
  }

  @Test
  public void testRetryableFailureRequeuedUntilMaxAttempts() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    WorkerRuntime runtime =
        runtime(
            job -> {
              calls.incrementAndGet();
              throw new InferenceException("model unavailable");
            });
    Job job = enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.REQUEUED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(
        WorkerRuntime.Outcome.REQUEUED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(
        WorkerRuntime.Outcome.DROPPED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(3, calls.get());
    Assertions.assertEquals(0, queue.size());
    Assertions.assertFalse(ledger.isCommitted(job.getIdempotencyKey(), job.getDueTime()));
  }

  @Test
  public void testRetryFollowsBackoff() throws Exception {
    config.setRetryBackoff(Duration.ofSeconds(30));
    WorkerRuntime runtime =
        runtime(
            job -> {
              throw new IllegalStateException("boom");
            });
    enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.REQUEUED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertNull(queue.consume(Duration.ZERO));
    clock.add(Duration.ofSeconds(30));
    Assertions.assertNotNull(queue.consume(Duration.ZERO));
  }

  @Test
  public void testSerializationFailureNotRetried() throws Exception {
    WorkerRuntime runtime =
        runtime(
            job -> {
              throw new SerializationException("malformed arrow response");
            });
    enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.DROPPED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testDataUnavailableSkipsTick() throws Exception {
    WorkerRuntime runtime =
        runtime(
            job -> {
              throw new DataUnavailableException("no samples");
            });
    Job job = enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.DROPPED, runtime.process(queue.consume(Duration.ZERO)));
    // the claim is released so a later trigger of the same tick may run
    Assertions.assertEquals(
        ClaimResult.CLAIMED,
        ledger.claim(job.getIdempotencyKey(), job.getDueTime(), "other", Duration.ofMinutes(1)));
  }

  @Test
  public void testUnreachableTsdbIsRequeued() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    WorkerRuntime runtime =
        runtime(
            job -> {
              if (calls.incrementAndGet() == 1) {
                throw DataUnavailableException.unreachable("query_range returned status 503");
              }
              written.add(job);
            });
    enqueue(DUE);
    Assertions.assertEquals(
        WorkerRuntime.Outcome.REQUEUED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(
        WorkerRuntime.Outcome.SUCCEEDED, runtime.process(queue.consume(Duration.ZERO)));
    Assertions.assertEquals(1, written.size());
  }

  @Test
  public void testTimeoutWhileRunning() throws Exception {
    config.setThreads(1);
    config.setTaskTimeout(Duration.ofMillis(100));
    config.setMaxAttempts(1);
    AtomicInteger calls = new AtomicInteger();
    WorkerRuntime runtime =
        runtime(
            job -> {
              calls.incrementAndGet();
              Thread.sleep(10_000);
            });
    runtime.start();
    try {
      enqueue(DUE);
      Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> queue.size() == 0);
      Assertions.assertEquals(1, calls.get());
    } finally {
      runtime.stop();
    }
  }

  @Test
  public void testStartedRuntimeDrainsQueue() throws Exception {
    config.setThreads(2);
    WorkerRuntime runtime = runtime(written::add);
    runtime.start();
    Assertions.assertTrue(runtime.isRunning());
    try {
      for (int i = 0; i < 5; i++) {
        enqueue(DUE.plus(Duration.ofMinutes(5L * i)));
      }
      Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> written.size() == 5);
      Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> queue.size() == 0);
    } finally {
      runtime.stop();
    }
    Assertions.assertFalse(runtime.isRunning());
  }

  @Test
  public void testPurgeLedger() throws Exception {
    config.setLedgerRetention(Duration.ofDays(1));
    WorkerRuntime runtime = runtime(written::add);
    Job job = enqueue(DUE);
    runtime.process(queue.consume(Duration.ZERO));
    clock.add(Duration.ofDays(2));
    runtime.start();
    try {
      runtime.purgeLedger();
    } finally {
      runtime.stop();
    }
    Assertions.assertFalse(ledger.isCommitted(job.getIdempotencyKey(), job.getDueTime()));
  }
}
