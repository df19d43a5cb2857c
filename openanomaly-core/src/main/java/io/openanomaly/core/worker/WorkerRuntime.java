package io.openanomaly.core.worker;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.uber.m3.tally.Scope;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.config.WorkerConfiguration;
import io.openanomaly.core.errors.ErrorClass;
import io.openanomaly.core.errors.ErrorClassifier;
import io.openanomaly.core.errors.TaskTimeoutException;
import io.openanomaly.core.queue.Delivery;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.queue.JobQueue;
import io.opentracing.Span;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * WorkerRuntime consumes jobs from the {@link JobQueue} and runs them through the {@link
 * TaskExecutor}.
 *
 * <p>Each delivery first claims its idempotency key in the {@link ResultLedger}. A key already
 * committed means another delivery wrote the result: the job is acknowledged and nothing runs. A
 * key claimed by another live worker is put back with a delay. Otherwise the task runs within its
 * wall-clock budget, and the claim is committed on success or abandoned on failure.
 *
 * <p>Failures are classified with {@link ErrorClassifier}. Retryable classes are redelivered
 * until the delivery count reaches {@code maxAttempts}, everything else is dropped and reported.
 * Only the error class, pipeline, kind and due time are logged; the exception itself is logged
 * at debug level.
 */
public class WorkerRuntime implements SmartLifecycle {
  public static final String SPRING_PROFILE = "openanomaly-worker";
  private static final Logger logger = LoggerFactory.getLogger(WorkerRuntime.class);

  private final JobQueue queue;
  private final ResultLedger ledger;
  private final TaskExecutor taskExecutor;
  private final WorkerConfiguration config;
  private final Clock clock;
  private final CoreInfra infra;
  private final AtomicBoolean running;

  @Nullable private ExecutorService consumers;
  @Nullable private ExecutorService tasks;

  public WorkerRuntime(
      JobQueue queue,
      ResultLedger ledger,
      TaskExecutor taskExecutor,
      WorkerConfiguration config,
      Clock clock,
      CoreInfra infra) {
    this.queue = queue;
    this.ledger = ledger;
    this.taskExecutor = taskExecutor;
    this.config = config;
    this.clock = clock;
    this.infra = infra;
    this.running = new AtomicBoolean(false);
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    queue.start();
    ledger.start();
    tasks =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("openanomaly-task-%d")
                .setDaemon(true)
                .build());
    consumers =
        Executors.newFixedThreadPool(
            config.getThreads(),
            new ThreadFactoryBuilder().setNameFormat("openanomaly-worker-%d").build());
    for (int i = 0; i < config.getThreads(); i++) {
      consumers.submit(this::consumeLoop);
    }
    logger.info(
        "worker.runtime.started",
        StructuredLogging.holderId(config.getWorkerId()),
        StructuredLogging.count(config.getThreads()));
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    shutdown(consumers);
    shutdown(tasks);
    ledger.stop();
    queue.stop();
    logger.info("worker.runtime.stopped", StructuredLogging.holderId(config.getWorkerId()));
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  // stop after the scheduler so that enqueued jobs are still drained while it stops
  @Override
  public int getPhase() {
    return Integer.MAX_VALUE - 1;
  }

  private void shutdown(@Nullable ExecutorService executor) {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    long waitMs = config.getPollTimeout().toMillis() * 2;
    try {
      if (!executor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
        logger.warn("worker.runtime.shutdown.timeout");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void consumeLoop() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        Delivery delivery = queue.consume(config.getPollTimeout());
        if (delivery != null) {
          process(delivery);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Exception e) {
        // queue unreachable; back off for one poll and try again
        infra.scope().counter("worker.queue.consume.failed").inc(1);
        logger.warn("worker.queue.consume.failure", e);
        try {
          Thread.sleep(config.getPollTimeout().toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
        }
      }
    }
  }

  /**
   * Processes one delivery to its end: acknowledged, requeued or dropped.
   *
   * @return the outcome, for tests.
   */
  @VisibleForTesting
  Outcome process(Delivery delivery) throws Exception {
    Job job = delivery.getJob();
    Scope scope =
        infra
            .scope()
            .tagged(
                ImmutableMap.of(
                    StructuredLogging.PIPELINE, job.pipelineName(),
                    StructuredLogging.JOB_KIND, job.getKind().tag()));
    // unique per delivery, so redundant deliveries inside one process don't share a claim
    String owner = config.getWorkerId() + "/" + job.getJobId() + "/" + delivery.getDeliveryCount();
    ClaimResult claim =
        ledger.claim(job.getIdempotencyKey(), job.getDueTime(), owner, config.getClaimTtl());
    switch (claim) {
      case ALREADY_COMMITTED:
        queue.complete(delivery);
        scope.counter("worker.job.duplicate.suppressed").inc(1);
        logger.info(
            "worker.job.duplicate.suppressed",
            StructuredLogging.pipeline(job.pipelineName()),
            StructuredLogging.jobKind(job.getKind().tag()),
            StructuredLogging.dueTime(job.getDueTime()),
            StructuredLogging.idempotencyKey(job.getIdempotencyKey()));
        return Outcome.SUPPRESSED;
      case IN_PROGRESS:
        queue.fail(delivery, true, config.getRetryBackoff());
        scope.counter("worker.job.claim.contended").inc(1);
        return Outcome.DEFERRED;
      case CLAIMED:
      default:
        return run(delivery, owner, scope);
    }
  }

  private Outcome run(Delivery delivery, String owner, Scope scope) throws Exception {
    Job job = delivery.getJob();
    long startNs = System.nanoTime();
    Span span =
        infra
            .tracer()
            .buildSpan("worker.job")
            .withTag(StructuredLogging.PIPELINE, job.pipelineName())
            .withTag(StructuredLogging.JOB_KIND, job.getKind().tag())
            .start();
    try (io.opentracing.Scope ignored = infra.tracer().scopeManager().activate(span)) {
      runWithBudget(job);
    } catch (InterruptedException e) {
      // shutting down: hand the job to another worker right away
      ledger.abandon(job.getIdempotencyKey(), owner);
      queue.fail(delivery, true);
      Thread.currentThread().interrupt();
      return Outcome.DEFERRED;
    } catch (Exception e) {
      return failed(delivery, owner, scope, e);
    } finally {
      span.finish();
      scope
          .timer("worker.job.latency")
          .record(com.uber.m3.util.Duration.ofNanos(System.nanoTime() - startNs));
    }
    ledger.commit(job.getIdempotencyKey(), job.getDueTime(), owner);
    queue.complete(delivery);
    scope.counter("worker.job.succeeded").inc(1);
    logger.info(
        "worker.job.succeeded",
        StructuredLogging.pipeline(job.pipelineName()),
        StructuredLogging.jobKind(job.getKind().tag()),
        StructuredLogging.dueTime(job.getDueTime()),
        StructuredLogging.attempt(delivery.getDeliveryCount()),
        StructuredLogging.duration(Duration.ofNanos(System.nanoTime() - startNs)));
    return Outcome.SUCCEEDED;
  }

  private Outcome failed(Delivery delivery, String owner, Scope scope, Exception e)
      throws Exception {
    Job job = delivery.getJob();
    ErrorClass errorClass = ErrorClassifier.classify(e);
    ledger.abandon(job.getIdempotencyKey(), owner);
    boolean requeue =
        ErrorClassifier.isRetryable(e) && delivery.getDeliveryCount() < config.getMaxAttempts();
    queue.fail(delivery, requeue, config.getRetryBackoff());
    scope
        .tagged(ImmutableMap.of(StructuredLogging.ERROR_CLASS, errorClass.tag()))
        .counter(requeue ? "worker.job.requeued" : "worker.job.dropped")
        .inc(1);
    logger.warn(
        "worker.job.failure",
        StructuredLogging.errorClass(errorClass.tag()),
        StructuredLogging.pipeline(job.pipelineName()),
        StructuredLogging.jobKind(job.getKind().tag()),
        StructuredLogging.dueTime(job.getDueTime()),
        StructuredLogging.attempt(delivery.getDeliveryCount()),
        StructuredLogging.action(requeue ? "requeue" : "drop"));
    if (logger.isDebugEnabled()) {
      logger.debug(
          "worker.job.failure.cause",
          StructuredLogging.pipeline(job.pipelineName()),
          StructuredLogging.jobKind(job.getKind().tag()),
          ErrorClassifier.unwrap(e));
    }
    return requeue ? Outcome.REQUEUED : Outcome.DROPPED;
  }

  private void runWithBudget(Job job) throws Exception {
    ExecutorService executor = tasks;
    if (executor == null) {
      taskExecutor.execute(job);
      return;
    }
    Future<?> future =
        executor.submit(
            () -> {
              taskExecutor.execute(job);
              return null;
            });
    try {
      future.get(config.getTaskTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TaskTimeoutException(config.getTaskTimeout());
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw e;
    }
  }

  /** Forgets ledger entries older than the retention. */
  @Scheduled(fixedDelayString = "${worker.ledgerPurgeIntervalMs:3600000}")
  public void purgeLedger() {
    if (!running.get()) {
      return;
    }
    try {
      int purged = ledger.purge(clock.instant().minus(config.getLedgerRetention()));
      infra.scope().counter("worker.ledger.purged").inc(purged);
    } catch (Exception e) {
      infra.scope().counter("worker.ledger.purge.failed").inc(1);
      logger.warn("worker.ledger.purge.failure", e);
    }
  }

  @VisibleForTesting
  enum Outcome {
    SUCCEEDED,
    SUPPRESSED,
    DEFERRED,
    REQUEUED,
    DROPPED
  }
}
