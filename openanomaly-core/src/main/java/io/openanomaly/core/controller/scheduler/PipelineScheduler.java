package io.openanomaly.core.controller.scheduler;

import com.google.common.collect.ImmutableMap;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.controller.coordinator.LeaderSelector;
import io.openanomaly.core.controller.coordinator.Lease;
import io.openanomaly.core.errors.LeadershipLostException;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.queue.JobQueue;
import io.openanomaly.core.queue.StaleFencingTokenException;
import io.openanomaly.core.registry.PipelineRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * PipelineScheduler is the timer driven evaluation loop of the leader.
 *
 * <p>Every evaluation reads the registry afresh, plans the due ticks of each enabled pipeline and
 * enqueues them as jobs stamped with the lease's fencing token. The instance is ACTIVE while its
 * {@link LeaderSelector} holds the lease and STANDBY otherwise. A new tenure, even of the same
 * holder, starts from a clean {@link TickPlanner}.
 *
 * <p>Leadership is checked again before every enqueue. If the lease lapsed or changed, or the
 * queue has seen a newer fencing token, the evaluation halts at once with {@link
 * LeadershipLostException} and the instance returns to STANDBY.
 */
public class PipelineScheduler {
  public static final String SPRING_PROFILE = "openanomaly-scheduler";
  private static final Logger logger = LoggerFactory.getLogger(PipelineScheduler.class);

  private final PipelineRegistry registry;
  private final JobQueue queue;
  private final LeaderSelector leaderSelector;
  private final TickPlanner planner;
  private final Clock clock;
  private final CoreInfra infra;

  private volatile SchedulerState state = SchedulerState.STANDBY;
  @Nullable private Lease activeLease;

  public PipelineScheduler(
      PipelineRegistry registry,
      JobQueue queue,
      LeaderSelector leaderSelector,
      TickPlanner planner,
      Clock clock,
      CoreInfra infra) {
    this.registry = registry;
    this.queue = queue;
    this.leaderSelector = leaderSelector;
    this.planner = planner;
    this.clock = clock;
    this.infra = infra;
  }

  public SchedulerState getState() {
    return state;
  }

  /** Runs one evaluation if this instance leads. */
  @Scheduled(fixedDelayString = "${scheduler.evaluation-interval:PT1S}")
  public synchronized void evaluate() {
    Optional<Lease> lease = leaderSelector.currentLease();
    if (lease.isEmpty()) {
      standBy("lease.absent");
      return;
    }
    if (activeLease == null || !activeLease.sameTenure(lease.get())) {
      activate(lease.get());
    }
    try {
      evaluate(lease.get());
    } catch (LeadershipLostException e) {
      infra.scope().counter("scheduler.leadership.lost").inc(1);
      standBy(e.getMessage());
    }
  }

  private void evaluate(Lease lease) throws LeadershipLostException {
    List<Pipeline> pipelines;
    try {
      pipelines = registry.list();
    } catch (Exception e) {
      infra.scope().counter("scheduler.registry.read.failed").inc(1);
      logger.warn("scheduler.registry.read.failure", e);
      return;
    }
    Instant now = clock.instant();
    planner.retain(pipelines);
    for (Pipeline pipeline : pipelines) {
      if (!pipeline.isEnabled()) {
        continue;
      }
      for (JobKind kind : pipeline.getScheduledKinds()) {
        schedule(pipeline, kind, lease, now);
      }
    }
    infra.scope().gauge("scheduler.pipelines").update(pipelines.size());
  }

  private void schedule(Pipeline pipeline, JobKind kind, Lease lease, Instant now)
      throws LeadershipLostException {
    TickPlan plan;
    try {
      plan = planner.plan(pipeline, kind, now);
    } catch (IllegalArgumentException e) {
      logger.warn(
          "scheduler.schedule.invalid",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.jobKind(kind.tag()),
          StructuredLogging.reason(e.getMessage()));
      return;
    }
    if (plan.getDiscarded() > 0) {
      tagged(pipeline, kind).counter("scheduler.ticks.discarded").inc(plan.getDiscarded());
      logger.warn(
          "scheduler.ticks.discarded",
          StructuredLogging.pipeline(pipeline.getName()),
          StructuredLogging.jobKind(kind.tag()),
          StructuredLogging.count(plan.getDiscarded()));
    }
    for (ScheduleTick tick : plan.getTicks()) {
      try {
        enqueue(pipeline, tick, lease, now);
      } catch (LeadershipLostException e) {
        throw e;
      } catch (Exception e) {
        // the watermark stays put so the tick is planned again next evaluation
        tagged(pipeline, kind).counter("scheduler.enqueue.failed").inc(1);
        logger.warn(
            "scheduler.enqueue.failure",
            StructuredLogging.pipeline(pipeline.getName()),
            StructuredLogging.jobKind(kind.tag()),
            StructuredLogging.dueTime(tick.getDueTime()),
            e);
        return;
      }
    }
    planner.advance(pipeline.getName(), kind, now);
  }

  private void enqueue(Pipeline pipeline, ScheduleTick tick, Lease lease, Instant now)
      throws Exception {
    ensureLeader(lease);
    Job job =
        Job.create(pipeline, tick.getKind(), tick.getDueTime(), now, lease.getFencingToken());
    boolean added;
    try {
      added = queue.enqueue(job);
    } catch (StaleFencingTokenException e) {
      throw new LeadershipLostException("queue has seen fencing token " + e.getHighestSeen(), e);
    }
    tagged(pipeline, tick.getKind())
        .counter(added ? "scheduler.job.enqueued" : "scheduler.job.deduplicated")
        .inc(1);
    logger.info(
        added ? "scheduler.job.enqueued" : "scheduler.job.deduplicated",
        StructuredLogging.pipeline(pipeline.getName()),
        StructuredLogging.jobKind(tick.getKind().tag()),
        StructuredLogging.dueTime(tick.getDueTime()),
        StructuredLogging.fencingToken(lease.getFencingToken()),
        StructuredLogging.action(tick.isCatchUp() ? "catch-up" : "on-time"));
  }

  private void ensureLeader(Lease lease) throws LeadershipLostException {
    Optional<Lease> current = leaderSelector.currentLease();
    if (current.isEmpty()) {
      throw new LeadershipLostException("lease lapsed during evaluation");
    }
    if (!current.get().sameTenure(lease)) {
      throw new LeadershipLostException("lease changed during evaluation");
    }
  }

  private void activate(Lease lease) {
    planner.reset();
    activeLease = lease;
    state = SchedulerState.ACTIVE;
    infra.scope().gauge("scheduler.active").update(1);
    logger.info(
        "scheduler.state.changed",
        StructuredLogging.state(SchedulerState.ACTIVE),
        StructuredLogging.fencingToken(lease.getFencingToken()));
  }

  private void standBy(String reason) {
    if (state == SchedulerState.STANDBY) {
      return;
    }
    planner.reset();
    activeLease = null;
    state = SchedulerState.STANDBY;
    infra.scope().gauge("scheduler.active").update(0);
    logger.warn(
        "scheduler.state.changed",
        StructuredLogging.state(SchedulerState.STANDBY),
        StructuredLogging.reason(reason));
  }

  private com.uber.m3.tally.Scope tagged(Pipeline pipeline, JobKind kind) {
    return infra
        .scope()
        .tagged(
            ImmutableMap.of(
                StructuredLogging.PIPELINE, pipeline.getName(),
                StructuredLogging.JOB_KIND, kind.tag()));
  }
}
