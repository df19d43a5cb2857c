package io.openanomaly.core.controller.scheduler;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.TestUtils;
import io.openanomaly.core.controller.coordinator.LeaderSelector;
import io.openanomaly.core.controller.coordinator.Lease;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineFixtures;
import io.openanomaly.core.pipeline.PipelineValidator;
import io.openanomaly.core.queue.Delivery;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.queue.JobQueue;
import io.openanomaly.core.queue.LocalJobQueue;
import io.openanomaly.core.registry.LocalPipelineRegistry;
import io.openanomaly.core.registry.PipelineRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

public class PipelineSchedulerTest {
  private static final Instant NOW = Instant.parse("2024-01-01T12:00:00.500Z");

  private TestUtils.TestClock clock;
  private LocalPipelineRegistry registry;
  private LocalJobQueue queue;
  private LeaderSelector leaderSelector;
  private PipelineScheduler scheduler;
  private Lease lease;

  @BeforeEach
  public void setup() throws Exception {
    clock = new TestUtils.TestClock(NOW);
    registry = new LocalPipelineRegistry(new PipelineValidator());
    registry.upsert(PipelineFixtures.forecastOnly("cpu", "*/5 * * * *"));
    queue = new LocalJobQueue(clock, Duration.ofMinutes(5));
    leaderSelector = Mockito.mock(LeaderSelector.class);
    lease = new Lease("scheduler-a", 7, NOW.plusSeconds(15));
    scheduler =
        new PipelineScheduler(
            registry,
            queue,
            leaderSelector,
            new TickPlanner(Duration.ofSeconds(2), true, Duration.ofHours(1), ZoneId.of("UTC")),
            clock,
            CoreInfra.NOOP);
  }

  private List<Job> drain(JobQueue queue) throws Exception {
    List<Job> jobs = new ArrayList<>();
    Delivery delivery;
    while ((delivery = queue.consume(Duration.ZERO)) != null) {
      jobs.add(delivery.getJob());
    }
    return jobs;
  }

  @Test
  public void testStandbyWithoutLease() throws Exception {
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.empty());
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.STANDBY, scheduler.getState());
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testLeaderEnqueuesFencedJobs() throws Exception {
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());

    List<Job> jobs = drain(queue);
    Assertions.assertEquals(2, jobs.size());
    Assertions.assertEquals(Instant.parse("2024-01-01T11:55:00Z"), jobs.get(0).getDueTime());
    Assertions.assertEquals(Instant.parse("2024-01-01T12:00:00Z"), jobs.get(1).getDueTime());
    for (Job job : jobs) {
      Assertions.assertEquals("cpu", job.pipelineName());
      Assertions.assertEquals(JobKind.FORECAST, job.getKind());
      Assertions.assertEquals(7, job.getFencingToken());
      Assertions.assertEquals(NOW, job.getEnqueueTime());
    }
  }

  @Test
  public void testRepeatedEvaluationEnqueuesOnce() throws Exception {
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    clock.add(Duration.ofSeconds(1));
    scheduler.evaluate();
    clock.add(Duration.ofSeconds(1));
    scheduler.evaluate();
    Assertions.assertEquals(2, queue.size());

    clock.set(Instant.parse("2024-01-01T12:05:00.200Z"));
    scheduler.evaluate();
    Assertions.assertEquals(3, queue.size());
  }

  @Test
  public void testNewTenureReplansWithoutDuplicates() throws Exception {
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(2, queue.size());

    // a new tenure forgets the watermarks, the queue deduplicates the same ticks
    Lease next = new Lease("scheduler-a", 8, NOW.plusSeconds(20));
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(next));
    clock.add(Duration.ofSeconds(1));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());
    Assertions.assertEquals(2, queue.size());
  }

  @Test
  public void testLeaseLapsedMidEvaluationHalts() throws Exception {
    registry.upsert(PipelineFixtures.forecastOnly("memory", "*/5 * * * *"));
    // evaluation start, first enqueue check, then gone
    Mockito.when(leaderSelector.currentLease())
        .thenReturn(Optional.of(lease), Optional.of(lease), Optional.empty());
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.STANDBY, scheduler.getState());
    Assertions.assertEquals(1, queue.size());
  }

  @Test
  public void testLeaseChangedMidEvaluationHalts() throws Exception {
    Lease other = new Lease("scheduler-b", 8, NOW.plusSeconds(15));
    Mockito.when(leaderSelector.currentLease())
        .thenReturn(Optional.of(lease), Optional.of(other));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.STANDBY, scheduler.getState());
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testStaleFencingTokenIsLostLeadership() throws Exception {
    Pipeline other = PipelineFixtures.forecastOnly("other", "0 0 * * *");
    queue.enqueue(Job.create(other, JobKind.FORECAST, NOW, NOW, 9));
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.STANDBY, scheduler.getState());
    Assertions.assertEquals(1, queue.size());
  }

  @Test
  public void testDisabledPipelineIsSkipped() throws Exception {
    Pipeline disabled = PipelineFixtures.forecastOnly("cpu", "*/5 * * * *");
    disabled.setEnabled(false);
    registry.upsert(disabled);
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testEnqueueFailureRetriesNextEvaluation() throws Exception {
    JobQueue failing = Mockito.mock(JobQueue.class);
    Mockito.when(failing.enqueue(Mockito.any()))
        .thenThrow(new IllegalStateException("queue down"))
        .thenReturn(true);
    PipelineScheduler scheduler =
        new PipelineScheduler(
            registry,
            failing,
            leaderSelector,
            new TickPlanner(Duration.ofSeconds(2), false, Duration.ofHours(1), ZoneId.of("UTC")),
            clock,
            CoreInfra.NOOP);
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());
    clock.add(Duration.ofSeconds(1));
    scheduler.evaluate();
    Mockito.verify(failing, Mockito.times(2)).enqueue(Mockito.any());
  }

  @Test
  public void testRegistryFailureKeepsLeadership() throws Exception {
    PipelineRegistry broken = Mockito.mock(PipelineRegistry.class);
    Mockito.when(broken.list()).thenThrow(new IllegalStateException("zk down"));
    PipelineScheduler scheduler =
        new PipelineScheduler(
            broken,
            queue,
            leaderSelector,
            new TickPlanner(Duration.ofSeconds(2), true, Duration.ofHours(1), ZoneId.of("UTC")),
            clock,
            CoreInfra.NOOP);
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());
    Assertions.assertEquals(0, queue.size());
  }

  @Test
  public void testStepsDownWhenLeaseGoes() throws Exception {
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.of(lease));
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.ACTIVE, scheduler.getState());
    Mockito.when(leaderSelector.currentLease()).thenReturn(Optional.empty());
    scheduler.evaluate();
    Assertions.assertEquals(SchedulerState.STANDBY, scheduler.getState());
  }
}
