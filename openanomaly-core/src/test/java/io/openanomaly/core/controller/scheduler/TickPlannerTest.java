package io.openanomaly.core.controller.scheduler;

import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineFixtures;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TickPlannerTest {
  private static final Duration GRACE = Duration.ofSeconds(2);
  private static final ZoneId UTC = ZoneId.of("UTC");

  private Pipeline pipeline;

  @BeforeEach
  public void setup() {
    pipeline = PipelineFixtures.forecastOnly("cpu", "*/5 * * * *");
  }

  private static Instant at(String time) {
    return Instant.parse("2024-01-01T" + time + "Z");
  }

  private static ScheduleTick tick(String time, boolean catchUp) {
    return new ScheduleTick("cpu", JobKind.FORECAST, at(time), catchUp);
  }

  @Test
  public void testResumeFromNowWithCatchUp() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:00:00.500"));
    Assertions.assertEquals(
        List.of(tick("11:55:00", true), tick("12:00:00", false)), plan.getTicks());
    // 11:05 .. 11:50
    Assertions.assertEquals(10, plan.getDiscarded());
  }

  @Test
  public void testResumeFromNowWithoutCatchUp() {
    TickPlanner planner = new TickPlanner(GRACE, false, Duration.ofHours(1), UTC);
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:00:00.500"));
    Assertions.assertEquals(List.of(tick("12:00:00", false)), plan.getTicks());
    Assertions.assertEquals(0, plan.getDiscarded());
  }

  @Test
  public void testNothingDueBetweenFires() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    Instant now = at("12:00:00.500");
    planner.plan(pipeline, JobKind.FORECAST, now);
    planner.advance("cpu", JobKind.FORECAST, now);
    for (int i = 1; i < 10; i++) {
      Instant later = now.plusSeconds(i);
      TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, later);
      Assertions.assertTrue(plan.getTicks().isEmpty());
      Assertions.assertEquals(0, plan.getDiscarded());
      planner.advance("cpu", JobKind.FORECAST, later);
    }
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:05:00.100"));
    Assertions.assertEquals(List.of(tick("12:05:00", false)), plan.getTicks());
  }

  @Test
  public void testTickDueExactlyAtEvaluationIsPlannedOnce() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    planner.advance("cpu", JobKind.FORECAST, at("12:04:59"));
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:05:00"));
    Assertions.assertEquals(List.of(tick("12:05:00", false)), plan.getTicks());
    planner.advance("cpu", JobKind.FORECAST, at("12:05:00"));
    Assertions.assertTrue(
        planner.plan(pipeline, JobKind.FORECAST, at("12:05:01")).getTicks().isEmpty());
  }

  @Test
  public void testWatermarkNotAdvancedPlansAgain() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    planner.advance("cpu", JobKind.FORECAST, at("12:04:59"));
    Assertions.assertEquals(
        1, planner.plan(pipeline, JobKind.FORECAST, at("12:05:00.500")).getTicks().size());
    // enqueue failed, no advance: the same tick comes back while current
    Assertions.assertEquals(
        List.of(tick("12:05:00", false)),
        planner.plan(pipeline, JobKind.FORECAST, at("12:05:01.500")).getTicks());
    // and as catch-up once it is older than the grace period
    Assertions.assertEquals(
        List.of(tick("12:05:00", true)),
        planner.plan(pipeline, JobKind.FORECAST, at("12:05:10")).getTicks());
  }

  @Test
  public void testStalledEvaluationCatchesUpLatestOnly() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    planner.advance("cpu", JobKind.FORECAST, at("12:00:00.500"));
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:30:00.500"));
    Assertions.assertEquals(
        List.of(tick("12:25:00", true), tick("12:30:00", false)), plan.getTicks());
    // 12:05 .. 12:20
    Assertions.assertEquals(4, plan.getDiscarded());
  }

  @Test
  public void testCatchUpWindowBoundsLookBack() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofMinutes(12), UTC);
    planner.advance("cpu", JobKind.FORECAST, at("10:00:00"));
    TickPlan plan = planner.plan(pipeline, JobKind.FORECAST, at("12:00:00.500"));
    Assertions.assertEquals(
        List.of(tick("11:55:00", true), tick("12:00:00", false)), plan.getTicks());
    // 11:50 only: older fires are outside the window
    Assertions.assertEquals(1, plan.getDiscarded());
  }

  @Test
  public void testResetForgetsWatermarks() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    Instant now = at("12:00:00.500");
    planner.advance("cpu", JobKind.FORECAST, now);
    Assertions.assertTrue(planner.plan(pipeline, JobKind.FORECAST, now).getTicks().isEmpty());
    planner.reset();
    Assertions.assertEquals(2, planner.plan(pipeline, JobKind.FORECAST, now).getTicks().size());
  }

  @Test
  public void testRetainDropsRemovedPipelines() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    Instant now = at("12:00:00.500");
    planner.advance("cpu", JobKind.FORECAST, now);
    planner.retain(List.of(pipeline));
    Assertions.assertTrue(planner.plan(pipeline, JobKind.FORECAST, now).getTicks().isEmpty());
    planner.retain(List.of(PipelineFixtures.forecastOnly("memory", "*/5 * * * *")));
    Assertions.assertFalse(planner.plan(pipeline, JobKind.FORECAST, now).getTicks().isEmpty());
  }

  @Test
  public void testRetainDropsUnusedSchedules() {
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    Instant now = at("12:00:00.500");
    planner.plan(pipeline, JobKind.FORECAST, now);
    Pipeline edited = PipelineFixtures.forecastOnly("cpu", "*/10 * * * *");
    planner.plan(edited, JobKind.FORECAST, now);
    Assertions.assertEquals(2, planner.cachedSchedules());

    planner.retain(List.of(edited));
    Assertions.assertEquals(1, planner.cachedSchedules());
    Assertions.assertEquals(2, planner.plan(edited, JobKind.FORECAST, now).getTicks().size());
    planner.retain(List.of());
    Assertions.assertEquals(0, planner.cachedSchedules());
  }

  @Test
  public void testKindsHaveIndependentWatermarks() {
    Pipeline both = PipelineFixtures.pipeline("cpu");
    both.setForecastSchedule("*/5 * * * *");
    both.setAnomalySchedule("*/1 * * * *");
    TickPlanner planner = new TickPlanner(GRACE, false, Duration.ofHours(1), UTC);
    Instant now = at("12:01:00.500");
    planner.advance("cpu", JobKind.FORECAST, now);
    Assertions.assertTrue(planner.plan(both, JobKind.FORECAST, now).getTicks().isEmpty());
    Assertions.assertEquals(
        List.of(new ScheduleTick("cpu", JobKind.ANOMALY, at("12:01:00"), false)),
        planner.plan(both, JobKind.ANOMALY, now).getTicks());
  }

  @Test
  public void testInvalidScheduleThrows() {
    pipeline.setForecastSchedule("not a cron");
    TickPlanner planner = new TickPlanner(GRACE, true, Duration.ofHours(1), UTC);
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> planner.plan(pipeline, JobKind.FORECAST, at("12:00:00")));
  }
}
