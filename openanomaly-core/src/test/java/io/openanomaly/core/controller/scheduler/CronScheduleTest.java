package io.openanomaly.core.controller.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CronScheduleTest {

  @Test
  public void testFiveFieldExpression() {
    CronSchedule schedule = CronSchedule.parse("*/5 * * * *");
    Assertions.assertEquals(
        Instant.parse("2024-01-01T12:05:00Z"),
        schedule.nextAfter(Instant.parse("2024-01-01T12:00:00Z")));
    Assertions.assertEquals("*/5 * * * *", schedule.getExpression());
  }

  @Test
  public void testSixFieldExpression() {
    CronSchedule schedule = CronSchedule.parse("30 * * * * *");
    Assertions.assertEquals(
        Instant.parse("2024-01-01T12:00:30Z"),
        schedule.nextAfter(Instant.parse("2024-01-01T12:00:00Z")));
  }

  @Test
  public void testMacro() {
    CronSchedule schedule = CronSchedule.parse("@hourly");
    Assertions.assertEquals(
        Instant.parse("2024-01-01T13:00:00Z"),
        schedule.nextAfter(Instant.parse("2024-01-01T12:00:00Z")));
  }

  @Test
  public void testZone() {
    CronSchedule schedule = CronSchedule.parse("0 9 * * *", ZoneId.of("Europe/Berlin"));
    Assertions.assertEquals(
        Instant.parse("2024-01-02T08:00:00Z"),
        schedule.nextAfter(Instant.parse("2024-01-01T12:00:00Z")));
  }

  @Test
  public void testFiresBetweenIsHalfOpen() {
    CronSchedule schedule = CronSchedule.parse("*/5 * * * *");
    List<Instant> fires =
        schedule.firesBetween(
            Instant.parse("2024-01-01T12:00:00Z"), Instant.parse("2024-01-01T12:15:00Z"), 10);
    Assertions.assertEquals(
        List.of(
            Instant.parse("2024-01-01T12:05:00Z"),
            Instant.parse("2024-01-01T12:10:00Z"),
            Instant.parse("2024-01-01T12:15:00Z")),
        fires);
  }

  @Test
  public void testFiresBetweenKeepsLatest() {
    CronSchedule schedule = CronSchedule.parse("*/5 * * * *");
    List<Instant> fires =
        schedule.firesBetween(
            Instant.parse("2024-01-01T12:00:00Z"), Instant.parse("2024-01-01T13:00:00Z"), 2);
    Assertions.assertEquals(
        List.of(Instant.parse("2024-01-01T12:55:00Z"), Instant.parse("2024-01-01T13:00:00Z")),
        fires);
  }

  @Test
  public void testInvalid() {
    Assertions.assertFalse(CronSchedule.isValid(""));
    Assertions.assertFalse(CronSchedule.isValid("* * *"));
    Assertions.assertFalse(CronSchedule.isValid("61 * * * *"));
    Assertions.assertTrue(CronSchedule.isValid("0 0 * * 1-5"));
  }
}
