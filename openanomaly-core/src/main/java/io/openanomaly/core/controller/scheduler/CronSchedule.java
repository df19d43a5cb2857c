package io.openanomaly.core.controller.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;
import org.springframework.scheduling.support.CronExpression;

/**
 * CronSchedule evaluates a cron expression against wall-clock time.
 *
 * <p>Both the standard 5-field form ({@code minute hour day month weekday}) and the 6-field form
 * with a leading seconds field are accepted, as well as the {@code @hourly} style macros.
 */
public final class CronSchedule {
  private final String expression;
  private final CronExpression cron;
  private final ZoneId zone;

  private CronSchedule(String expression, CronExpression cron, ZoneId zone) {
    this.expression = expression;
    this.cron = cron;
    this.zone = zone;
  }

  /**
   * Parses the expression.
   *
   * @throws IllegalArgumentException if the expression is not a valid cron expression.
   */
  public static CronSchedule parse(String expression, ZoneId zone) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("cron expression must not be empty");
    }
    String trimmed = expression.trim();
    String normalized = trimmed;
    if (!trimmed.startsWith("@") && trimmed.split("\\s+").length == 5) {
      normalized = "0 " + trimmed;
    }
    return new CronSchedule(trimmed, CronExpression.parse(normalized), zone);
  }

  public static CronSchedule parse(String expression) {
    return parse(expression, ZoneId.of("UTC"));
  }

  public static boolean isValid(String expression) {
    try {
      parse(expression);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /** Returns the first fire time strictly after the given instant. */
  @Nullable
  public Instant nextAfter(Instant instant) {
    ZonedDateTime next = cron.next(instant.atZone(zone));
    return next == null ? null : next.toInstant();
  }

  /**
   * Returns fire times in {@code (fromExclusive, toInclusive]}, oldest first, keeping only the
   * latest {@code limit} of them.
   */
  public List<Instant> firesBetween(Instant fromExclusive, Instant toInclusive, int limit) {
    List<Instant> fires = new ArrayList<>();
    Instant cursor = fromExclusive;
    while (true) {
      Instant next = nextAfter(cursor);
      if (next == null || next.isAfter(toInclusive)) {
        break;
      }
      fires.add(next);
      if (fires.size() > limit) {
        fires.remove(0);
      }
      cursor = next;
    }
    return fires;
  }

  public String getExpression() {
    return expression;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CronSchedule that = (CronSchedule) o;
    return expression.equals(that.expression) && zone.equals(that.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, zone);
  }

  @Override
  public String toString() {
    return expression;
  }
}
