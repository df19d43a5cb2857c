package io.openanomaly.core.controller.scheduler;

import com.google.common.annotations.VisibleForTesting;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * TickPlanner turns cron schedules into due ticks, one evaluation at a time.
 *
 * <p>It keeps a watermark per pipeline and job kind: the evaluation time up to which ticks were
 * enqueued. Fire times after the watermark and up to now are due. A due tick no older than the
 * grace period is current and always planned. Older ticks were missed; when catch-up is enabled
 * the latest missed tick is planned and the rest discarded, otherwise all are discarded.
 *
 * <p>Without a watermark, as after a leadership change, planning resumes from now and looks back
 * over the catch-up window only.
 */
@NotThreadSafe
public final class TickPlanner {
  private final Duration grace;
  private final boolean catchUpEnabled;
  private final Duration catchUpWindow;
  private final ZoneId zone;
  private final Map<WatermarkKey, Instant> watermarks = new HashMap<>();
  private final Map<String, CronSchedule> schedules = new HashMap<>();

  public TickPlanner(Duration grace, boolean catchUpEnabled, Duration catchUpWindow, ZoneId zone) {
    this.grace = grace;
    this.catchUpEnabled = catchUpEnabled;
    this.catchUpWindow = catchUpWindow;
    this.zone = zone;
  }

  /**
   * Plans the ticks of one pipeline schedule due at {@code now}. The watermark does not move until
   * {@link #advance} is called.
   *
   * @throws IllegalArgumentException if the schedule is not a valid cron expression.
   */
  public TickPlan plan(Pipeline pipeline, JobKind kind, Instant now) {
    CronSchedule schedule =
        schedules.computeIfAbsent(pipeline.scheduleFor(kind), e -> CronSchedule.parse(e, zone));
    Duration lookBack =
        catchUpEnabled && catchUpWindow.compareTo(grace) > 0 ? catchUpWindow : grace;
    Instant floor = now.minus(lookBack);
    Instant from = watermarks.get(new WatermarkKey(pipeline.getName(), kind));
    if (from == null || from.isBefore(floor)) {
      from = floor;
    }
    Instant currentSince = now.minus(grace);
    List<ScheduleTick> ticks = new ArrayList<>();
    int missed = 0;
    @Nullable Instant latestMissed = null;
    for (Instant due : schedule.firesBetween(from, now, Integer.MAX_VALUE)) {
      if (due.isBefore(currentSince)) {
        missed++;
        latestMissed = due;
      } else {
        ticks.add(new ScheduleTick(pipeline.getName(), kind, due, false));
      }
    }
    if (catchUpEnabled && latestMissed != null) {
      ticks.add(0, new ScheduleTick(pipeline.getName(), kind, latestMissed, true));
      missed--;
    }
    return new TickPlan(ticks, missed);
  }

  /** Records that all ticks up to {@code evaluatedAt} were enqueued. */
  public void advance(String pipelineName, JobKind kind, Instant evaluatedAt) {
    watermarks.put(new WatermarkKey(pipelineName, kind), evaluatedAt);
  }

  /**
   * Forgets pipelines that are gone from the registry, and parsed schedules no longer used by any
   * of the given pipelines.
   */
  public void retain(Collection<Pipeline> pipelines) {
    Set<String> names = new HashSet<>();
    Set<String> expressions = new HashSet<>();
    for (Pipeline pipeline : pipelines) {
      names.add(pipeline.getName());
      for (JobKind kind : pipeline.getScheduledKinds()) {
        expressions.add(pipeline.scheduleFor(kind));
      }
    }
    watermarks.keySet().removeIf(key -> !names.contains(key.pipelineName));
    schedules.keySet().retainAll(expressions);
  }

  @VisibleForTesting
  int cachedSchedules() {
    return schedules.size();
  }

  /** Forgets every watermark. Called when this instance stops being active. */
  public void reset() {
    watermarks.clear();
    schedules.clear();
  }

  private static final class WatermarkKey {
    final String pipelineName;
    final JobKind kind;

    WatermarkKey(String pipelineName, JobKind kind) {
      this.pipelineName = pipelineName;
      this.kind = kind;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      WatermarkKey that = (WatermarkKey) o;
      return pipelineName.equals(that.pipelineName) && kind == that.kind;
    }

    @Override
    public int hashCode() {
      return Objects.hash(pipelineName, kind);
    }
  }
}
