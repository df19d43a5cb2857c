package io.openanomaly.core.controller.scheduler;

import io.openanomaly.core.pipeline.JobKind;
import java.time.Instant;
import java.util.Objects;

/** A fire time of one pipeline schedule. Derived from the cron expression, never stored. */
public final class ScheduleTick {
  private final String pipelineName;
  private final JobKind kind;
  private final Instant dueTime;
  private final boolean catchUp;

  public ScheduleTick(String pipelineName, JobKind kind, Instant dueTime, boolean catchUp) {
    this.pipelineName = pipelineName;
    this.kind = kind;
    this.dueTime = dueTime;
    this.catchUp = catchUp;
  }

  public String getPipelineName() {
    return pipelineName;
  }

  public JobKind getKind() {
    return kind;
  }

  public Instant getDueTime() {
    return dueTime;
  }

  /** True if the tick was missed while no instance was active and is enqueued late. */
  public boolean isCatchUp() {
    return catchUp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScheduleTick that = (ScheduleTick) o;
    return catchUp == that.catchUp
        && pipelineName.equals(that.pipelineName)
        && kind == that.kind
        && dueTime.equals(that.dueTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pipelineName, kind, dueTime, catchUp);
  }

  @Override
  public String toString() {
    return pipelineName + "/" + kind.tag() + "@" + dueTime + (catchUp ? " (catch-up)" : "");
  }
}
