package io.openanomaly.core.controller.scheduler;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ticks of one pipeline schedule to enqueue now, oldest first, and how many were discarded. */
public final class TickPlan {
  private final List<ScheduleTick> ticks;
  private final int discarded;

  TickPlan(List<ScheduleTick> ticks, int discarded) {
    this.ticks = ImmutableList.copyOf(ticks);
    this.discarded = discarded;
  }

  public List<ScheduleTick> getTicks() {
    return ticks;
  }

  /** Missed ticks that are not enqueued. */
  public int getDiscarded() {
    return discarded;
  }
}
