package io.openanomaly.core.controller.scheduler;

/** Scheduling state of one instance. Only an ACTIVE instance enqueues jobs. */
public enum SchedulerState {
  STANDBY,
  ACTIVE
}
