package io.openanomaly.core.worker;

import io.openanomaly.core.queue.Job;

/**
 * TaskExecutor runs the body of a job.
 *
 * <p>Implementations classify failures by throwing a {@link
 * io.openanomaly.core.errors.TaskException}. Anything else is treated as an internal error. The
 * body must stop promptly when its thread is interrupted.
 */
public interface TaskExecutor {
  void execute(Job job) throws Exception;
}
