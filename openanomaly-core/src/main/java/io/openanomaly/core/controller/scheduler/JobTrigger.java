package io.openanomaly.core.controller.scheduler;

import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.queue.JobQueue;
import io.openanomaly.core.registry.PipelineRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JobTrigger enqueues a job by hand, outside of any schedule and without leadership.
 *
 * <p>The job is due now, truncated to the second, and unfenced. A second trigger within the same
 * second is deduplicated like any other repeated tick.
 */
public final class JobTrigger {
  private static final Logger logger = LoggerFactory.getLogger(JobTrigger.class);

  private final PipelineRegistry registry;
  private final JobQueue queue;
  private final Clock clock;

  public JobTrigger(PipelineRegistry registry, JobQueue queue, Clock clock) {
    this.registry = registry;
    this.queue = queue;
    this.clock = clock;
  }

  /**
   * Enqueues one job of the given kind for the pipeline.
   *
   * @return the job.
   * @throws ConfigValidationException if the pipeline is unknown or doesn't run jobs of the kind.
   */
  public Job trigger(String pipelineName, JobKind kind) throws Exception {
    Pipeline pipeline =
        registry
            .get(pipelineName)
            .orElseThrow(() -> new ConfigValidationException("unknown pipeline " + pipelineName));
    if (!pipeline.getScheduledKinds().contains(kind)) {
      throw new ConfigValidationException(
          "pipeline " + pipelineName + " does not run " + kind.tag() + " jobs");
    }
    Instant now = clock.instant();
    Job job = Job.create(pipeline, kind, now.truncatedTo(ChronoUnit.SECONDS), now, Job.UNFENCED);
    boolean added = queue.enqueue(job);
    logger.info(
        added ? "trigger.job.enqueued" : "trigger.job.deduplicated",
        StructuredLogging.pipeline(pipelineName),
        StructuredLogging.jobKind(kind.tag()),
        StructuredLogging.dueTime(job.getDueTime()));
    return job;
  }
}
