package io.openanomaly.task;

import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.queue.Job;
import io.openanomaly.core.worker.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs a job by its kind against the pipeline snapshot the job carries. */
public class PipelineTaskExecutor implements TaskExecutor {
  private static final Logger logger = LoggerFactory.getLogger(PipelineTaskExecutor.class);

  private final ForecastTask forecastTask;
  private final AnomalyTask anomalyTask;
  private final TrainTask trainTask;

  public PipelineTaskExecutor(
      ForecastTask forecastTask, AnomalyTask anomalyTask, TrainTask trainTask) {
    this.forecastTask = forecastTask;
    this.anomalyTask = anomalyTask;
    this.trainTask = trainTask;
  }

  @Override
  public void execute(Job job) throws Exception {
    logger.debug(
        "task.execute",
        StructuredLogging.pipeline(job.pipelineName()),
        StructuredLogging.jobKind(job.getKind().tag()),
        StructuredLogging.dueTime(job.getDueTime()));
    switch (job.getKind()) {
      case FORECAST:
        forecastTask.run(job.getPipeline(), job.getDueTime());
        break;
      case ANOMALY:
        anomalyTask.run(job.getPipeline(), job.getDueTime());
        break;
      case TRAIN:
        trainTask.run(job.getPipeline(), job.getDueTime());
        break;
      default:
        throw new IllegalArgumentException("unknown job kind " + job.getKind());
    }
  }
}
