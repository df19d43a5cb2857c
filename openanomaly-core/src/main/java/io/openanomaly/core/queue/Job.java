package io.openanomaly.core.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.openanomaly.core.pipeline.JobKind;
import io.openanomaly.core.pipeline.Pipeline;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Job is one scheduled unit of work.
 *
 * <p>The job carries a snapshot of the pipeline taken at enqueue time, so later registry edits do
 * not change jobs already queued. The fencing token is the token of the leader that enqueued it,
 * or 0 for jobs triggered by hand.
 */
public final class Job {
  public static final long UNFENCED = 0;

  private final String jobId;
  private final Pipeline pipeline;
  private final JobKind kind;
  private final Instant dueTime;
  private final Instant enqueueTime;
  private final String idempotencyKey;
  private final long fencingToken;

  @JsonCreator
  public Job(
      @JsonProperty("job_id") String jobId,
      @JsonProperty("pipeline") Pipeline pipeline,
      @JsonProperty("kind") JobKind kind,
      @JsonProperty("due_time") Instant dueTime,
      @JsonProperty("enqueue_time") Instant enqueueTime,
      @JsonProperty("idempotency_key") String idempotencyKey,
      @JsonProperty("fencing_token") long fencingToken) {
    this.jobId = jobId;
    this.pipeline = pipeline;
    this.kind = kind;
    this.dueTime = dueTime;
    this.enqueueTime = enqueueTime;
    this.idempotencyKey = idempotencyKey;
    this.fencingToken = fencingToken;
  }

  /** Creates a job with a fresh id and the idempotency key of its tick. */
  public static Job create(
      Pipeline pipeline, JobKind kind, Instant dueTime, Instant enqueueTime, long fencingToken) {
    return new Job(
        UUID.randomUUID().toString(),
        pipeline.copy(),
        kind,
        dueTime,
        enqueueTime,
        IdempotencyKeys.of(pipeline.getName(), kind, dueTime),
        fencingToken);
  }

  @JsonProperty("job_id")
  public String getJobId() {
    return jobId;
  }

  @JsonProperty("pipeline")
  public Pipeline getPipeline() {
    return pipeline;
  }

  @JsonProperty("kind")
  public JobKind getKind() {
    return kind;
  }

  @JsonProperty("due_time")
  public Instant getDueTime() {
    return dueTime;
  }

  @JsonProperty("enqueue_time")
  public Instant getEnqueueTime() {
    return enqueueTime;
  }

  @JsonProperty("idempotency_key")
  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  @JsonProperty("fencing_token")
  public long getFencingToken() {
    return fencingToken;
  }

  public String pipelineName() {
    return pipeline.getName();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Job job = (Job) o;
    return fencingToken == job.fencingToken
        && jobId.equals(job.jobId)
        && pipeline.equals(job.pipeline)
        && kind == job.kind
        && dueTime.equals(job.dueTime)
        && enqueueTime.equals(job.enqueueTime)
        && idempotencyKey.equals(job.idempotencyKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(jobId, kind, dueTime, idempotencyKey, fencingToken);
  }

  @Override
  public String toString() {
    return "Job{id="
        + jobId
        + ", pipeline="
        + pipeline.getName()
        + ", kind="
        + kind.tag()
        + ", due="
        + dueTime
        + ", fencingToken="
        + fencingToken
        + "}";
  }
}
