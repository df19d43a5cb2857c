package io.openanomaly.core.registry;

import io.openanomaly.core.common.RunningLifecycle;
import io.openanomaly.core.pipeline.Pipeline;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.context.SmartLifecycle;

/**
 * PipelineRegistry is the durable store of pipeline definitions and training artifacts.
 *
 * @implSpec All methods must be threadsafe. Returned pipelines are copies: mutating them never
 *     changes the registry.
 * @implSpec The registry is read-mostly. {@link #upsert} and {@link #delete} are atomic per
 *     pipeline.
 * @implNote Registries that need to connect report not running until started, so the spring
 *     context starts them on refresh.
 */
public interface PipelineRegistry extends RunningLifecycle, SmartLifecycle {

  /** Returns all pipelines that passed validation, enabled or not. */
  List<Pipeline> list() throws Exception;

  Optional<Pipeline> get(String name) throws Exception;

  /**
   * Returns pipelines that failed validation, keyed by name, with the reason. These are excluded
   * from scheduling until fixed.
   */
  Map<String, String> rejected() throws Exception;

  /**
   * Creates or replaces a pipeline.
   *
   * @throws io.openanomaly.core.errors.ConfigValidationException if the pipeline is invalid.
   */
  void upsert(Pipeline pipeline) throws Exception;

  /** Deletes the pipeline, returning false if it did not exist. */
  boolean delete(String name) throws Exception;

  void saveArtifact(TrainingArtifact artifact) throws Exception;

  Optional<TrainingArtifact> latestArtifact(String pipelineName) throws Exception;
}
