package io.openanomaly.core.registry;

import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineValidator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** LocalPipelineRegistry is an in-memory registry for single-node deployments and tests. */
public final class LocalPipelineRegistry implements PipelineRegistry {
  private final PipelineValidator validator;
  private final ConcurrentMap<String, Pipeline> pipelines = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, TrainingArtifact> artifacts = new ConcurrentHashMap<>();

  public LocalPipelineRegistry(PipelineValidator validator) {
    this.validator = validator;
  }

  @Override
  public List<Pipeline> list() {
    List<Pipeline> result = new ArrayList<>();
    for (Pipeline pipeline : pipelines.values()) {
      result.add(pipeline.copy());
    }
    result.sort(Comparator.comparing(Pipeline::getName));
    return result;
  }

  @Override
  public Optional<Pipeline> get(String name) {
    return Optional.ofNullable(pipelines.get(name)).map(Pipeline::copy);
  }

  @Override
  public Map<String, String> rejected() {
    return Map.of();
  }

  @Override
  public void upsert(Pipeline pipeline) throws Exception {
    validator.validate(pipeline);
    pipelines.put(pipeline.getName(), pipeline.copy());
  }

  @Override
  public boolean delete(String name) {
    return pipelines.remove(name) != null;
  }

  @Override
  public void saveArtifact(TrainingArtifact artifact) {
    artifacts.put(artifact.getPipelineName(), artifact);
  }

  @Override
  public Optional<TrainingArtifact> latestArtifact(String pipelineName) {
    return Optional.ofNullable(artifacts.get(pipelineName));
  }
}
