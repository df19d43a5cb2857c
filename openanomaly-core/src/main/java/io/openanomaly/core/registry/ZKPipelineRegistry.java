package io.openanomaly.core.registry;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonSerializationFactory;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.common.ZKUtils;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.instrumentation.Instrumentation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZKPipelineRegistry stores one znode per pipeline under {@code <root>/pipelines} and the latest
 * training artifact per pipeline under {@code <root>/artifacts}.
 *
 * <p>Pipelines are stored as JSON. Each upsert is a single znode create or set, so it is atomic
 * per pipeline.
 */
public final class ZKPipelineRegistry implements PipelineRegistry {
  private static final Logger logger = LoggerFactory.getLogger(ZKPipelineRegistry.class);
  private static final String PIPELINES = "pipelines";
  private static final String ARTIFACTS = "artifacts";

  private final CuratorFramework curatorFramework;
  private final String pipelinesPath;
  private final String artifactsPath;
  private final PipelineCodec codec;
  private final JsonSerializationFactory<TrainingArtifact> artifactSerializer;
  private final CoreInfra infra;
  private final AtomicBoolean running = new AtomicBoolean(false);
  // rejections already logged, so that each is logged once per reason
  private final Map<String, String> reported = new ConcurrentHashMap<>();

  public ZKPipelineRegistry(
      CuratorFramework curatorFramework, String rootPath, PipelineCodec codec, CoreInfra infra) {
    this.curatorFramework = curatorFramework;
    this.pipelinesPath = ZKUtils.join(rootPath, PIPELINES);
    this.artifactsPath = ZKUtils.join(rootPath, ARTIFACTS);
    this.codec = codec;
    this.artifactSerializer = new JsonSerializationFactory<>(TrainingArtifact.class);
    this.infra = infra;
  }

  @Override
  public void start() {
    ZKUtils.startIfLatent(curatorFramework);
    try {
      ZKUtils.ensurePath(curatorFramework, pipelinesPath);
      ZKUtils.ensurePath(curatorFramework, artifactsPath);
    } catch (Exception e) {
      logger.error("registry.zk.path.create.failure", StructuredLogging.zkPath(pipelinesPath), e);
      throw new RuntimeException(e);
    }
    running.set(true);
  }

  @Override
  public void stop() {
    running.set(false);
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public List<Pipeline> list() throws Exception {
    return new ArrayList<>(load().valid.values());
  }

  @Override
  public Optional<Pipeline> get(String name) throws Exception {
    byte[] data;
    try {
      data = curatorFramework.getData().forPath(ZKUtils.join(pipelinesPath, name));
    } catch (KeeperException.NoNodeException e) {
      return Optional.empty();
    }
    try {
      return Optional.of(codec.readPipeline(data));
    } catch (ConfigValidationException e) {
      return Optional.empty();
    }
  }

  @Override
  public Map<String, String> rejected() throws Exception {
    return load().rejected;
  }

  @Override
  public void upsert(Pipeline pipeline) throws Exception {
    codec.getValidator().validate(pipeline);
    byte[] data = codec.writePipeline(pipeline);
    String path = ZKUtils.join(pipelinesPath, pipeline.getName());
    Instrumentation.instrument.returnVoidWithException(
        logger,
        infra.scope(),
        infra.tracer(),
        () -> {
          try {
            curatorFramework.create().creatingParentContainersIfNeeded().forPath(path, data);
          } catch (KeeperException.NodeExistsException e) {
            curatorFramework.setData().forPath(path, data);
          }
        },
        "registry.zk.upsert",
        StructuredLogging.PIPELINE,
        pipeline.getName());
  }

  @Override
  public boolean delete(String name) throws Exception {
    try {
      curatorFramework.delete().forPath(ZKUtils.join(pipelinesPath, name));
      logger.info("registry.zk.deleted", StructuredLogging.pipeline(name));
      return true;
    } catch (KeeperException.NoNodeException e) {
      return false;
    }
  }

  @Override
  public void saveArtifact(TrainingArtifact artifact) throws Exception {
    byte[] data = artifactSerializer.serialize(artifact);
    String path = ZKUtils.join(artifactsPath, artifact.getPipelineName());
    try {
      curatorFramework.create().creatingParentContainersIfNeeded().forPath(path, data);
    } catch (KeeperException.NodeExistsException e) {
      curatorFramework.setData().forPath(path, data);
    }
  }

  @Override
  public Optional<TrainingArtifact> latestArtifact(String pipelineName) throws Exception {
    try {
      byte[] data =
          curatorFramework.getData().forPath(ZKUtils.join(artifactsPath, pipelineName));
      return Optional.of(artifactSerializer.deserialize(data));
    } catch (KeeperException.NoNodeException e) {
      return Optional.empty();
    }
  }

  private Loaded load() throws Exception {
    List<String> names;
    try {
      names = new ArrayList<>(curatorFramework.getChildren().forPath(pipelinesPath));
    } catch (KeeperException.NoNodeException e) {
      return new Loaded(Map.of(), Map.of());
    }
    Collections.sort(names);
    Map<String, Pipeline> valid = new LinkedHashMap<>();
    Map<String, String> rejected = new LinkedHashMap<>();
    for (String name : names) {
      byte[] data;
      try {
        data = curatorFramework.getData().forPath(ZKUtils.join(pipelinesPath, name));
      } catch (KeeperException.NoNodeException e) {
        // deleted between list and read
        continue;
      }
      try {
        valid.put(name, codec.readPipeline(data));
      } catch (ConfigValidationException e) {
        rejected.put(name, e.getMessage());
        if (!e.getMessage().equals(reported.put(name, e.getMessage()))) {
          logger.error(
              "registry.pipeline.rejected",
              StructuredLogging.pipeline(name),
              StructuredLogging.reason(e.getMessage()));
        }
      }
    }
    reported.keySet().retainAll(rejected.keySet());
    infra.scope().gauge("registry.pipelines.valid").update(valid.size());
    infra.scope().gauge("registry.pipelines.rejected").update(rejected.size());
    return new Loaded(valid, rejected);
  }

  private static final class Loaded {
    final Map<String, Pipeline> valid;
    final Map<String, String> rejected;

    Loaded(Map<String, Pipeline> valid, Map<String, String> rejected) {
      this.valid = valid;
      this.rejected = rejected;
    }
  }
}
