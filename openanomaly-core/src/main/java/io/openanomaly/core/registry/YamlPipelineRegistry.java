package io.openanomaly.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.annotations.VisibleForTesting;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonMappers;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.PipelineCodec;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * YamlPipelineRegistry serves pipelines from a YAML (or JSON) document on disk.
 *
 * <p>The document is re-read whenever its modification time or size changes, so edits take effect
 * at the next read. If the new content cannot be parsed at all, the previous snapshot keeps being
 * served. Training artifacts are kept in a sibling {@code <file>.artifacts.json}.
 */
public final class YamlPipelineRegistry implements PipelineRegistry {
  private static final Logger logger = LoggerFactory.getLogger(YamlPipelineRegistry.class);
  private static final TypeReference<Map<String, TrainingArtifact>> ARTIFACTS =
      new TypeReference<Map<String, TrainingArtifact>>() {};

  private final Path path;
  private final Path artifactsPath;
  private final PipelineCodec codec;
  private final PipelineCodec.Format format;
  private final CoreInfra infra;

  private volatile Snapshot snapshot = Snapshot.EMPTY;
  @Nullable private Map<String, TrainingArtifact> artifacts;

  public YamlPipelineRegistry(Path path, PipelineCodec codec, CoreInfra infra) {
    this.path = path;
    this.artifactsPath = path.resolveSibling(path.getFileName() + ".artifacts.json");
    this.codec = codec;
    this.format = PipelineCodec.Format.forPath(path);
    this.infra = infra;
  }

  @Override
  public void start() {
    refreshIfChanged();
  }

  @Override
  public List<Pipeline> list() {
    List<Pipeline> result = new ArrayList<>();
    for (Pipeline pipeline : refreshIfChanged().result.getPipelines()) {
      result.add(pipeline.copy());
    }
    return result;
  }

  @Override
  public Optional<Pipeline> get(String name) {
    return refreshIfChanged().result.getPipelines().stream()
        .filter(p -> p.getName().equals(name))
        .findFirst()
        .map(Pipeline::copy);
  }

  @Override
  public Map<String, String> rejected() {
    return refreshIfChanged().result.getRejected();
  }

  @Override
  public synchronized void upsert(Pipeline pipeline) throws Exception {
    byte[] updated = codec.upsertInDocument(readOrEmpty(path), pipeline, format);
    writeAtomically(path, updated);
    invalidate();
    refreshIfChanged();
  }

  @Override
  public synchronized boolean delete(String name) throws Exception {
    boolean existed = get(name).isPresent() || rejected().containsKey(name);
    if (existed) {
      writeAtomically(path, codec.removeFromDocument(readOrEmpty(path), name, format));
      invalidate();
      refreshIfChanged();
    }
    return existed;
  }

  @Override
  public synchronized void saveArtifact(TrainingArtifact artifact) throws IOException {
    Map<String, TrainingArtifact> current = new HashMap<>(loadArtifacts());
    current.put(artifact.getPipelineName(), artifact);
    writeAtomically(artifactsPath, JsonMappers.lenient().writeValueAsBytes(current));
    artifacts = current;
  }

  @Override
  public synchronized Optional<TrainingArtifact> latestArtifact(String pipelineName)
      throws IOException {
    return Optional.ofNullable(loadArtifacts().get(pipelineName));
  }

  @VisibleForTesting
  synchronized Snapshot refreshIfChanged() {
    FileTime modified;
    long size;
    try {
      modified = Files.getLastModifiedTime(path);
      size = Files.size(path);
    } catch (NoSuchFileException e) {
      if (snapshot != Snapshot.EMPTY) {
        logger.warn("registry.yaml.missing", StructuredLogging.path(path.toString()));
        snapshot = Snapshot.EMPTY;
      }
      return snapshot;
    } catch (IOException e) {
      logger.error("registry.yaml.stat.failure", StructuredLogging.path(path.toString()), e);
      infra.scope().counter("registry.yaml.reload.failure").inc(1);
      return snapshot;
    }
    Snapshot current = snapshot;
    if (modified.equals(current.modified) && size == current.size) {
      return current;
    }
    try {
      PipelineCodec.LoadResult result = codec.read(Files.readAllBytes(path), format);
      snapshot = new Snapshot(modified, size, result);
      for (Map.Entry<String, String> entry : result.getRejected().entrySet()) {
        logger.error(
            "registry.pipeline.rejected",
            StructuredLogging.pipeline(entry.getKey()),
            StructuredLogging.reason(entry.getValue()));
      }
      logger.info(
          "registry.yaml.reloaded",
          StructuredLogging.path(path.toString()),
          StructuredLogging.count(result.getPipelines().size()));
      infra.scope().counter("registry.yaml.reload.success").inc(1);
      infra.scope().gauge("registry.pipelines.valid").update(result.getPipelines().size());
      infra.scope().gauge("registry.pipelines.rejected").update(result.getRejected().size());
    } catch (ConfigValidationException | IOException e) {
      // keep serving the previous snapshot, but don't re-read the same broken content
      snapshot = new Snapshot(modified, size, current.result);
      logger.error(
          "registry.yaml.reload.failure",
          StructuredLogging.path(path.toString()),
          StructuredLogging.reason(e.getMessage()));
      infra.scope().counter("registry.yaml.reload.failure").inc(1);
    }
    return snapshot;
  }

  private void invalidate() {
    snapshot = new Snapshot(null, -1, snapshot.result);
  }

  private Map<String, TrainingArtifact> loadArtifacts() throws IOException {
    if (artifacts == null) {
      if (Files.exists(artifactsPath)) {
        artifacts = JsonMappers.lenient().readValue(Files.readAllBytes(artifactsPath), ARTIFACTS);
      } else {
        artifacts = new HashMap<>();
      }
    }
    return Objects.requireNonNull(artifacts);
  }

  private static byte[] readOrEmpty(Path path) throws IOException {
    return Files.exists(path) ? Files.readAllBytes(path) : new byte[0];
  }

  private static void writeAtomically(Path target, byte[] content) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      Files.write(tmp, content);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  @VisibleForTesting
  static final class Snapshot {
    static final Snapshot EMPTY =
        new Snapshot(null, -1, new PipelineCodec.LoadResult(List.of(), Map.of()));

    @Nullable final FileTime modified;
    final long size;
    final PipelineCodec.LoadResult result;

    Snapshot(@Nullable FileTime modified, long size, PipelineCodec.LoadResult result) {
      this.modified = modified;
      this.size = size;
      this.result = result;
    }
  }
}
