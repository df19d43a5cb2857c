package io.openanomaly.model;

import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.errors.ConfigValidationException;
import io.openanomaly.core.pipeline.ModelConfig;
import io.openanomaly.core.pipeline.ModelReferenceChecker;
import io.openanomaly.core.pipeline.ModelType;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.TrainingConfig;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ModelEngineFactory picks the engine of a pipeline by its {@link ModelType}.
 *
 * <p>It also validates model references when pipelines are loaded, so that an unknown local
 * backend or an untrainable model with training enabled is rejected before any job runs.
 */
public class ModelEngineFactory implements ModelReferenceChecker {
  private final HttpClient httpClient;
  private final ModelConfiguration config;
  private final CoreInfra infra;
  private final Map<LocalBackend, LocalModelEngine> localEngines =
      new EnumMap<>(LocalBackend.class);

  public ModelEngineFactory(HttpClient httpClient, ModelConfiguration config, CoreInfra infra) {
    this.httpClient = httpClient;
    this.config = config;
    this.infra = infra;
    for (LocalBackend backend : LocalBackend.values()) {
      localEngines.put(backend, new LocalModelEngine(backend));
    }
  }

  public ModelEngineFactory(ModelConfiguration config, CoreInfra infra) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        config,
        infra);
  }

  /**
   * Returns the engine of the pipeline.
   *
   * @throws ConfigValidationException when the model reference is not usable.
   */
  public ModelEngine get(Pipeline pipeline) throws ConfigValidationException {
    ModelConfig model = pipeline.getModel();
    switch (model.getType()) {
      case REMOTE:
        if (model.getEndpoint() == null || model.getEndpoint().isBlank()) {
          throw new ConfigValidationException("model.endpoint is required for remote models");
        }
        TrainingConfig training = pipeline.getTraining();
        String trainingEndpoint =
            training != null && training.getEndpoint() != null
                ? training.getEndpoint()
                : RemoteModelEngine.defaultTrainingEndpoint(model.getEndpoint());
        return new RemoteModelEngine(
            httpClient,
            model.getEndpoint(),
            trainingEndpoint,
            model.getSerializationFormat(),
            model.getTimeout(),
            config.getHeaders(),
            infra.subScope("remote"));
      case LOCAL:
      default:
        return LocalBackend.fromId(model.getId())
            .map(localEngines::get)
            .orElseThrow(() -> new ConfigValidationException(unknownBackend(model.getId())));
    }
  }

  @Override
  public List<String> check(ModelConfig model, boolean trainingEnabled) {
    List<String> violations = new ArrayList<>();
    if (model.getType() != ModelType.LOCAL) {
      return violations;
    }
    Optional<LocalBackend> backend = LocalBackend.fromId(model.getId());
    if (backend.isEmpty()) {
      violations.add(unknownBackend(model.getId()));
    } else if (trainingEnabled && !backend.get().isTrainable()) {
      violations.add("model.id " + model.getId() + " is not trainable, disable training");
    }
    return violations;
  }

  private static String unknownBackend(String id) {
    return "model.id "
        + id
        + " is not a local backend, expected one of "
        + Stream.of(LocalBackend.values()).map(LocalBackend::id).collect(Collectors.joining(", "));
  }
}
