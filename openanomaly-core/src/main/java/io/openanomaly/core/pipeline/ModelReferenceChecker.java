package io.openanomaly.core.pipeline;

import java.util.List;

/**
 * ModelReferenceChecker validates a pipeline's model reference against the model engines
 * available to the application.
 */
@FunctionalInterface
public interface ModelReferenceChecker {
  /** Accepts any model reference. */
  ModelReferenceChecker ANY = (model, trainingEnabled) -> List.of();

  /**
   * Checks the model reference.
   *
   * @param model to check.
   * @param trainingEnabled whether the pipeline retrains, which requires a trainable model.
   * @return the violations, empty when the reference is usable.
   */
  List<String> check(ModelConfig model, boolean trainingEnabled);
}
