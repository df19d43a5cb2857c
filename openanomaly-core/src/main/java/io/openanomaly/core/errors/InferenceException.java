package io.openanomaly.core.errors;

/** The model engine failed to produce a forecast or a trained model. */
public class InferenceException extends TaskException {
  public InferenceException(String message) {
    super(ErrorClass.INFERENCE, message);
  }

  public InferenceException(String message, Throwable cause) {
    super(ErrorClass.INFERENCE, message, cause);
  }
}
