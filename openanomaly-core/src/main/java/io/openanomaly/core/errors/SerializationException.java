package io.openanomaly.core.errors;

/** A remote response could not be decoded in the configured format. */
public class SerializationException extends TaskException {
  public SerializationException(String message) {
    super(ErrorClass.SERIALIZATION, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ErrorClass.SERIALIZATION, message, cause);
  }
}
