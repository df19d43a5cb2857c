package io.openanomaly.core.errors;

/** No stored forecast covers the window being scored. */
public class ForecastUnavailableException extends DataUnavailableException {
  public ForecastUnavailableException(String message) {
    super(message);
  }
}
