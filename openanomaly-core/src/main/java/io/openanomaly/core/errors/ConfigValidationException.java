package io.openanomaly.core.errors;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A pipeline definition failed validation. */
public class ConfigValidationException extends TaskException {
  private final List<String> violations;

  public ConfigValidationException(String message) {
    this(ImmutableList.of(message));
  }

  public ConfigValidationException(List<String> violations) {
    super(ErrorClass.CONFIG_VALIDATION, String.join("; ", violations));
    this.violations = ImmutableList.copyOf(violations);
  }

  public ConfigValidationException(String message, Throwable cause) {
    super(ErrorClass.CONFIG_VALIDATION, message, cause);
    this.violations = ImmutableList.of(message);
  }

  public List<String> getViolations() {
    return violations;
  }
}
