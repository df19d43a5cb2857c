package io.openanomaly.core.common;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats durations in the Prometheus notation, e.g. {@code 1h30m}, {@code 5m} or
 * {@code 500ms}. ISO-8601 durations ({@code PT5M}) are accepted on input.
 */
public final class PromDurations {
  private static final Pattern COMPONENT = Pattern.compile("(\\d+)(ms|y|w|d|h|m|s)");
  private static final String[] UNITS = {"y", "w", "d", "h", "m", "s", "ms"};
  private static final long[] UNIT_MILLIS = {
    365L * 24 * 3600 * 1000,
    7L * 24 * 3600 * 1000,
    24L * 3600 * 1000,
    3600L * 1000,
    60L * 1000,
    1000L,
    1L
  };

  private PromDurations() {}

  public static Duration parse(String text) {
    Preconditions.checkArgument(text != null && !text.isBlank(), "duration must not be empty");
    String value = text.trim();
    if (value.startsWith("P") || value.startsWith("p")) {
      return Duration.parse(value);
    }
    Matcher matcher = COMPONENT.matcher(value);
    long millis = 0;
    int end = 0;
    while (matcher.find()) {
      if (matcher.start() != end) {
        break;
      }
      millis += Long.parseLong(matcher.group(1)) * unitMillis(matcher.group(2));
      end = matcher.end();
    }
    if (end == 0 || end != value.length()) {
      throw new IllegalArgumentException("invalid duration: " + text);
    }
    return Duration.ofMillis(millis);
  }

  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis == 0) {
      return "0s";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < UNITS.length; i++) {
      long count = millis / UNIT_MILLIS[i];
      if (count > 0) {
        sb.append(count).append(UNITS[i]);
        millis -= count * UNIT_MILLIS[i];
      }
    }
    return sb.toString();
  }

  private static long unitMillis(String unit) {
    for (int i = 0; i < UNITS.length; i++) {
      if (UNITS[i].equals(unit)) {
        return UNIT_MILLIS[i];
      }
    }
    throw new IllegalArgumentException("unknown duration unit " + unit);
  }
}
