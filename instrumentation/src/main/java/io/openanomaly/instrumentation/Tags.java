package io.openanomaly.instrumentation;

import java.util.Map;

/** Constant tag keys and values shared by structured logs and metrics. */
public final class Tags {
  private Tags() {}

  public static final class Key {
    public static final String reason = "reason";
    public static final String result = "result";

    private Key() {}
  }

  public static final class Value {
    public static final String success = "success";
    public static final String failure = "failure";

    private Value() {}
  }

  /**
   * Copies "key, value, key, value, ..." varargs into the destination map. A trailing key without
   * value is ignored.
   */
  static void copyTags(Map<String, String> destination, String... source) {
    for (int i = 0; i + 1 < source.length; i += 2) {
      destination.put(source[i], source[i + 1]);
    }
  }
}
