package dev.trailanalytics.sex;

import java.util.Locale;

/** Competition category a result set or panel is restricted to. */
public enum Sex {
  MALE,
  FEMALE;

  /** Lower-case name for payloads and sort-state keys: {@code "male"}, {@code "female"}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a {@link #key()} back to its constant, ignoring case.
   *
   * @throws IllegalArgumentException if the key names no sex
   */
  public static Sex fromKey(String key) {
    for (Sex sex : values()) {
      if (sex.key().equalsIgnoreCase(key.trim())) {
        return sex;
      }
    }
    throw new IllegalArgumentException("Unknown sex: " + key + " (expected male or female)");
  }
}
