package io.b2mash.b2b.digestengine.schedule;

import java.util.Arrays;

/** How often a digest schedule fires. */
public enum Frequency {
  DAILY("daily"),
  WEEKLY("weekly"),
  BIWEEKLY("biweekly"),
  MONTHLY("monthly");

  private final String wireName;

  Frequency(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean requiresDayOfWeek() {
    return this == WEEKLY || this == BIWEEKLY;
  }

  public boolean requiresDayOfMonth() {
    return this == MONTHLY;
  }

  /**
   * Parses the lowercase wire name ("daily", "weekly", ...).
   *
   * @throws IllegalArgumentException for an unknown value
   */
  public static Frequency fromWireName(String value) {
    return Arrays.stream(values())
        .filter(f -> f.wireName.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown frequency: " + value));
  }
}
