package io.b2mash.b2b.digestengine.notification.template;

import java.util.Arrays;

public enum TemplateCategory {
  SYNC("sync"),
  RESOURCES("resources"),
  REMINDERS("reminders"),
  ALERTS("alerts");

  private final String wireName;

  TemplateCategory(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static TemplateCategory fromWireName(String value) {
    return Arrays.stream(values())
        .filter(c -> c.wireName.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown template category: " + value));
  }
}
