package io.b2mash.b2b.digestengine.notification;

import java.util.Arrays;

/** Event kinds a notification rule can subscribe to. */
public enum TriggerKind {
  SYNC_SUCCESS("sync_success"),
  SYNC_FAILURE("sync_failure"),
  NEW_RESOURCES("new_resources"),
  UPDATED_RESOURCES("updated_resources"),
  CERTIFICATION_AVAILABLE("certification_available"),
  DEADLINE_REMINDER("deadline_reminder");

  /** Matches any wire name, for request validation. */
  public static final String WIRE_PATTERN =
      "sync_success|sync_failure|new_resources|updated_resources|certification_available"
          + "|deadline_reminder";

  private final String wireName;

  TriggerKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static TriggerKind fromWireName(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.wireName.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown trigger kind: " + value));
  }
}
