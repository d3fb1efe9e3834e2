package io.b2mash.b2b.digestengine.notification;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable record of one dispatch attempt. The rule name is copied at dispatch time so later
 * renames or deletions do not rewrite history.
 */
public record NotificationLogEntry(
    UUID id,
    UUID ruleId,
    String ruleName,
    String triggerType,
    String platform,
    List<String> recipients,
    String subject,
    NotificationStatus status,
    Instant sentAt,
    Integer resourcesCount,
    String errorMessage,
    Set<String> unresolvedVariables) {

  public NotificationLogEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ruleId, "ruleId");
    Objects.requireNonNull(status, "status");
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    unresolvedVariables = unresolvedVariables == null ? Set.of() : Set.copyOf(unresolvedVariables);
    if (status == NotificationStatus.FAILED && errorMessage == null) {
      throw new IllegalArgumentException("failed entries must carry an errorMessage");
    }
  }
}
