package io.b2mash.b2b.digestengine.notification;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record NotificationLogResponse(
    UUID id,
    UUID ruleId,
    String ruleName,
    String triggerType,
    String platform,
    List<String> recipients,
    String subject,
    String status,
    Instant sentAt,
    Integer resourcesCount,
    String errorMessage,
    Set<String> unresolvedVariables) {

  public static NotificationLogResponse from(NotificationLogEntry entry) {
    return new NotificationLogResponse(
        entry.id(),
        entry.ruleId(),
        entry.ruleName(),
        entry.triggerType(),
        entry.platform(),
        entry.recipients(),
        entry.subject(),
        entry.status().name().toLowerCase(),
        entry.sentAt(),
        entry.resourcesCount(),
        entry.errorMessage(),
        entry.unresolvedVariables());
  }
}
