package io.b2mash.b2b.digestengine.integration.email;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload addressed to one or more recipients, with optional metadata for
 * tracking (schedule id, rule id, trigger type).
 */
public record EmailMessage(
    List<String> recipients, String subject, String body, Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(recipients, "recipients");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    if (recipients.isEmpty()) {
      throw new IllegalArgumentException("recipients must not be empty");
    }
    recipients = List.copyOf(recipients);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Builds a message tagged with the entity it was sent for.
   *
   * @param referenceType the kind of entity, e.g. "SCHEDULE" or "NOTIFICATION_RULE"
   * @param referenceId the id of that entity
   */
  public static EmailMessage withTracking(
      List<String> recipients,
      String subject,
      String body,
      String referenceType,
      String referenceId) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(referenceId, "referenceId");
    return new EmailMessage(
        recipients,
        subject,
        body,
        Map.of("referenceType", referenceType, "referenceId", referenceId));
  }
}
