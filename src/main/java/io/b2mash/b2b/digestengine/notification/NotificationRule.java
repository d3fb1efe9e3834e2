package io.b2mash.b2b.digestengine.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Subscription of a recipient list to event kinds, optionally narrowed to platforms and a minimum
 * number of added resources. Immutable: activation changes, edits and delivery stats all return a
 * new instance, which {@link NotificationRuleStore} swaps in.
 */
public final class NotificationRule {

  private final UUID id;
  private final String name;
  private final String description;
  private final boolean active;
  private final Set<TriggerKind> triggers;
  private final Set<String> platforms;
  private final List<String> recipients;
  private final String subjectTemplate;
  private final String bodyTemplate;
  private final Integer minResources;
  private final Instant lastTriggered;
  private final long totalSent;
  private final Instant createdAt;
  private final Instant updatedAt;

  private NotificationRule(
      UUID id,
      String name,
      String description,
      boolean active,
      Set<TriggerKind> triggers,
      Set<String> platforms,
      List<String> recipients,
      String subjectTemplate,
      String bodyTemplate,
      Integer minResources,
      Instant lastTriggered,
      long totalSent,
      Instant createdAt,
      Instant updatedAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.active = active;
    this.triggers =
        Collections.unmodifiableSet(
            triggers.isEmpty() ? EnumSet.noneOf(TriggerKind.class) : EnumSet.copyOf(triggers));
    this.platforms = Collections.unmodifiableSet(new LinkedHashSet<>(platforms));
    this.recipients = List.copyOf(recipients);
    this.subjectTemplate = Objects.requireNonNull(subjectTemplate, "subjectTemplate");
    this.bodyTemplate = Objects.requireNonNull(bodyTemplate, "bodyTemplate");
    this.minResources = minResources;
    this.lastTriggered = lastTriggered;
    this.totalSent = totalSent;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.updatedAt = updatedAt;
  }

  public static NotificationRule create(NotificationRuleDraft draft, Instant now) {
    return new NotificationRule(
        UUID.randomUUID(),
        draft.name().trim(),
        draft.description(),
        draft.active(),
        draft.triggers(),
        draft.platforms(),
        draft.recipients(),
        draft.subject(),
        draft.body(),
        draft.minResources(),
        null,
        0,
        now,
        now);
  }

  /** Replaces the configurable fields, keeping identity and delivery stats. */
  public NotificationRule withContent(NotificationRuleDraft draft, Instant now) {
    return new NotificationRule(
        id,
        draft.name().trim(),
        draft.description(),
        draft.active(),
        draft.triggers(),
        draft.platforms(),
        draft.recipients(),
        draft.subject(),
        draft.body(),
        draft.minResources(),
        lastTriggered,
        totalSent,
        createdAt,
        now);
  }

  public NotificationRule withActive(boolean active, Instant now) {
    return new NotificationRule(
        id,
        name,
        description,
        active,
        triggers,
        platforms,
        recipients,
        subjectTemplate,
        bodyTemplate,
        minResources,
        lastTriggered,
        totalSent,
        createdAt,
        now);
  }

  /** Stats after a successful delivery to {@code delivered} addresses. */
  public NotificationRule withDelivery(Instant sentAt, int delivered) {
    return new NotificationRule(
        id,
        name,
        description,
        active,
        triggers,
        platforms,
        recipients,
        subjectTemplate,
        bodyTemplate,
        minResources,
        sentAt,
        totalSent + delivered,
        createdAt,
        updatedAt);
  }

  public boolean isTriggeredBy(TriggerKind kind) {
    return triggers.contains(kind);
  }

  public boolean acceptsPlatform(String platform) {
    return platforms.isEmpty() || platforms.contains(platform);
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isActive() {
    return active;
  }

  public Set<TriggerKind> getTriggers() {
    return triggers;
  }

  public Set<String> getPlatforms() {
    return platforms;
  }

  public List<String> getRecipients() {
    return recipients;
  }

  public String getSubjectTemplate() {
    return subjectTemplate;
  }

  public String getBodyTemplate() {
    return bodyTemplate;
  }

  public Integer getMinResources() {
    return minResources;
  }

  public Instant getLastTriggered() {
    return lastTriggered;
  }

  public long getTotalSent() {
    return totalSent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
