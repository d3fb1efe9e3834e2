package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.integration.email.EmailAddresses;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * A named set of digest addressees. Addresses are stored normalized (trimmed, lowercase) so the
 * same mailbox is never counted twice.
 */
public class RecipientGroup {

  private final UUID id;
  private String name;
  private String description;
  private List<String> recipients;
  private RecipientFilter filter;
  private boolean enabled;
  private final Instant createdAt;
  private Instant updatedAt;

  public RecipientGroup(
      String name,
      String description,
      Collection<String> recipients,
      RecipientFilter filter,
      boolean enabled,
      Instant createdAt) {
    this(UUID.randomUUID(), name, description, recipients, filter, enabled, createdAt, createdAt);
  }

  private RecipientGroup(
      UUID id,
      String name,
      String description,
      Collection<String> recipients,
      RecipientFilter filter,
      boolean enabled,
      Instant createdAt,
      Instant updatedAt) {
    this.id = id;
    this.name = name;
    this.description = description;
    this.recipients = EmailAddresses.normalize(recipients);
    this.filter = filter != null ? filter : RecipientFilter.none();
    this.enabled = enabled;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  void updateMutableFields(
      String name,
      String description,
      Collection<String> recipients,
      RecipientFilter filter,
      boolean enabled,
      Instant now) {
    this.name = name;
    this.description = description;
    this.recipients = EmailAddresses.normalize(recipients);
    this.filter = filter != null ? filter : RecipientFilter.none();
    this.enabled = enabled;
    this.updatedAt = now;
  }

  RecipientGroup copy() {
    return new RecipientGroup(
        id, name, description, recipients, filter, enabled, createdAt, updatedAt);
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

  public List<String> getRecipients() {
    return recipients;
  }

  public RecipientFilter getFilter() {
    return filter;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
