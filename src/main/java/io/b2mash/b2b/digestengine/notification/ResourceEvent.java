package io.b2mash.b2b.digestengine.notification;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Something that happened on a learning platform: a sync finished or failed, resources appeared or
 * changed, a certification or deadline came up. Published in-process through Spring's application
 * events or posted to {@code /api/events}.
 *
 * @param resourcesAdded {@code null} when the source did not report a count
 */
public record ResourceEvent(
    TriggerKind kind,
    String platform,
    Integer resourcesAdded,
    Integer resourcesUpdated,
    List<ResourceSummary> resources,
    String errorMessage,
    Instant occurredAt) {

  public ResourceEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(occurredAt, "occurredAt");
    resources = resources == null ? List.of() : List.copyOf(resources);
  }

  /** Added count for filtering; a missing count is zero. */
  public int addedCount() {
    return resourcesAdded != null ? resourcesAdded : 0;
  }

  /** Count shown to recipients: the reported added count, else the number of listed resources. */
  public int displayedCount() {
    if (resourcesAdded != null) {
      return resourcesAdded;
    }
    return resources.size();
  }
}
