package io.b2mash.b2b.digestengine.schedule.dto;

import io.b2mash.b2b.digestengine.schedule.RecipientGroup;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record RecipientGroupResponse(
    UUID id,
    String name,
    String description,
    List<String> recipients,
    Set<String> severityLevels,
    Set<String> regulatoryAuthorities,
    Set<String> updateTypes,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt) {

  public static RecipientGroupResponse from(RecipientGroup group) {
    var filter = group.getFilter();
    return new RecipientGroupResponse(
        group.getId(),
        group.getName(),
        group.getDescription(),
        group.getRecipients(),
        filter.severityLevels(),
        filter.regulatoryAuthorities(),
        filter.updateTypes(),
        group.isEnabled(),
        group.getCreatedAt(),
        group.getUpdatedAt());
  }
}
