package io.b2mash.b2b.digestengine.schedule.dto;

import io.b2mash.b2b.digestengine.schedule.RecipientFilter;
import io.b2mash.b2b.digestengine.schedule.RecipientGroupDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Set;

public record RecipientGroupRequest(
    @NotBlank @Size(max = 200) String name,
    @Size(max = 2000) String description,
    List<String> recipients,
    Set<String> severityLevels,
    Set<String> regulatoryAuthorities,
    Set<String> updateTypes,
    Boolean enabled) {

  public RecipientGroupDraft toDraft() {
    return new RecipientGroupDraft(
        name,
        description,
        recipients,
        new RecipientFilter(severityLevels, regulatoryAuthorities, updateTypes),
        enabled == null || enabled);
  }
}
