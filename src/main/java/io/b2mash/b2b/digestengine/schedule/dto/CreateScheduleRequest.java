package io.b2mash.b2b.digestengine.schedule.dto;

import io.b2mash.b2b.digestengine.schedule.ScheduleDraft;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

/**
 * Field rules (frequency-specific days, HH:MM time, IANA zone) are checked together by the store
 * so a caller gets every violation in one response.
 */
public record CreateScheduleRequest(
    @Size(max = 200) String name,
    @Size(max = 2000) String description,
    String frequency,
    Integer dayOfWeek,
    Integer dayOfMonth,
    String timeOfDay,
    String timezone,
    List<UUID> recipientGroupIds,
    String templateId,
    Boolean enabled) {

  public ScheduleDraft toDraft() {
    return new ScheduleDraft(
        name,
        description,
        frequency,
        dayOfWeek,
        dayOfMonth,
        timeOfDay,
        timezone,
        recipientGroupIds,
        templateId);
  }

  public boolean enabledOrDefault() {
    return enabled == null || enabled;
  }
}
