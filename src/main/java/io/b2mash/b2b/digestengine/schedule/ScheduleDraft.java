package io.b2mash.b2b.digestengine.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Unvalidated schedule fields as supplied by a management caller. {@link ScheduleStore} validates
 * them and builds the {@link RecurrenceSpec}.
 */
public record ScheduleDraft(
    String name,
    String description,
    String frequency,
    Integer dayOfWeek,
    Integer dayOfMonth,
    String timeOfDay,
    String timezone,
    List<UUID> recipientGroupIds,
    String templateId) {

  public ScheduleDraft {
    recipientGroupIds =
        recipientGroupIds == null
            ? Collections.<UUID>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(recipientGroupIds));
  }
}
