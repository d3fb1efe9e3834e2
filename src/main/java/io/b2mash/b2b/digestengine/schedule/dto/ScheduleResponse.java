package io.b2mash.b2b.digestengine.schedule.dto;

import io.b2mash.b2b.digestengine.schedule.DigestSchedule;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record ScheduleResponse(
    UUID id,
    String name,
    String description,
    String frequency,
    Integer dayOfWeek,
    Integer dayOfMonth,
    String timeOfDay,
    String timezone,
    String recurrence,
    LocalDate anchorDate,
    boolean enabled,
    List<UUID> recipientGroupIds,
    String templateId,
    Instant lastRun,
    Instant nextRun,
    int totalRuns,
    int successfulRuns,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduleResponse from(DigestSchedule schedule) {
    var recurrence = schedule.getRecurrence();
    return new ScheduleResponse(
        schedule.getId(),
        schedule.getName(),
        schedule.getDescription(),
        recurrence.frequency().wireName(),
        recurrence.dayOfWeek(),
        recurrence.dayOfMonth(),
        recurrence.timeOfDay().toString(),
        recurrence.zone().getId(),
        recurrence.describe(),
        recurrence.anchorDate(),
        schedule.isEnabled(),
        schedule.getRecipientGroupIds().stream().sorted().toList(),
        schedule.getTemplateId(),
        schedule.getLastRun(),
        schedule.getNextRun(),
        schedule.getTotalRuns(),
        schedule.getSuccessfulRuns(),
        schedule.getCreatedAt(),
        schedule.getUpdatedAt());
  }
}
