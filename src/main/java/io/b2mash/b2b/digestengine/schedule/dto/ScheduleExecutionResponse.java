package io.b2mash.b2b.digestengine.schedule.dto;

import io.b2mash.b2b.digestengine.schedule.ScheduleExecution;
import java.time.Instant;
import java.util.UUID;

public record ScheduleExecutionResponse(
    UUID id,
    UUID scheduleId,
    String trigger,
    Instant executedAt,
    String status,
    int recipientCount,
    int itemsIncluded,
    int criticalItems,
    long durationMs,
    String errorMessage,
    String digestId) {

  public static ScheduleExecutionResponse from(ScheduleExecution execution) {
    return new ScheduleExecutionResponse(
        execution.getId(),
        execution.getScheduleId(),
        execution.getTrigger().name().toLowerCase(),
        execution.getExecutedAt(),
        execution.getStatus().name().toLowerCase(),
        execution.getRecipientCount(),
        execution.getItemsIncluded(),
        execution.getCriticalItems(),
        execution.getDurationMs(),
        execution.getErrorMessage(),
        execution.getDigestId());
  }
}
