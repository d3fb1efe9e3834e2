package io.b2mash.b2b.digestengine.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One concrete run of a digest schedule, successful or not. Immutable after creation: no setters,
 * no update methods. {@code errorMessage} is present exactly when the status is not SUCCESS.
 */
public final class ScheduleExecution {

  private final UUID id;
  private final UUID scheduleId;
  private final ExecutionTrigger trigger;
  private final Instant executedAt;
  private final ExecutionStatus status;
  private final int recipientCount;
  private final int itemsIncluded;
  private final int criticalItems;
  private final long durationMs;
  private final String errorMessage;
  private final String digestId;

  public ScheduleExecution(
      UUID scheduleId,
      ExecutionTrigger trigger,
      Instant executedAt,
      ExecutionStatus status,
      int recipientCount,
      int itemsIncluded,
      int criticalItems,
      long durationMs,
      String errorMessage,
      String digestId) {
    this.id = UUID.randomUUID();
    this.scheduleId = Objects.requireNonNull(scheduleId, "scheduleId");
    this.trigger = Objects.requireNonNull(trigger, "trigger");
    this.executedAt = Objects.requireNonNull(executedAt, "executedAt");
    this.status = Objects.requireNonNull(status, "status");
    if ((status == ExecutionStatus.SUCCESS) != (errorMessage == null)) {
      throw new IllegalArgumentException(
          "errorMessage must be present exactly when status is not SUCCESS (status="
              + status
              + ")");
    }
    this.recipientCount = recipientCount;
    this.itemsIncluded = itemsIncluded;
    this.criticalItems = criticalItems;
    this.durationMs = durationMs;
    this.errorMessage = errorMessage;
    this.digestId = digestId;
  }

  /** A run that delivered nothing. Counts are zero because no digest went out. */
  public static ScheduleExecution failed(
      UUID scheduleId,
      ExecutionTrigger trigger,
      Instant executedAt,
      long durationMs,
      String errorMessage) {
    return new ScheduleExecution(
        scheduleId,
        trigger,
        executedAt,
        ExecutionStatus.FAILED,
        0,
        0,
        0,
        durationMs,
        errorMessage != null ? errorMessage : "Unknown error",
        null);
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public ExecutionTrigger getTrigger() {
    return trigger;
  }

  public Instant getExecutedAt() {
    return executedAt;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public boolean isSuccessful() {
    return status == ExecutionStatus.SUCCESS;
  }

  public int getRecipientCount() {
    return recipientCount;
  }

  public int getItemsIncluded() {
    return itemsIncluded;
  }

  public int getCriticalItems() {
    return criticalItems;
  }

  public long getDurationMs() {
    return durationMs;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getDigestId() {
    return digestId;
  }
}
