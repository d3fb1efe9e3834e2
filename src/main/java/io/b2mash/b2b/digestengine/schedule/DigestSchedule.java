package io.b2mash.b2b.digestengine.schedule;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * A recurring digest job. Identity (id, createdAt and the recurrence anchor) never changes; edits
 * replace the mutable fields only. {@code nextRun} is present exactly when the schedule is enabled.
 *
 * <p>Mutators are package-private: all state changes go through {@link ScheduleStore}, which hands
 * out copies to everyone else.
 */
public class DigestSchedule {

  private final UUID id;
  private String name;
  private String description;
  private RecurrenceSpec recurrence;
  private boolean enabled;
  private Set<UUID> recipientGroupIds;
  private String templateId;
  private Instant lastRun;
  private Instant nextRun;
  private int totalRuns;
  private int successfulRuns;
  private final Instant createdAt;
  private Instant updatedAt;

  public DigestSchedule(
      String name,
      String description,
      RecurrenceSpec recurrence,
      Collection<UUID> recipientGroupIds,
      String templateId,
      Instant createdAt) {
    this.id = UUID.randomUUID();
    this.name = name;
    this.description = description;
    this.recurrence = recurrence;
    this.enabled = false;
    this.recipientGroupIds = Set.copyOf(recipientGroupIds);
    this.templateId = templateId;
    this.totalRuns = 0;
    this.successfulRuns = 0;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  private DigestSchedule(DigestSchedule source) {
    this.id = source.id;
    this.name = source.name;
    this.description = source.description;
    this.recurrence = source.recurrence;
    this.enabled = source.enabled;
    this.recipientGroupIds = source.recipientGroupIds;
    this.templateId = source.templateId;
    this.lastRun = source.lastRun;
    this.nextRun = source.nextRun;
    this.totalRuns = source.totalRuns;
    this.successfulRuns = source.successfulRuns;
    this.createdAt = source.createdAt;
    this.updatedAt = source.updatedAt;
  }

  DigestSchedule copy() {
    return new DigestSchedule(this);
  }

  void updateMutableFields(
      String name,
      String description,
      RecurrenceSpec recurrence,
      Collection<UUID> recipientGroupIds,
      String templateId,
      Instant now) {
    this.name = name;
    this.description = description;
    this.recurrence = recurrence;
    this.recipientGroupIds = Set.copyOf(recipientGroupIds);
    this.templateId = templateId;
    this.updatedAt = now;
  }

  /** Enabling requires the next run instant; disabling clears it. */
  void setEnabled(boolean enabled, Instant nextRun, Instant now) {
    if (enabled && nextRun == null) {
      throw new IllegalArgumentException("An enabled schedule needs a nextRun");
    }
    this.enabled = enabled;
    this.nextRun = enabled ? nextRun : null;
    this.updatedAt = now;
  }

  /** No-op on a disabled schedule, which never carries a nextRun. */
  void advanceNextRun(Instant nextRun) {
    if (enabled) {
      this.nextRun = nextRun;
    }
  }

  /** Run bookkeeping: counters only ever grow, one step per execution. */
  void recordExecution(Instant executedAt, boolean successful) {
    this.lastRun = executedAt;
    this.totalRuns++;
    if (successful) {
      this.successfulRuns++;
    }
    this.updatedAt = executedAt;
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

  public RecurrenceSpec getRecurrence() {
    return recurrence;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Set<UUID> getRecipientGroupIds() {
    return recipientGroupIds;
  }

  public String getTemplateId() {
    return templateId;
  }

  public Instant getLastRun() {
    return lastRun;
  }

  public Instant getNextRun() {
    return nextRun;
  }

  public int getTotalRuns() {
    return totalRuns;
  }

  public int getSuccessfulRuns() {
    return successfulRuns;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
