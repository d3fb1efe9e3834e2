package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.digestengine.exception.ResourceConflictException;
import io.b2mash.b2b.digestengine.exception.ResourceNotFoundException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds digest schedules and recipient groups. Every state change happens under the write lock and
 * callers only ever see copies, so a schedule read by the runner cannot change underneath it.
 *
 * <p>{@code nextRun} is recomputed here, via {@link RecurrenceCalculator}, whenever a schedule is
 * enabled, edited while enabled, or finishes a run.
 */
@Component
public class ScheduleStore {

  private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

  private static final Pattern TIME_OF_DAY = Pattern.compile("([01]\\d|2[0-3]):[0-5]\\d");

  private final RecurrenceCalculator calculator;
  private final Map<UUID, DigestSchedule> schedules = new LinkedHashMap<>();
  private final Map<UUID, RecipientGroup> groups = new LinkedHashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public ScheduleStore(RecurrenceCalculator calculator) {
    this.calculator = calculator;
  }

  // --- Schedules ---

  public DigestSchedule create(ScheduleDraft draft, boolean enabled, Instant now) {
    ZoneId zone = requireValidZone(draft);
    var recurrence = toRecurrence(draft, LocalDate.ofInstant(now, zone));
    var schedule =
        new DigestSchedule(
            draft.name().trim(),
            draft.description(),
            recurrence,
            draft.recipientGroupIds(),
            draft.templateId(),
            now);
    if (enabled) {
      schedule.setEnabled(true, calculator.nextRun(recurrence, now), now);
    }

    lock.writeLock().lock();
    try {
      schedules.put(schedule.getId(), schedule);
    } finally {
      lock.writeLock().unlock();
    }

    log.info(
        "Created digest schedule {} ({}), enabled={}",
        schedule.getId(),
        recurrence.describe(),
        enabled);
    return schedule.copy();
  }

  /** Replaces the mutable fields. The biweekly anchor is kept so the cycle does not shift. */
  public DigestSchedule update(UUID id, ScheduleDraft draft, Instant now) {
    requireValidZone(draft);
    lock.writeLock().lock();
    try {
      var schedule = requireSchedule(id);
      var recurrence = toRecurrence(draft, schedule.getRecurrence().anchorDate());
      schedule.updateMutableFields(
          draft.name().trim(),
          draft.description(),
          recurrence,
          draft.recipientGroupIds(),
          draft.templateId(),
          now);
      schedule.advanceNextRun(calculator.nextRun(recurrence, now));
      log.info("Updated digest schedule {} ({})", id, recurrence.describe());
      return schedule.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void delete(UUID id) {
    lock.writeLock().lock();
    try {
      var schedule = requireSchedule(id);
      if (schedule.isEnabled()) {
        throw new ResourceConflictException(
            "Cannot delete enabled schedule", "Schedule must be disabled before deletion.");
      }
      schedules.remove(id);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Deleted digest schedule {}", id);
  }

  public DigestSchedule get(UUID id) {
    lock.readLock().lock();
    try {
      return requireSchedule(id).copy();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** All schedules, newest first. */
  public List<DigestSchedule> list() {
    lock.readLock().lock();
    try {
      return schedules.values().stream()
          .sorted(Comparator.comparing(DigestSchedule::getCreatedAt).reversed())
          .map(DigestSchedule::copy)
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Enabling computes a fresh nextRun from {@code now}; disabling clears it. */
  public DigestSchedule setEnabled(UUID id, boolean enabled, Instant now) {
    lock.writeLock().lock();
    try {
      var schedule = requireSchedule(id);
      Instant nextRun = enabled ? calculator.nextRun(schedule.getRecurrence(), now) : null;
      schedule.setEnabled(enabled, nextRun, now);
      log.info("Digest schedule {} {}, nextRun={}", id, enabled ? "enabled" : "disabled", nextRun);
      return schedule.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Enabled schedules with {@code nextRun <= now}, earliest first, ties broken by id. */
  public List<DigestSchedule> dueSchedules(Instant now) {
    lock.readLock().lock();
    try {
      return schedules.values().stream()
          .filter(DigestSchedule::isEnabled)
          .filter(s -> s.getNextRun() != null && !s.getNextRun().isAfter(now))
          .sorted(
              Comparator.comparing(DigestSchedule::getNextRun)
                  .thenComparing(DigestSchedule::getId))
          .map(DigestSchedule::copy)
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Applies the bookkeeping of a finished run: lastRun, counters, and a nextRun recomputed from the
   * recurrence and the execution time. A failed run therefore waits for the next natural slot.
   */
  public DigestSchedule recordExecution(ScheduleExecution execution) {
    lock.writeLock().lock();
    try {
      var schedule = requireSchedule(execution.getScheduleId());
      schedule.recordExecution(execution.getExecutedAt(), execution.isSuccessful());
      schedule.advanceNextRun(
          calculator.nextRun(schedule.getRecurrence(), execution.getExecutedAt()));
      return schedule.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Distinct addresses across the schedule's groups. Unknown or disabled groups contribute nothing.
   */
  public List<String> resolveRecipients(DigestSchedule schedule) {
    lock.readLock().lock();
    try {
      var recipients = new LinkedHashSet<String>();
      schedule.getRecipientGroupIds().stream()
          .sorted()
          .map(groups::get)
          .filter(g -> g != null && g.isEnabled())
          .forEach(g -> recipients.addAll(g.getRecipients()));
      return List.copyOf(recipients);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Filters of the schedule's enabled groups, used to scope generated content. */
  public List<RecipientFilter> recipientFilters(DigestSchedule schedule) {
    lock.readLock().lock();
    try {
      return schedule.getRecipientGroupIds().stream()
          .sorted()
          .map(groups::get)
          .filter(g -> g != null && g.isEnabled())
          .map(RecipientGroup::getFilter)
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public ScheduleStats stats() {
    lock.readLock().lock();
    try {
      int active = (int) schedules.values().stream().filter(DigestSchedule::isEnabled).count();
      Set<String> recipients = new LinkedHashSet<>();
      groups.values().stream()
          .filter(RecipientGroup::isEnabled)
          .forEach(g -> recipients.addAll(g.getRecipients()));
      long totalRuns = schedules.values().stream().mapToLong(DigestSchedule::getTotalRuns).sum();
      long successfulRuns =
          schedules.values().stream().mapToLong(DigestSchedule::getSuccessfulRuns).sum();
      int successRate =
          totalRuns > 0 ? (int) Math.round(successfulRuns * 100.0 / totalRuns) : 100;
      return new ScheduleStats(schedules.size(), active, recipients.size(), successRate);
    } finally {
      lock.readLock().unlock();
    }
  }

  // --- Recipient groups ---

  public RecipientGroup createGroup(RecipientGroupDraft draft, Instant now) {
    validateGroup(draft);
    var group =
        new RecipientGroup(
            draft.name().trim(),
            draft.description(),
            draft.recipients(),
            draft.filter(),
            draft.enabled(),
            now);
    lock.writeLock().lock();
    try {
      groups.put(group.getId(), group);
    } finally {
      lock.writeLock().unlock();
    }
    log.info(
        "Created recipient group {} with {} recipients",
        group.getId(),
        group.getRecipients().size());
    return group.copy();
  }

  public RecipientGroup updateGroup(UUID id, RecipientGroupDraft draft, Instant now) {
    validateGroup(draft);
    lock.writeLock().lock();
    try {
      var group = requireGroup(id);
      group.updateMutableFields(
          draft.name().trim(),
          draft.description(),
          draft.recipients(),
          draft.filter(),
          draft.enabled(),
          now);
      return group.copy();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Schedules still referencing the group simply resolve zero recipients from it. */
  public void deleteGroup(UUID id) {
    lock.writeLock().lock();
    try {
      requireGroup(id);
      groups.remove(id);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Deleted recipient group {}", id);
  }

  public RecipientGroup getGroup(UUID id) {
    lock.readLock().lock();
    try {
      return requireGroup(id).copy();
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<RecipientGroup> listGroups() {
    lock.readLock().lock();
    try {
      return groups.values().stream().map(RecipientGroup::copy).toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  // --- Validation ---

  private ZoneId requireValidZone(ScheduleDraft draft) {
    var violations = validate(draft);
    if (!violations.isEmpty()) {
      throw new InvalidConfigurationException("Invalid schedule", violations);
    }
    return ZoneId.of(draft.timezone());
  }

  /** Collects every violation so callers can fix them in one round trip. */
  List<String> validate(ScheduleDraft draft) {
    var violations = new ArrayList<String>();
    if (draft.name() == null || draft.name().isBlank()) {
      violations.add("name is required");
    }
    Frequency frequency = null;
    try {
      frequency = Frequency.fromWireName(draft.frequency());
    } catch (IllegalArgumentException e) {
      violations.add("frequency must be one of daily, weekly, biweekly, monthly");
    }
    if (draft.timeOfDay() == null || !TIME_OF_DAY.matcher(draft.timeOfDay()).matches()) {
      violations.add("timeOfDay must be a 24-hour HH:MM time");
    }
    if (draft.timezone() == null || !ZoneId.getAvailableZoneIds().contains(draft.timezone())) {
      violations.add("timezone must be an IANA zone id");
    }
    if (draft.recipientGroupIds().contains(null)) {
      violations.add("recipientGroupIds must not contain null");
    }
    if (frequency != null && frequency.requiresDayOfWeek()) {
      if (draft.dayOfWeek() == null) {
        violations.add(frequency.wireName() + " schedules require dayOfWeek");
      } else if (draft.dayOfWeek() < 0 || draft.dayOfWeek() > 6) {
        violations.add("dayOfWeek must be between 0 (Sunday) and 6 (Saturday)");
      }
    }
    if (frequency != null && frequency.requiresDayOfMonth()) {
      if (draft.dayOfMonth() == null) {
        violations.add("monthly schedules require dayOfMonth");
      } else if (draft.dayOfMonth() < 1 || draft.dayOfMonth() > 28) {
        violations.add("dayOfMonth must be between 1 and 28");
      }
    }
    return violations;
  }

  private RecurrenceSpec toRecurrence(ScheduleDraft draft, LocalDate anchorDate) {
    var frequency = Frequency.fromWireName(draft.frequency());
    return new RecurrenceSpec(
        frequency,
        frequency.requiresDayOfWeek() ? draft.dayOfWeek() : null,
        frequency.requiresDayOfMonth() ? draft.dayOfMonth() : null,
        LocalTime.parse(draft.timeOfDay()),
        ZoneId.of(draft.timezone()),
        anchorDate);
  }

  private void validateGroup(RecipientGroupDraft draft) {
    var violations = new ArrayList<String>();
    if (draft.name() == null || draft.name().isBlank()) {
      violations.add("name is required");
    }
    if (draft.recipients().contains(null)) {
      violations.add("recipients must not contain null");
    }
    draft.recipients().stream()
        .filter(r -> r != null && !r.isBlank() && !r.contains("@"))
        .forEach(r -> violations.add("not an email address: " + r));
    if (!violations.isEmpty()) {
      throw new InvalidConfigurationException("Invalid recipient group", violations);
    }
  }

  private DigestSchedule requireSchedule(UUID id) {
    var schedule = schedules.get(id);
    if (schedule == null) {
      throw new ResourceNotFoundException("DigestSchedule", id);
    }
    return schedule;
  }

  private RecipientGroup requireGroup(UUID id) {
    var group = groups.get(id);
    if (group == null) {
      throw new ResourceNotFoundException("RecipientGroup", id);
    }
    return group;
  }
}
