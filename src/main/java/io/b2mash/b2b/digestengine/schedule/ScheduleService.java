package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.exception.ResourceConflictException;
import io.b2mash.b2b.digestengine.history.ExecutionLog;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Management operations on schedules, stamped with the engine clock. */
@Service
public class ScheduleService {

  private final ScheduleStore scheduleStore;
  private final ExecutionRunner executionRunner;
  private final ExecutionLog executionLog;
  private final Clock clock;

  public ScheduleService(
      ScheduleStore scheduleStore,
      ExecutionRunner executionRunner,
      ExecutionLog executionLog,
      Clock clock) {
    this.scheduleStore = scheduleStore;
    this.executionRunner = executionRunner;
    this.executionLog = executionLog;
    this.clock = clock;
  }

  public List<DigestSchedule> list() {
    return scheduleStore.list();
  }

  public DigestSchedule get(UUID id) {
    return scheduleStore.get(id);
  }

  public DigestSchedule create(ScheduleDraft draft, boolean enabled) {
    return scheduleStore.create(draft, enabled, clock.instant());
  }

  public DigestSchedule update(UUID id, ScheduleDraft draft) {
    return scheduleStore.update(id, draft, clock.instant());
  }

  public void delete(UUID id) {
    scheduleStore.delete(id);
    executionRunner.forget(id);
  }

  public DigestSchedule enable(UUID id) {
    return scheduleStore.setEnabled(id, true, clock.instant());
  }

  public DigestSchedule disable(UUID id) {
    return scheduleStore.setEnabled(id, false, clock.instant());
  }

  /**
   * Runs the schedule immediately, whether or not it is enabled or due.
   *
   * @throws ResourceConflictException if a run of the same schedule is already in progress
   */
  public ScheduleExecution runNow(UUID id) {
    return executionRunner
        .run(id, clock.instant(), ExecutionTrigger.MANUAL)
        .orElseThrow(
            () ->
                new ResourceConflictException(
                    "Schedule already running",
                    "A run of schedule " + id + " is already in progress."));
  }

  public List<ScheduleExecution> listExecutions(UUID id, int limit) {
    scheduleStore.get(id);
    return executionLog.forSchedule(id, limit);
  }

  public List<ScheduleExecution> recentExecutions(int limit) {
    return executionLog.recent(limit);
  }

  public ScheduleStats stats() {
    return scheduleStore.stats();
  }
}
