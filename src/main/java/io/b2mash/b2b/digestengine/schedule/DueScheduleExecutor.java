package io.b2mash.b2b.digestengine.schedule;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Poll loop that hands every due schedule to the runner pool. A schedule already queued or running
 * from an earlier poll is not submitted again. Errors in one schedule never stop the loop.
 */
@Component
public class DueScheduleExecutor {

  private static final Logger log = LoggerFactory.getLogger(DueScheduleExecutor.class);

  private final ScheduleStore scheduleStore;
  private final ExecutionRunner executionRunner;
  private final TaskExecutor runnerExecutor;
  private final Clock clock;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public DueScheduleExecutor(
      ScheduleStore scheduleStore,
      ExecutionRunner executionRunner,
      @Qualifier("scheduleRunnerExecutor") TaskExecutor runnerExecutor,
      Clock clock) {
    this.scheduleStore = scheduleStore;
    this.executionRunner = executionRunner;
    this.runnerExecutor = runnerExecutor;
    this.clock = clock;
  }

  /**
   * Submits due schedules, earliest first.
   *
   * @return how many runs were submitted by this poll
   */
  @Scheduled(
      fixedDelayString = "${digest-engine.scheduler.poll-interval-ms:30000}",
      initialDelayString = "${digest-engine.scheduler.initial-delay-ms:5000}")
  public int pollDueSchedules() {
    var now = clock.instant();
    var due = scheduleStore.dueSchedules(now);
    log.debug("Poll at {} found {} due schedules", now, due.size());

    int submitted = 0;
    for (var schedule : due) {
      var scheduleId = schedule.getId();
      if (!inFlight.add(scheduleId)) {
        continue;
      }
      try {
        runnerExecutor.execute(() -> runSafely(scheduleId));
        submitted++;
      } catch (TaskRejectedException e) {
        inFlight.remove(scheduleId);
        log.warn("Runner pool rejected schedule {}, will retry on next poll", scheduleId);
      }
    }
    return submitted;
  }

  private void runSafely(UUID scheduleId) {
    try {
      executionRunner.run(scheduleId, clock.instant(), ExecutionTrigger.TIMER);
    } catch (Exception e) {
      log.error("Unexpected failure running schedule {}", scheduleId, e);
    } finally {
      inFlight.remove(scheduleId);
    }
  }
}
