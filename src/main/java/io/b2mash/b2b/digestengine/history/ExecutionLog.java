package io.b2mash.b2b.digestengine.history;

import io.b2mash.b2b.digestengine.schedule.ScheduleExecution;
import java.util.List;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Most recent digest executions across all schedules. */
@Component
public class ExecutionLog extends BoundedLog<ScheduleExecution> {

  public ExecutionLog(@Value("${digest-engine.history.execution-capacity:100}") int capacity) {
    super(capacity);
  }

  public List<ScheduleExecution> forSchedule(UUID scheduleId, int limit) {
    return recent(execution -> execution.getScheduleId().equals(scheduleId), limit);
  }
}
