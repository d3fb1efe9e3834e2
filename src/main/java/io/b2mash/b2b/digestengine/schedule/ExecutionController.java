package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.schedule.dto.ScheduleExecutionResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Recent executions across all schedules, newest first. */
@RestController
@RequestMapping("/api/executions")
public class ExecutionController {

  private final ScheduleService scheduleService;

  public ExecutionController(ScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping
  public ResponseEntity<List<ScheduleExecutionResponse>> listRecentExecutions(
      @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(
        scheduleService.recentExecutions(ScheduleController.clampLimit(limit)).stream()
            .map(ScheduleExecutionResponse::from)
            .toList());
  }
}
