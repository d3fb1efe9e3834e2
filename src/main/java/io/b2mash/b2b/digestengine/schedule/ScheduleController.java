package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.schedule.dto.CreateScheduleRequest;
import io.b2mash.b2b.digestengine.schedule.dto.ScheduleExecutionResponse;
import io.b2mash.b2b.digestengine.schedule.dto.ScheduleResponse;
import io.b2mash.b2b.digestengine.schedule.dto.UpdateScheduleRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

  private final ScheduleService scheduleService;

  public ScheduleController(ScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping
  public ResponseEntity<List<ScheduleResponse>> listSchedules() {
    return ResponseEntity.ok(scheduleService.list().stream().map(ScheduleResponse::from).toList());
  }

  @GetMapping("/stats")
  public ResponseEntity<ScheduleStats> getStats() {
    return ResponseEntity.ok(scheduleService.stats());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.get(id)));
  }

  @PostMapping
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request) {
    var schedule = scheduleService.create(request.toDraft(), request.enabledOrDefault());
    return ResponseEntity.created(URI.create("/api/schedules/" + schedule.getId()))
        .body(ScheduleResponse.from(schedule));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @PathVariable UUID id, @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.update(id, request.toDraft())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSchedule(@PathVariable UUID id) {
    scheduleService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/enable")
  public ResponseEntity<ScheduleResponse> enableSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.enable(id)));
  }

  @PostMapping("/{id}/disable")
  public ResponseEntity<ScheduleResponse> disableSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(ScheduleResponse.from(scheduleService.disable(id)));
  }

  @PostMapping("/{id}/run")
  public ResponseEntity<ScheduleExecutionResponse> runSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(ScheduleExecutionResponse.from(scheduleService.runNow(id)));
  }

  @GetMapping("/{id}/executions")
  public ResponseEntity<List<ScheduleExecutionResponse>> listExecutions(
      @PathVariable UUID id, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(
        scheduleService.listExecutions(id, clampLimit(limit)).stream()
            .map(ScheduleExecutionResponse::from)
            .toList());
  }

  static int clampLimit(int limit) {
    return Math.max(1, Math.min(limit, 100));
  }
}
