package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.schedule.dto.RecipientGroupRequest;
import io.b2mash.b2b.digestengine.schedule.dto.RecipientGroupResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Clock;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recipient-groups")
public class RecipientGroupController {

  private final ScheduleStore scheduleStore;
  private final Clock clock;

  public RecipientGroupController(ScheduleStore scheduleStore, Clock clock) {
    this.scheduleStore = scheduleStore;
    this.clock = clock;
  }

  @GetMapping
  public ResponseEntity<List<RecipientGroupResponse>> listGroups() {
    return ResponseEntity.ok(
        scheduleStore.listGroups().stream().map(RecipientGroupResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<RecipientGroupResponse> getGroup(@PathVariable UUID id) {
    return ResponseEntity.ok(RecipientGroupResponse.from(scheduleStore.getGroup(id)));
  }

  @PostMapping
  public ResponseEntity<RecipientGroupResponse> createGroup(
      @Valid @RequestBody RecipientGroupRequest request) {
    var group = scheduleStore.createGroup(request.toDraft(), clock.instant());
    return ResponseEntity.created(URI.create("/api/recipient-groups/" + group.getId()))
        .body(RecipientGroupResponse.from(group));
  }

  @PutMapping("/{id}")
  public ResponseEntity<RecipientGroupResponse> updateGroup(
      @PathVariable UUID id, @Valid @RequestBody RecipientGroupRequest request) {
    return ResponseEntity.ok(
        RecipientGroupResponse.from(
            scheduleStore.updateGroup(id, request.toDraft(), clock.instant())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteGroup(@PathVariable UUID id) {
    scheduleStore.deleteGroup(id);
    return ResponseEntity.noContent().build();
  }
}
