package io.b2mash.b2b.digestengine.notification;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Clock;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Accepts events from platform integrations. Dispatch continues after the 202 response. */
@RestController
@RequestMapping("/api/events")
public class ResourceEventController {

  private final ResourceEventHandler eventHandler;
  private final Clock clock;

  public ResourceEventController(ResourceEventHandler eventHandler, Clock clock) {
    this.eventHandler = eventHandler;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<EventAcceptedResponse> submitEvent(
      @Valid @RequestBody ResourceEventRequest request) {
    var resources =
        request.resources() == null
            ? List.<ResourceSummary>of()
            : request.resources().stream()
                .map(r -> new ResourceSummary(r.title(), r.type()))
                .toList();
    var event =
        new ResourceEvent(
            TriggerKind.fromWireName(request.kind()),
            request.platform(),
            request.resourcesAdded(),
            request.resourcesUpdated(),
            resources,
            request.errorMessage(),
            clock.instant());
    var batch = eventHandler.ingest(event);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new EventAcceptedResponse(batch.matchedRules()));
  }

  // --- DTOs ---

  public record ResourceEventRequest(
      @NotNull @Pattern(regexp = TriggerKind.WIRE_PATTERN) String kind,
      @NotBlank String platform,
      @PositiveOrZero Integer resourcesAdded,
      @PositiveOrZero Integer resourcesUpdated,
      List<@Valid ResourceItem> resources,
      String errorMessage) {}

  public record ResourceItem(@NotBlank String title, String type) {}

  public record EventAcceptedResponse(int matchedRules) {}
}
