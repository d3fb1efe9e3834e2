package io.b2mash.b2b.digestengine.notification;

import io.b2mash.b2b.digestengine.notification.template.EmailTemplateService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
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
@RequestMapping("/api/notification-rules")
public class NotificationRuleController {

  private final NotificationRuleStore ruleStore;
  private final NotificationDispatcher dispatcher;
  private final EmailTemplateService templateService;
  private final Clock clock;

  public NotificationRuleController(
      NotificationRuleStore ruleStore,
      NotificationDispatcher dispatcher,
      EmailTemplateService templateService,
      Clock clock) {
    this.ruleStore = ruleStore;
    this.dispatcher = dispatcher;
    this.templateService = templateService;
    this.clock = clock;
  }

  @GetMapping
  public ResponseEntity<List<RuleResponse>> listRules() {
    return ResponseEntity.ok(ruleStore.snapshot().stream().map(RuleResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<RuleResponse> getRule(@PathVariable UUID id) {
    return ResponseEntity.ok(RuleResponse.from(ruleStore.get(id)));
  }

  @PostMapping
  public ResponseEntity<RuleResponse> createRule(@Valid @RequestBody RuleRequest request) {
    var rule = ruleStore.create(toDraft(request), clock.instant());
    return ResponseEntity.created(URI.create("/api/notification-rules/" + rule.getId()))
        .body(RuleResponse.from(rule));
  }

  @PutMapping("/{id}")
  public ResponseEntity<RuleResponse> updateRule(
      @PathVariable UUID id, @Valid @RequestBody RuleRequest request) {
    return ResponseEntity.ok(
        RuleResponse.from(ruleStore.update(id, toDraft(request), clock.instant())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteRule(@PathVariable UUID id) {
    ruleStore.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/activate")
  public ResponseEntity<RuleResponse> activateRule(@PathVariable UUID id) {
    return ResponseEntity.ok(RuleResponse.from(ruleStore.setActive(id, true, clock.instant())));
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<RuleResponse> deactivateRule(@PathVariable UUID id) {
    return ResponseEntity.ok(RuleResponse.from(ruleStore.setActive(id, false, clock.instant())));
  }

  @PostMapping("/{id}/test")
  public ResponseEntity<NotificationLogResponse> sendTest(
      @PathVariable UUID id, @Valid @RequestBody TestRequest request) {
    var entry = dispatcher.sendTest(id, request.email());
    return ResponseEntity.ok(NotificationLogResponse.from(entry));
  }

  /** Subject and body fall back to the named email template when left blank. */
  private NotificationRuleDraft toDraft(RuleRequest request) {
    String subject = request.subject();
    String body = request.body();
    if (request.templateId() != null && (isBlank(subject) || isBlank(body))) {
      var template = templateService.get(request.templateId());
      subject = isBlank(subject) ? template.getSubject() : subject;
      body = isBlank(body) ? template.getBody() : body;
    }
    return new NotificationRuleDraft(
        request.name(),
        request.description(),
        request.active() == null || request.active(),
        parseTriggers(request.triggers()),
        request.platforms() == null ? null : new LinkedHashSet<>(request.platforms()),
        request.recipients(),
        subject,
        body,
        request.minResources());
  }

  private static Set<TriggerKind> parseTriggers(Map<String, Boolean> triggers) {
    var kinds = EnumSet.noneOf(TriggerKind.class);
    if (triggers != null) {
      triggers.forEach(
          (name, enabled) -> {
            var kind = TriggerKind.fromWireName(name);
            if (Boolean.TRUE.equals(enabled)) {
              kinds.add(kind);
            }
          });
    }
    return kinds;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  // --- DTOs ---

  public record RuleRequest(
      @NotBlank @Size(max = 200) String name,
      @Size(max = 2000) String description,
      Boolean active,
      Map<String, Boolean> triggers,
      List<String> platforms,
      List<String> recipients,
      String subject,
      String body,
      String templateId,
      Integer minResources) {}

  public record TestRequest(@NotBlank String email) {}

  public record RuleResponse(
      UUID id,
      String name,
      String description,
      boolean active,
      List<String> triggers,
      Set<String> platforms,
      List<String> recipients,
      String subject,
      String body,
      Integer minResources,
      Instant lastTriggered,
      long totalSent,
      Instant createdAt,
      Instant updatedAt) {

    public static RuleResponse from(NotificationRule rule) {
      return new RuleResponse(
          rule.getId(),
          rule.getName(),
          rule.getDescription(),
          rule.isActive(),
          rule.getTriggers().stream().map(TriggerKind::wireName).toList(),
          rule.getPlatforms(),
          rule.getRecipients(),
          rule.getSubjectTemplate(),
          rule.getBodyTemplate(),
          rule.getMinResources(),
          rule.getLastTriggered(),
          rule.getTotalSent(),
          rule.getCreatedAt(),
          rule.getUpdatedAt());
    }
  }
}
