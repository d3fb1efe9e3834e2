package io.b2mash.b2b.digestengine.notification;

import io.b2mash.b2b.digestengine.config.NotificationProperties;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import org.springframework.stereotype.Component;

/**
 * Builds the template variables for an event: a common set shared by every kind plus a per-kind
 * contribution looked up in a table keyed by {@link TriggerKind}.
 */
@Component
public class TriggerVariableResolver {

  static final DateTimeFormatter SYNC_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

  private static final String NOT_AVAILABLE = "N/A";

  private final NotificationProperties properties;
  private final Map<TriggerKind, BiConsumer<ResourceEvent, Map<String, Object>>> perKind =
      new EnumMap<>(TriggerKind.class);

  public TriggerVariableResolver(NotificationProperties properties) {
    this.properties = properties;
    perKind.put(TriggerKind.SYNC_SUCCESS, TriggerVariableResolver::syncCounts);
    perKind.put(TriggerKind.SYNC_FAILURE, TriggerVariableResolver::syncFailure);
    perKind.put(TriggerKind.NEW_RESOURCES, TriggerVariableResolver::resourceList);
    perKind.put(
        TriggerKind.UPDATED_RESOURCES,
        (event, vars) -> {
          resourceList(event, vars);
          syncCounts(event, vars);
        });
    perKind.put(TriggerKind.CERTIFICATION_AVAILABLE, TriggerVariableResolver::resourceList);
    perKind.put(TriggerKind.DEADLINE_REMINDER, TriggerVariableResolver::resourceList);
  }

  public Map<String, Object> resolve(ResourceEvent event) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("TRIGGER_TYPE", event.kind().wireName());
    if (event.platform() != null) {
      variables.put("PLATFORM", event.platform());
      variables.put("PLATFORM_NAME", properties.platformName(event.platform()));
    }
    variables.put("RESOURCE_COUNT", event.displayedCount());
    variables.put("SYNC_TIME", SYNC_TIME_FORMAT.format(event.occurredAt()));
    variables.put("ERROR_MESSAGE", NOT_AVAILABLE);
    perKind.get(event.kind()).accept(event, variables);
    return variables;
  }

  /** Fixed sample values used by test sends. */
  public Map<String, Object> sample(Instant now) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("TRIGGER_TYPE", "manual_test");
    variables.put("PLATFORM", "test");
    variables.put("PLATFORM_NAME", "Test Platform");
    variables.put("RESOURCE_COUNT", 3);
    variables.put("UPDATED_COUNT", 0);
    variables.put("SYNC_TIME", SYNC_TIME_FORMAT.format(now));
    variables.put("ERROR_MESSAGE", NOT_AVAILABLE);
    var resources =
        List.of(
            new ResourceSummary("GDPR Fundamentals", "course"),
            new ResourceSummary("Risk Assessment Workshop", "video"),
            new ResourceSummary("ISO 27001 Lead Auditor", "certification"));
    variables.put("RESOURCE_LIST", resources);
    variables.put("RESOURCE_SUMMARY", resources);
    return variables;
  }

  private static void syncCounts(ResourceEvent event, Map<String, Object> vars) {
    vars.put("UPDATED_COUNT", event.resourcesUpdated() != null ? event.resourcesUpdated() : 0);
  }

  private static void syncFailure(ResourceEvent event, Map<String, Object> vars) {
    if (event.errorMessage() != null && !event.errorMessage().isBlank()) {
      vars.put("ERROR_MESSAGE", event.errorMessage());
    }
  }

  private static void resourceList(ResourceEvent event, Map<String, Object> vars) {
    if (!event.resources().isEmpty()) {
      vars.put("RESOURCE_LIST", event.resources());
      vars.put("RESOURCE_SUMMARY", event.resources());
    }
  }
}
