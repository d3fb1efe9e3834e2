package io.b2mash.b2b.digestengine.history;

import io.b2mash.b2b.digestengine.notification.NotificationLogEntry;
import java.util.List;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Most recent notification dispatches, test sends included. */
@Component
public class NotificationLog extends BoundedLog<NotificationLogEntry> {

  public NotificationLog(
      @Value("${digest-engine.history.notification-capacity:100}") int capacity) {
    super(capacity);
  }

  public List<NotificationLogEntry> forRule(UUID ruleId, int limit) {
    return recent(entry -> entry.ruleId().equals(ruleId), limit);
  }
}
