package io.b2mash.b2b.digestengine.notification;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides which rules an event fires. Pure: no logging of non-matches, no state, and the result
 * keeps the order the rules were registered in. Two rules matching the same event are both
 * returned and dispatched independently.
 */
@Component
public class TriggerEvaluator {

  public List<NotificationRule> matches(ResourceEvent event, List<NotificationRule> rules) {
    return rules.stream().filter(rule -> matches(event, rule)).toList();
  }

  boolean matches(ResourceEvent event, NotificationRule rule) {
    if (!rule.isActive() || !rule.isTriggeredBy(event.kind())) {
      return false;
    }
    if (!rule.acceptsPlatform(event.platform())) {
      return false;
    }
    return rule.getMinResources() == null || event.addedCount() >= rule.getMinResources();
  }
}
