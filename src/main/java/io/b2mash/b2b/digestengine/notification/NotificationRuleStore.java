package io.b2mash.b2b.digestengine.notification;

import io.b2mash.b2b.digestengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.digestengine.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Notification rules in registration order. Writers serialize on a lock and publish a fresh
 * immutable list; readers take {@link #snapshot()} without locking, so event evaluation never waits
 * on an edit.
 */
@Component
public class NotificationRuleStore {

  private static final Logger log = LoggerFactory.getLogger(NotificationRuleStore.class);

  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile List<NotificationRule> rules = List.of();

  public List<NotificationRule> snapshot() {
    return rules;
  }

  public NotificationRule get(UUID id) {
    return rules.stream()
        .filter(rule -> rule.getId().equals(id))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("NotificationRule", id));
  }

  public NotificationRule create(NotificationRuleDraft draft, Instant now) {
    validate(draft);
    var rule = NotificationRule.create(draft, now);
    writeLock.lock();
    try {
      var next = new ArrayList<>(rules);
      next.add(rule);
      rules = List.copyOf(next);
    } finally {
      writeLock.unlock();
    }
    log.info(
        "Created notification rule {} ({}) for triggers {}",
        rule.getId(),
        rule.getName(),
        rule.getTriggers());
    return rule;
  }

  public NotificationRule update(UUID id, NotificationRuleDraft draft, Instant now) {
    validate(draft);
    return replace(id, rule -> rule.withContent(draft, now));
  }

  public NotificationRule setActive(UUID id, boolean active, Instant now) {
    var updated = replace(id, rule -> rule.withActive(active, now));
    log.info("Notification rule {} {}", id, active ? "activated" : "deactivated");
    return updated;
  }

  /**
   * Applies delivery stats. A rule deleted while its dispatch was in flight is ignored.
   *
   * @return whether the rule still existed
   */
  public boolean recordDelivery(UUID id, Instant sentAt, int delivered) {
    try {
      replace(id, rule -> rule.withDelivery(sentAt, delivered));
      return true;
    } catch (ResourceNotFoundException e) {
      log.debug("Rule {} removed before its delivery stats were recorded", id);
      return false;
    }
  }

  public void delete(UUID id) {
    writeLock.lock();
    try {
      var next = new ArrayList<>(rules);
      if (!next.removeIf(rule -> rule.getId().equals(id))) {
        throw new ResourceNotFoundException("NotificationRule", id);
      }
      rules = List.copyOf(next);
    } finally {
      writeLock.unlock();
    }
    log.info("Deleted notification rule {}", id);
  }

  private NotificationRule replace(UUID id, UnaryOperator<NotificationRule> change) {
    writeLock.lock();
    try {
      var next = new ArrayList<>(rules);
      for (int i = 0; i < next.size(); i++) {
        if (next.get(i).getId().equals(id)) {
          var updated = change.apply(next.get(i));
          next.set(i, updated);
          rules = List.copyOf(next);
          return updated;
        }
      }
      throw new ResourceNotFoundException("NotificationRule", id);
    } finally {
      writeLock.unlock();
    }
  }

  private static void validate(NotificationRuleDraft draft) {
    var violations = new ArrayList<String>();
    if (draft.name() == null || draft.name().isBlank()) {
      violations.add("name is required");
    }
    if (draft.subject() == null || draft.subject().isBlank()) {
      violations.add("template subject is required");
    }
    if (draft.body() == null || draft.body().isBlank()) {
      violations.add("template body is required");
    }
    if (draft.triggers().contains(null)) {
      violations.add("triggers must not contain null");
    }
    if (draft.platforms().contains(null)) {
      violations.add("platforms must not contain null");
    }
    if (draft.recipients().contains(null)) {
      violations.add("recipients must not contain null");
    }
    if (draft.recipients().stream().noneMatch(r -> r != null && !r.isBlank())) {
      violations.add("at least one recipient is required");
    }
    draft.recipients().stream()
        .filter(r -> r != null && !r.isBlank() && !r.contains("@"))
        .forEach(r -> violations.add("not an email address: " + r));
    if (draft.minResources() != null && draft.minResources() < 1) {
      violations.add("minResources must be at least 1");
    }
    if (!violations.isEmpty()) {
      throw new InvalidConfigurationException("Invalid notification rule", violations);
    }
  }
}
