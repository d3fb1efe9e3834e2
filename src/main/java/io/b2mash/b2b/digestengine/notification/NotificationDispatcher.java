package io.b2mash.b2b.digestengine.notification;

import io.b2mash.b2b.digestengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.digestengine.history.NotificationLog;
import io.b2mash.b2b.digestengine.integration.email.EmailAddresses;
import io.b2mash.b2b.digestengine.integration.email.EmailMessage;
import io.b2mash.b2b.digestengine.integration.email.EmailProvider;
import io.b2mash.b2b.digestengine.integration.email.SendResult;
import io.b2mash.b2b.digestengine.notification.template.RenderedTemplate;
import io.b2mash.b2b.digestengine.notification.template.TemplateRenderer;
import io.b2mash.b2b.digestengine.support.CollaboratorException;
import io.b2mash.b2b.digestengine.support.CollaboratorInvoker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a rule's template, sends it and always leaves a {@link NotificationLogEntry}. Rule stats
 * change only after a successful send. Failed sends are logged, never retried.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  static final String TEST_TRIGGER_TYPE = "manual_test";

  private final TemplateRenderer templateRenderer;
  private final EmailProvider emailProvider;
  private final CollaboratorInvoker invoker;
  private final NotificationRuleStore ruleStore;
  private final NotificationLog notificationLog;
  private final TriggerVariableResolver variableResolver;
  private final Clock clock;
  private final Duration sendTimeout;
  private final boolean blockOnUnresolved;

  public NotificationDispatcher(
      TemplateRenderer templateRenderer,
      EmailProvider emailProvider,
      CollaboratorInvoker invoker,
      NotificationRuleStore ruleStore,
      NotificationLog notificationLog,
      TriggerVariableResolver variableResolver,
      Clock clock,
      @Value("${digest-engine.execution.send-timeout:PT15S}") Duration sendTimeout,
      @Value("${digest-engine.templates.block-on-unresolved:false}") boolean blockOnUnresolved) {
    this.templateRenderer = templateRenderer;
    this.emailProvider = emailProvider;
    this.invoker = invoker;
    this.ruleStore = ruleStore;
    this.notificationLog = notificationLog;
    this.variableResolver = variableResolver;
    this.clock = clock;
    this.sendTimeout = sendTimeout;
    this.blockOnUnresolved = blockOnUnresolved;
  }

  /** Dispatches {@code rule} for {@code event} using the variables resolved for that event. */
  public NotificationLogEntry dispatch(NotificationRule rule, ResourceEvent event) {
    return dispatch(rule, event, variableResolver.resolve(event));
  }

  public NotificationLogEntry dispatch(
      NotificationRule rule, ResourceEvent event, Map<String, ?> variables) {
    var rendered =
        templateRenderer.render(rule.getSubjectTemplate(), rule.getBodyTemplate(), variables);
    var recipients = EmailAddresses.normalize(rule.getRecipients());
    var entry =
        deliver(
            rule.getId(),
            rule.getName(),
            event.kind().wireName(),
            event.platform(),
            recipients,
            rendered,
            event.displayedCount());

    notificationLog.append(entry);
    if (entry.status() == NotificationStatus.SENT) {
      ruleStore.recordDelivery(rule.getId(), entry.sentAt(), entry.recipients().size());
      log.info(
          "Notification rule {} sent {} to {} recipients",
          rule.getId(),
          event.kind().wireName(),
          entry.recipients().size());
    } else if (entry.status() == NotificationStatus.FAILED) {
      log.warn("Notification rule {} failed: {}", rule.getId(), entry.errorMessage());
    }
    return entry;
  }

  /**
   * Sends the rule's template, filled with sample values, to a single address. Logged as a test
   * entry; the rule's stats are not touched.
   */
  public NotificationLogEntry sendTest(UUID ruleId, String address) {
    var rule = ruleStore.get(ruleId);
    var recipients = EmailAddresses.normalize(address == null ? List.of() : List.of(address));
    if (recipients.isEmpty() || !recipients.get(0).contains("@")) {
      throw new InvalidConfigurationException(
          "Invalid test recipient", "not an email address: " + address);
    }
    var variables = variableResolver.sample(clock.instant());
    var rendered =
        templateRenderer.render(rule.getSubjectTemplate(), rule.getBodyTemplate(), variables);
    var entry =
        deliver(
            rule.getId(),
            rule.getName() + " (Test)",
            TEST_TRIGGER_TYPE,
            null,
            recipients,
            rendered,
            (Integer) variables.get("RESOURCE_COUNT"));
    notificationLog.append(entry);
    log.info("Test notification for rule {} ended {}", ruleId, entry.status());
    return entry;
  }

  private NotificationLogEntry deliver(
      UUID ruleId,
      String ruleName,
      String triggerType,
      String platform,
      List<String> recipients,
      RenderedTemplate rendered,
      Integer resourcesCount) {
    Instant sentAt = clock.instant();
    var entry =
        new EntryBuilder(
            ruleId, ruleName, triggerType, platform, recipients, rendered, sentAt, resourcesCount);

    if (recipients.isEmpty()) {
      return entry.failed("No valid recipients");
    }
    if (blockOnUnresolved && !rendered.isFullyResolved()) {
      return entry.failed("Unresolved template variables: " + rendered.unresolved());
    }

    var message =
        EmailMessage.withTracking(
            recipients,
            rendered.subject(),
            rendered.body(),
            "NOTIFICATION_RULE",
            ruleId.toString());
    SendResult result;
    try {
      result =
          invoker.invoke("Notification delivery", sendTimeout, () -> emailProvider.send(message));
    } catch (CollaboratorException e) {
      return entry.failed(e.getMessage());
    }

    if (result == null || !result.success()) {
      return entry.failed(
          result != null && result.errorMessage() != null
              ? result.errorMessage()
              : "Transport reported failure");
    }
    if (result.deferred()) {
      return entry.build(NotificationStatus.PENDING, recipients, null);
    }
    if (result.isPartial()) {
      var rejected = result.rejectedRecipients();
      var delivered = recipients.stream().filter(r -> !rejected.contains(r)).toList();
      if (delivered.isEmpty()) {
        return entry.failed("Transport rejected every recipient");
      }
      return entry.build(
          NotificationStatus.SENT,
          delivered,
          "Transport rejected " + rejected.size() + " recipients");
    }
    return entry.build(NotificationStatus.SENT, recipients, null);
  }

  private record EntryBuilder(
      UUID ruleId,
      String ruleName,
      String triggerType,
      String platform,
      List<String> recipients,
      RenderedTemplate rendered,
      Instant sentAt,
      Integer resourcesCount) {

    NotificationLogEntry failed(String errorMessage) {
      return build(NotificationStatus.FAILED, recipients, errorMessage);
    }

    NotificationLogEntry build(
        NotificationStatus status, List<String> delivered, String errorMessage) {
      return new NotificationLogEntry(
          UUID.randomUUID(),
          ruleId,
          ruleName,
          triggerType,
          platform,
          delivered,
          rendered.subject(),
          status,
          sentAt,
          resourcesCount,
          errorMessage,
          rendered.unresolved());
    }
  }
}
