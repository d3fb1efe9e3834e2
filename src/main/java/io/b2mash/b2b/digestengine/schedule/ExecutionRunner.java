package io.b2mash.b2b.digestengine.schedule;

import io.b2mash.b2b.digestengine.exception.RateLimitExceededException;
import io.b2mash.b2b.digestengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.digestengine.history.ExecutionLog;
import io.b2mash.b2b.digestengine.integration.email.EmailMessage;
import io.b2mash.b2b.digestengine.integration.email.EmailProvider;
import io.b2mash.b2b.digestengine.integration.email.SendResult;
import io.b2mash.b2b.digestengine.notification.template.EmailTemplate;
import io.b2mash.b2b.digestengine.notification.template.EmailTemplateService;
import io.b2mash.b2b.digestengine.notification.template.TemplateRenderer;
import io.b2mash.b2b.digestengine.schedule.content.DigestContentGenerator;
import io.b2mash.b2b.digestengine.schedule.content.DigestContext;
import io.b2mash.b2b.digestengine.schedule.content.GeneratedDigest;
import io.b2mash.b2b.digestengine.support.CollaboratorException;
import io.b2mash.b2b.digestengine.support.CollaboratorInvoker;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Performs one digest run: recipients, rate limits, content generation, rendering, sending, then
 * bookkeeping in {@link ScheduleStore} and an entry in {@link ExecutionLog}.
 *
 * <p>At most one run per schedule is in flight. A second trigger arriving while the schedule's lock
 * is held returns empty and leaves no trace. Collaborator failures are recorded on the execution
 * and never retried; the next attempt is the schedule's next natural slot.
 */
@Service
public class ExecutionRunner {

  private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

  private final ScheduleStore scheduleStore;
  private final ExecutionRateLimiter rateLimiter;
  private final DigestContentGenerator contentGenerator;
  private final EmailProvider emailProvider;
  private final EmailTemplateService templateService;
  private final TemplateRenderer templateRenderer;
  private final CollaboratorInvoker invoker;
  private final ExecutionLog executionLog;
  private final Duration contentTimeout;
  private final Duration sendTimeout;
  private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

  public ExecutionRunner(
      ScheduleStore scheduleStore,
      ExecutionRateLimiter rateLimiter,
      DigestContentGenerator contentGenerator,
      EmailProvider emailProvider,
      EmailTemplateService templateService,
      TemplateRenderer templateRenderer,
      CollaboratorInvoker invoker,
      ExecutionLog executionLog,
      @Value("${digest-engine.execution.content-timeout:PT30S}") Duration contentTimeout,
      @Value("${digest-engine.execution.send-timeout:PT15S}") Duration sendTimeout) {
    this.scheduleStore = scheduleStore;
    this.rateLimiter = rateLimiter;
    this.contentGenerator = contentGenerator;
    this.emailProvider = emailProvider;
    this.templateService = templateService;
    this.templateRenderer = templateRenderer;
    this.invoker = invoker;
    this.executionLog = executionLog;
    this.contentTimeout = contentTimeout;
    this.sendTimeout = sendTimeout;
  }

  /**
   * Runs the schedule now.
   *
   * @return the recorded execution, or empty when another run of the same schedule is in flight or
   *     a timer-triggered run finds the schedule no longer due
   * @throws ResourceNotFoundException if the schedule does not exist
   */
  public Optional<ScheduleExecution> run(UUID scheduleId, Instant now, ExecutionTrigger trigger) {
    scheduleStore.get(scheduleId);
    var lock = locks.computeIfAbsent(scheduleId, id -> new ReentrantLock());
    if (!lock.tryLock()) {
      log.debug("Schedule {} already running, skipping {} trigger", scheduleId, trigger);
      return Optional.empty();
    }
    try {
      var schedule = scheduleStore.get(scheduleId);
      if (trigger == ExecutionTrigger.TIMER && !isDue(schedule, now)) {
        log.debug("Schedule {} no longer due at {}, skipping", scheduleId, now);
        return Optional.empty();
      }

      var execution = execute(schedule, now, trigger);
      record(execution);
      return Optional.of(execution);
    } finally {
      lock.unlock();
    }
  }

  /** Drops the run lock of a deleted schedule. A lock still held by a running run is kept. */
  public void forget(UUID scheduleId) {
    locks.computeIfPresent(scheduleId, (id, lock) -> lock.isLocked() ? lock : null);
  }

  int trackedLockCount() {
    return locks.size();
  }

  /** True while some thread holds the schedule's run lock. */
  public boolean isRunning(UUID scheduleId) {
    var lock = locks.get(scheduleId);
    return lock != null && lock.isLocked();
  }

  private static boolean isDue(DigestSchedule schedule, Instant now) {
    return schedule.isEnabled()
        && schedule.getNextRun() != null
        && !schedule.getNextRun().isAfter(now);
  }

  private ScheduleExecution execute(
      DigestSchedule schedule, Instant now, ExecutionTrigger trigger) {
    long started = System.nanoTime();
    try {
      var recipients = scheduleStore.resolveRecipients(schedule);
      var decision = rateLimiter.tryAcquire(schedule.getId(), recipients.size());
      if (!decision.allowed()) {
        throw new RateLimitExceededException(decision.reason());
      }

      var context =
          new DigestContext(
              schedule.getId(),
              schedule.getName(),
              schedule.getDescription(),
              schedule.getLastRun(),
              now,
              scheduleStore.recipientFilters(schedule));
      GeneratedDigest generated =
          invoker.invoke(
              "Digest generation", contentTimeout, () -> contentGenerator.generate(context));
      var digest = generated != null ? generated : GeneratedDigest.empty();

      if (recipients.isEmpty()) {
        log.warn(
            "Schedule {} resolved no recipients, nothing sent for this run", schedule.getId());
        return new ScheduleExecution(
            schedule.getId(),
            trigger,
            now,
            ExecutionStatus.SUCCESS,
            0,
            digest.itemsIncluded(),
            digest.criticalItems(),
            elapsedMillis(started),
            null,
            null);
      }

      var message = buildMessage(schedule, digest, recipients, now);
      SendResult result =
          invoker.invoke("Digest delivery", sendTimeout, () -> emailProvider.send(message));

      return toExecution(
          schedule, trigger, now, recipients, digest, result, elapsedMillis(started));
    } catch (RateLimitExceededException e) {
      log.warn("Schedule {} rate limited: {}", schedule.getId(), e.getBody().getDetail());
      return ScheduleExecution.failed(
          schedule.getId(), trigger, now, elapsedMillis(started), e.getBody().getDetail());
    } catch (CollaboratorException e) {
      return ScheduleExecution.failed(
          schedule.getId(), trigger, now, elapsedMillis(started), e.getMessage());
    }
  }

  private EmailMessage buildMessage(
      DigestSchedule schedule, GeneratedDigest digest, List<String> recipients, Instant now) {
    var template = resolveTemplate(schedule);
    var recurrence = schedule.getRecurrence();
    Map<String, Object> variables = new HashMap<>();
    variables.put("SCHEDULE_NAME", schedule.getName());
    variables.put(
        "SCHEDULE_DESCRIPTION", schedule.getDescription() != null ? schedule.getDescription() : "");
    variables.put("FREQUENCY", recurrence.describe());
    variables.put("RUN_DATE", LocalDate.ofInstant(now, recurrence.zone()).toString());
    variables.put("DIGEST_CONTENT", digest.body());
    variables.put("ITEMS_INCLUDED", digest.itemsIncluded());
    variables.put("CRITICAL_ITEMS", digest.criticalItems());
    variables.put("RECIPIENT_COUNT", recipients.size());

    var rendered = templateRenderer.render(template.getSubject(), template.getBody(), variables);
    return EmailMessage.withTracking(
        recipients,
        rendered.subject(),
        rendered.body(),
        "DIGEST_SCHEDULE",
        schedule.getId().toString());
  }

  private EmailTemplate resolveTemplate(DigestSchedule schedule) {
    var templateId = schedule.getTemplateId();
    if (templateId != null) {
      var template = templateService.find(templateId);
      if (template.isPresent()) {
        return template.get();
      }
      log.warn(
          "Schedule {} references unknown template {}, using {}",
          schedule.getId(),
          templateId,
          EmailTemplateService.SCHEDULED_DIGEST_TEMPLATE_ID);
    }
    return templateService.get(EmailTemplateService.SCHEDULED_DIGEST_TEMPLATE_ID);
  }

  private static ScheduleExecution toExecution(
      DigestSchedule schedule,
      ExecutionTrigger trigger,
      Instant now,
      List<String> recipients,
      GeneratedDigest digest,
      SendResult result,
      long durationMs) {
    if (result == null || !result.success()) {
      String error =
          result != null && result.errorMessage() != null
              ? result.errorMessage()
              : "Transport reported failure";
      return ScheduleExecution.failed(
          schedule.getId(), trigger, now, durationMs, "Delivery failed: " + error);
    }
    if (result.isPartial()) {
      int rejected = result.rejectedRecipients().size();
      if (rejected >= recipients.size()) {
        return ScheduleExecution.failed(
            schedule.getId(),
            trigger,
            now,
            durationMs,
            "Delivery failed: transport rejected every recipient");
      }
      return new ScheduleExecution(
          schedule.getId(),
          trigger,
          now,
          ExecutionStatus.PARTIAL,
          recipients.size() - rejected,
          digest.itemsIncluded(),
          digest.criticalItems(),
          durationMs,
          "Transport rejected " + rejected + " of " + recipients.size() + " recipients",
          result.providerMessageId());
    }
    return new ScheduleExecution(
        schedule.getId(),
        trigger,
        now,
        ExecutionStatus.SUCCESS,
        recipients.size(),
        digest.itemsIncluded(),
        digest.criticalItems(),
        durationMs,
        null,
        result.providerMessageId());
  }

  private void record(ScheduleExecution execution) {
    try {
      scheduleStore.recordExecution(execution);
    } catch (ResourceNotFoundException e) {
      log.warn("Schedule {} was deleted during its run", execution.getScheduleId());
    }
    executionLog.append(execution);
    if (execution.isSuccessful()) {
      log.info(
          "Digest run {} for schedule {} completed: status={}, recipients={}, items={}",
          execution.getId(),
          execution.getScheduleId(),
          execution.getStatus(),
          execution.getRecipientCount(),
          execution.getItemsIncluded());
    } else {
      log.warn(
          "Digest run {} for schedule {} {}: {}",
          execution.getId(),
          execution.getScheduleId(),
          execution.getStatus(),
          execution.getErrorMessage());
    }
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
