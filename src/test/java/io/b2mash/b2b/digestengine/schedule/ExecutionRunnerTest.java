package io.b2mash.b2b.digestengine.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.digestengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.digestengine.history.ExecutionLog;
import io.b2mash.b2b.digestengine.integration.email.EmailMessage;
import io.b2mash.b2b.digestengine.integration.email.EmailProvider;
import io.b2mash.b2b.digestengine.integration.email.SendResult;
import io.b2mash.b2b.digestengine.notification.template.EmailTemplateService;
import io.b2mash.b2b.digestengine.notification.template.TemplateRenderer;
import io.b2mash.b2b.digestengine.schedule.content.DigestContentGenerator;
import io.b2mash.b2b.digestengine.schedule.content.DigestContext;
import io.b2mash.b2b.digestengine.schedule.content.GeneratedDigest;
import io.b2mash.b2b.digestengine.support.CollaboratorInvoker;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tools.jackson.databind.json.JsonMapper;

class ExecutionRunnerTest {

  // Wednesday
  private static final Instant NOW = Instant.parse("2024-01-10T10:00:00Z");

  private ScheduleStore store;
  private DigestContentGenerator contentGenerator;
  private EmailProvider emailProvider;
  private ExecutionLog executionLog;
  private ThreadPoolTaskExecutor collaboratorExecutor;
  private EmailTemplateService templateService;

  @BeforeEach
  void setUp() {
    store = new ScheduleStore(new RecurrenceCalculator());
    contentGenerator = mock(DigestContentGenerator.class);
    emailProvider = mock(EmailProvider.class);
    executionLog = new ExecutionLog(100);
    templateService = new EmailTemplateService(JsonMapper.builder().build());
    collaboratorExecutor = new ThreadPoolTaskExecutor();
    collaboratorExecutor.setCorePoolSize(4);
    collaboratorExecutor.initialize();
  }

  @AfterEach
  void tearDown() {
    collaboratorExecutor.shutdown();
  }

  @Test
  void run_successfulDigestIsSentAndRecorded() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Weekly FDA digest", null);
    when(contentGenerator.generate(any()))
        .thenReturn(new GeneratedDigest("FDA issued 4 guidance updates", 4, 1));
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg-1"));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    assertThat(execution.getTrigger()).isEqualTo(ExecutionTrigger.MANUAL);
    assertThat(execution.getRecipientCount()).isEqualTo(2);
    assertThat(execution.getItemsIncluded()).isEqualTo(4);
    assertThat(execution.getCriticalItems()).isEqualTo(1);
    assertThat(execution.getDigestId()).isEqualTo("msg-1");
    assertThat(execution.getErrorMessage()).isNull();

    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).send(captor.capture());
    var message = captor.getValue();
    assertThat(message.recipients()).containsExactly("ana@example.com", "bo@example.com");
    assertThat(message.subject()).isEqualTo("Weekly FDA digest - 2024-01-10");
    assertThat(message.body())
        .contains("FDA issued 4 guidance updates")
        .contains("Items included: 4 (1 critical)");
    assertThat(message.metadata()).containsEntry("referenceId", schedule.getId().toString());

    var updated = store.get(schedule.getId());
    assertThat(updated.getTotalRuns()).isEqualTo(1);
    assertThat(updated.getSuccessfulRuns()).isEqualTo(1);
    assertThat(updated.getLastRun()).isEqualTo(NOW);
    assertThat(executionLog.forSchedule(schedule.getId(), 10)).containsExactly(execution);
  }

  @Test
  void run_passesPreviousRunAndFiltersToGenerator() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Digest", null);
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));

    runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL);
    runner.run(schedule.getId(), NOW.plusSeconds(3600), ExecutionTrigger.MANUAL);

    var captor = ArgumentCaptor.forClass(DigestContext.class);
    verify(contentGenerator, times(2)).generate(captor.capture());
    assertThat(captor.getAllValues().get(0).since()).isNull();
    assertThat(captor.getAllValues().get(1).since()).isEqualTo(NOW);
    assertThat(captor.getAllValues().get(1).until()).isEqualTo(NOW.plusSeconds(3600));
    assertThat(captor.getAllValues().get(1).filters()).hasSize(1);
  }

  @Test
  void run_unknownTemplateFallsBackToScheduledDigest() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Fallback digest", "no-such-template");
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.isSuccessful()).isTrue();
    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).send(captor.capture());
    assertThat(captor.getValue().subject()).isEqualTo("Fallback digest - 2024-01-10");
  }

  @Test
  void run_withoutRecipientsSucceedsWithoutSending() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = store.create(weekly("Nobody", List.of(), null), true, NOW);
    when(contentGenerator.generate(any())).thenReturn(new GeneratedDigest("body", 3, 0));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    assertThat(execution.getRecipientCount()).isZero();
    assertThat(execution.getItemsIncluded()).isEqualTo(3);
    assertThat(execution.getErrorMessage()).isNull();
    verify(emailProvider, never()).send(any());
    var updated = store.get(schedule.getId());
    assertThat(updated.getTotalRuns()).isEqualTo(1);
    assertThat(updated.getSuccessfulRuns()).isEqualTo(1);
  }

  @Test
  void run_scheduleWhoseOnlyGroupWasDeletedStillSucceeds() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Orphaned", null);
    store.deleteGroup(schedule.getRecipientGroupIds().iterator().next());
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    assertThat(execution.getRecipientCount()).isZero();
    verify(emailProvider, never()).send(any());
    assertThat(store.stats().successRate()).isEqualTo(100);
  }

  @Test
  void run_rateLimitedRunIsRecordedAsFailure() {
    var runner = runner(1, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Limited", null);
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));

    runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL);
    var second = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(second.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(second.getErrorMessage()).startsWith("Execution limit exceeded");
    verify(emailProvider, times(1)).send(any());
    var updated = store.get(schedule.getId());
    assertThat(updated.getTotalRuns()).isEqualTo(2);
    assertThat(updated.getSuccessfulRuns()).isEqualTo(1);
  }

  @Test
  void run_generatorTimeoutRecordsFailureWithoutSending() {
    var runner = runner(10, Duration.ofMillis(200));
    var schedule = scheduleWithRecipients("Slow", null);
    when(contentGenerator.generate(any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return GeneratedDigest.empty();
            });

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(execution.getErrorMessage()).contains("timed out");
    verify(emailProvider, never()).send(any());
    assertThat(runner.isRunning(schedule.getId())).isFalse();
  }

  @Test
  void run_generatorExceptionRecordsFailure() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Broken", null);
    when(contentGenerator.generate(any())).thenThrow(new IllegalStateException("model offline"));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(execution.getErrorMessage()).contains("model offline");
  }

  @Test
  void run_transportFailureRecordsFailure() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Bounced", null);
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.failed("mailbox unavailable"));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(execution.getErrorMessage()).isEqualTo("Delivery failed: mailbox unavailable");
    assertThat(store.get(schedule.getId()).getSuccessfulRuns()).isZero();
  }

  @Test
  void run_partialDeliveryCountsDeliveredRecipients() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Partial", null);
    when(contentGenerator.generate(any())).thenReturn(new GeneratedDigest("body", 2, 0));
    when(emailProvider.send(any()))
        .thenReturn(new SendResult(true, "msg-p", null, List.of("bo@example.com"), false));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIAL);
    assertThat(execution.getRecipientCount()).isEqualTo(1);
    assertThat(execution.getErrorMessage()).isEqualTo("Transport rejected 1 of 2 recipients");
    assertThat(store.get(schedule.getId()).getSuccessfulRuns()).isZero();
  }

  @Test
  void run_everyRecipientRejectedIsFailure() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("All bounced", null);
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any()))
        .thenReturn(
            new SendResult(
                true, "msg-r", null, List.of("ana@example.com", "bo@example.com"), false));

    var execution = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL).orElseThrow();

    assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(execution.getErrorMessage())
        .isEqualTo("Delivery failed: transport rejected every recipient");
  }

  @Test
  void forget_dropsLockOfDeletedSchedule() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Short lived", null);
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));
    runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL);
    assertThat(runner.trackedLockCount()).isEqualTo(1);

    store.setEnabled(schedule.getId(), false, NOW);
    store.delete(schedule.getId());
    runner.forget(schedule.getId());

    assertThat(runner.trackedLockCount()).isZero();
    assertThat(runner.isRunning(schedule.getId())).isFalse();
  }

  @Test
  void run_timerTriggerSkipsScheduleThatIsNotDue() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Not yet", null);

    var result = runner.run(schedule.getId(), NOW, ExecutionTrigger.TIMER);

    assertThat(result).isEmpty();
    assertThat(executionLog.size()).isZero();
    verify(contentGenerator, never()).generate(any());
  }

  @Test
  void run_timerTriggerAdvancesNextRun() {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Due", null);
    var dueAt = schedule.getNextRun();
    when(contentGenerator.generate(any())).thenReturn(GeneratedDigest.empty());
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));

    var execution = runner.run(schedule.getId(), dueAt, ExecutionTrigger.TIMER).orElseThrow();

    assertThat(execution.getTrigger()).isEqualTo(ExecutionTrigger.TIMER);
    assertThat(store.get(schedule.getId()).getNextRun()).isEqualTo(dueAt.plus(Duration.ofDays(7)));
  }

  @Test
  void run_unknownScheduleIsNotFound() {
    var runner = runner(10, Duration.ofSeconds(5));

    assertThatThrownBy(() -> runner.run(UUID.randomUUID(), NOW, ExecutionTrigger.MANUAL))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void run_concurrentTriggersProduceOneExecution() throws Exception {
    var runner = runner(10, Duration.ofSeconds(5));
    var schedule = scheduleWithRecipients("Contended", null);
    var entered = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    when(contentGenerator.generate(any()))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return GeneratedDigest.empty();
            });
    when(emailProvider.send(any())).thenReturn(SendResult.sent("msg"));

    var first =
        CompletableFuture.supplyAsync(
            () -> runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(runner.isRunning(schedule.getId())).isTrue();
    var second = runner.run(schedule.getId(), NOW, ExecutionTrigger.MANUAL);
    release.countDown();

    assertThat(second).isEmpty();
    assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
    assertThat(executionLog.size()).isEqualTo(1);
    assertThat(store.get(schedule.getId()).getTotalRuns()).isEqualTo(1);
  }

  private ExecutionRunner runner(int perHourLimit, Duration contentTimeout) {
    return new ExecutionRunner(
        store,
        new ExecutionRateLimiter(perHourLimit, 500, 500, Ticker.systemTicker()),
        contentGenerator,
        emailProvider,
        templateService,
        new TemplateRenderer(5),
        new CollaboratorInvoker(collaboratorExecutor),
        executionLog,
        contentTimeout,
        Duration.ofSeconds(5));
  }

  private DigestSchedule scheduleWithRecipients(String name, String templateId) {
    var group =
        store.createGroup(
            new RecipientGroupDraft(
                "Regulatory",
                null,
                List.of("ana@example.com", "bo@example.com"),
                RecipientFilter.none(),
                true),
            NOW);
    return store.create(weekly(name, List.of(group.getId()), templateId), true, NOW);
  }

  private static ScheduleDraft weekly(String name, List<UUID> groupIds, String templateId) {
    return new ScheduleDraft(
        name, "Regulatory updates", "weekly", 1, null, "09:00", "UTC", groupIds, templateId);
  }
}
