package io.b2mash.b2b.digestengine.notification;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Entry point for resource events. Matching runs on the caller against the current rule snapshot;
 * each match is dispatched as its own task on the bounded notification pool, so a slow transport
 * delays only its own rule.
 */
@Component
public class ResourceEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ResourceEventHandler.class);

  private final NotificationRuleStore ruleStore;
  private final TriggerEvaluator triggerEvaluator;
  private final NotificationDispatcher dispatcher;
  private final TaskExecutor dispatchExecutor;

  public ResourceEventHandler(
      NotificationRuleStore ruleStore,
      TriggerEvaluator triggerEvaluator,
      NotificationDispatcher dispatcher,
      @Qualifier("notificationDispatchExecutor") TaskExecutor dispatchExecutor) {
    this.ruleStore = ruleStore;
    this.triggerEvaluator = triggerEvaluator;
    this.dispatcher = dispatcher;
    this.dispatchExecutor = dispatchExecutor;
  }

  /** Events published in-process through {@code ApplicationEventPublisher}. */
  @EventListener
  public void onResourceEvent(ResourceEvent event) {
    try {
      ingest(event);
    } catch (Exception e) {
      log.warn("Failed to ingest {} event from platform={}", event.kind(), event.platform(), e);
    }
  }

  public DispatchBatch ingest(ResourceEvent event) {
    var matches = triggerEvaluator.matches(event, ruleStore.snapshot());
    log.debug(
        "Event {} from platform={} matched {} rules",
        event.kind().wireName(),
        event.platform(),
        matches.size());

    var futures = new ArrayList<CompletableFuture<NotificationLogEntry>>(matches.size());
    for (var rule : matches) {
      futures.add(
          CompletableFuture.supplyAsync(() -> dispatcher.dispatch(rule, event), dispatchExecutor)
              .whenComplete(
                  (entry, error) -> {
                    if (error != null) {
                      log.error(
                          "Unexpected failure dispatching rule {} for {}",
                          rule.getId(),
                          event.kind().wireName(),
                          error);
                    }
                  }));
    }

    var completion =
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    return new DispatchBatch(matches.size(), completion);
  }
}
