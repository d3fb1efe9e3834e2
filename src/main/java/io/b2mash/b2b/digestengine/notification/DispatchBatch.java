package io.b2mash.b2b.digestengine.notification;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on the dispatches started for one event.
 *
 * @param matchedRules how many rules matched, known as soon as the event is accepted
 * @param completion completes with one log entry per matched rule, in rule registration order
 */
public record DispatchBatch(
    int matchedRules, CompletableFuture<List<NotificationLogEntry>> completion) {}
