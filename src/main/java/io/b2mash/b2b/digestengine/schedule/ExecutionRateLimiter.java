package io.b2mash.b2b.digestengine.schedule;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Caps digest runs per schedule and across the whole engine over a one-hour window, and the number
 * of recipients a single run may address. The window starts at a counter's first run and the
 * counter expires an hour later.
 */
@Service
public class ExecutionRateLimiter {

  private static final String PLATFORM_AGGREGATE_KEY = "platform-aggregate";

  private final int scheduleLimit;
  private final int platformAggregateLimit;
  private final int maxRecipients;
  private final Cache<UUID, AtomicInteger> scheduleCounters;
  private final Cache<String, AtomicInteger> aggregateCounter;

  @Autowired
  public ExecutionRateLimiter(
      @Value("${digest-engine.execution.max-executions-per-hour:10}") int scheduleLimit,
      @Value("${digest-engine.execution.platform-executions-per-hour:500}")
          int platformAggregateLimit,
      @Value("${digest-engine.execution.max-recipients-per-schedule:500}") int maxRecipients) {
    this(scheduleLimit, platformAggregateLimit, maxRecipients, Ticker.systemTicker());
  }

  ExecutionRateLimiter(
      int scheduleLimit, int platformAggregateLimit, int maxRecipients, Ticker ticker) {
    this.scheduleLimit = scheduleLimit;
    this.platformAggregateLimit = platformAggregateLimit;
    this.maxRecipients = maxRecipients;
    this.scheduleCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
    this.aggregateCounter =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10)
            .ticker(ticker)
            .build();
  }

  /**
   * Reserves one run for the schedule, or explains why it may not run.
   *
   * @return an allowed decision, or a denied one carrying the rate-limit reason
   */
  public RateLimitDecision tryAcquire(UUID scheduleId, int recipientCount) {
    if (recipientCount > maxRecipients) {
      return RateLimitDecision.denied(
          "Recipient limit exceeded: "
              + recipientCount
              + " recipients, at most "
              + maxRecipients
              + " allowed per schedule");
    }

    var scheduleCounter = scheduleCounters.get(scheduleId, k -> new AtomicInteger(0));
    if (scheduleCounter.incrementAndGet() > scheduleLimit) {
      scheduleCounter.decrementAndGet();
      return RateLimitDecision.denied(
          "Execution limit exceeded: at most " + scheduleLimit + " runs per hour per schedule");
    }

    var aggregate = aggregateCounter.get(PLATFORM_AGGREGATE_KEY, k -> new AtomicInteger(0));
    if (aggregate.incrementAndGet() > platformAggregateLimit) {
      aggregate.decrementAndGet();
      scheduleCounter.decrementAndGet();
      return RateLimitDecision.denied(
          "Platform execution limit exceeded: at most "
              + platformAggregateLimit
              + " runs per hour across all schedules");
    }

    return RateLimitDecision.ALLOWED;
  }

  public record RateLimitDecision(boolean allowed, String reason) {

    static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null);

    static RateLimitDecision denied(String reason) {
      return new RateLimitDecision(false, reason);
    }
  }
}
