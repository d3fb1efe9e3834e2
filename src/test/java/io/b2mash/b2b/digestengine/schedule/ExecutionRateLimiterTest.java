package io.b2mash.b2b.digestengine.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ExecutionRateLimiterTest {

  @Test
  void tryAcquire_succeedsWithinLimit() {
    var limiter = new ExecutionRateLimiter(2, 500, 500, Ticker.systemTicker());
    var scheduleId = UUID.randomUUID();

    var decision = limiter.tryAcquire(scheduleId, 3);

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.reason()).isNull();
    assertThat(limiter.tryAcquire(scheduleId, 3).allowed()).isTrue();
  }

  @Test
  void tryAcquire_failsWhenScheduleLimitExceeded() {
    var limiter = new ExecutionRateLimiter(3, 500, 500, Ticker.systemTicker());
    var scheduleId = UUID.randomUUID();

    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    var fourth = limiter.tryAcquire(scheduleId, 1);

    assertThat(fourth.allowed()).isFalse();
    assertThat(fourth.reason()).startsWith("Execution limit exceeded");
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isFalse();
  }

  @Test
  void tryAcquire_scheduleLimitsAreIndependent() {
    var limiter = new ExecutionRateLimiter(1, 500, 500, Ticker.systemTicker());

    assertThat(limiter.tryAcquire(UUID.randomUUID(), 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(UUID.randomUUID(), 1).allowed()).isTrue();
  }

  @Test
  void tryAcquire_failsWhenPlatformAggregateExceeded() {
    var limiter = new ExecutionRateLimiter(1, 3, 500, Ticker.systemTicker());

    assertThat(limiter.tryAcquire(UUID.randomUUID(), 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(UUID.randomUUID(), 1).allowed()).isTrue();
    var third = UUID.randomUUID();
    assertThat(limiter.tryAcquire(third, 1).allowed()).isTrue();
    var blockedId = UUID.randomUUID();
    var fourth = limiter.tryAcquire(blockedId, 1);

    assertThat(fourth.allowed()).isFalse();
    assertThat(fourth.reason()).startsWith("Platform execution limit exceeded");
    // Still platform-limited, not schedule-limited: the denied run took no schedule quota
    assertThat(limiter.tryAcquire(blockedId, 1).reason())
        .startsWith("Platform execution limit exceeded");
    assertThat(limiter.tryAcquire(third, 1).reason()).startsWith("Execution limit exceeded");
  }

  @Test
  void tryAcquire_rejectsOversizedRecipientListWithoutConsumingQuota() {
    var limiter = new ExecutionRateLimiter(1, 500, 10, Ticker.systemTicker());
    var scheduleId = UUID.randomUUID();

    var decision = limiter.tryAcquire(scheduleId, 11);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).startsWith("Recipient limit exceeded");
    assertThat(limiter.tryAcquire(scheduleId, 10).allowed()).isTrue();
  }

  @Test
  void counters_resetAfterCacheExpiry() {
    var fakeTicker = new FakeTicker();
    var limiter = new ExecutionRateLimiter(2, 500, 500, fakeTicker);
    var scheduleId = UUID.randomUUID();

    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isFalse();

    fakeTicker.advance(61 * 60 * 1_000_000_000L); // 61 minutes in nanos

    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isTrue();
    assertThat(limiter.tryAcquire(scheduleId, 1).allowed()).isFalse();
  }

  /** Fake ticker for simulating time passage in Caffeine caches. */
  private static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong(System.nanoTime());

    void advance(long deltaNanos) {
      nanos.addAndGet(deltaNanos);
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
