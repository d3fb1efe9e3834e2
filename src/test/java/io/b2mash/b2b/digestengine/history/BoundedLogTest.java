package io.b2mash.b2b.digestengine.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.digestengine.schedule.ExecutionTrigger;
import io.b2mash.b2b.digestengine.schedule.ScheduleExecution;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BoundedLogTest {

  @Test
  void append_evictsOldestOnceFull() {
    var log = new BoundedLog<Integer>(100);

    IntStream.rangeClosed(1, 150).forEach(log::append);

    assertThat(log.size()).isEqualTo(100);
    assertThat(log.evictedCount()).isEqualTo(50);
    assertThat(log.snapshot().get(0)).isEqualTo(51);
    assertThat(log.snapshot().get(99)).isEqualTo(150);
  }

  @Test
  void recent_returnsNewestFirst() {
    var log = new BoundedLog<Integer>(10);
    IntStream.rangeClosed(1, 5).forEach(log::append);

    assertThat(log.recent(3)).containsExactly(5, 4, 3);
    assertThat(log.recent(50)).containsExactly(5, 4, 3, 2, 1);
  }

  @Test
  void recent_appliesFilterBeforeLimit() {
    var log = new BoundedLog<Integer>(10);
    IntStream.rangeClosed(1, 10).forEach(log::append);

    assertThat(log.recent(n -> n % 2 == 0, 3)).containsExactly(10, 8, 6);
  }

  @Test
  void constructor_rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new BoundedLog<String>(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void append_concurrentWritersNeverExceedCapacity() throws Exception {
    var log = new BoundedLog<Integer>(100);
    var pool = Executors.newFixedThreadPool(8);
    var start = new CountDownLatch(1);
    try {
      for (int t = 0; t < 8; t++) {
        int offset = t * 1000;
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 500; i++) {
                log.append(offset + i);
              }
              return null;
            });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(log.size()).isEqualTo(100);
    assertThat(log.evictedCount()).isEqualTo(3900);
  }

  @Test
  void executionLog_filtersBySchedule() {
    var executionLog = new ExecutionLog(100);
    var scheduleA = UUID.randomUUID();
    var scheduleB = UUID.randomUUID();
    var now = Instant.parse("2024-01-10T09:00:00Z");
    for (int i = 0; i < 5; i++) {
      executionLog.append(failed(scheduleA, now.plusSeconds(i)));
      executionLog.append(failed(scheduleB, now.plusSeconds(i)));
    }

    var forA = executionLog.forSchedule(scheduleA, 3);

    assertThat(forA).hasSize(3).allMatch(e -> e.getScheduleId().equals(scheduleA));
    assertThat(forA.get(0).getExecutedAt()).isEqualTo(now.plusSeconds(4));
  }

  private static ScheduleExecution failed(UUID scheduleId, Instant at) {
    return ScheduleExecution.failed(scheduleId, ExecutionTrigger.TIMER, at, 1, "boom");
  }
}
