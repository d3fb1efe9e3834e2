package io.b2mash.b2b.digestengine.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link RecurrenceSpec} and a reference instant into the next run instant. Pure and
 * deterministic; the result is always strictly after the reference instant.
 *
 * <p>All date arithmetic happens in the spec's zone. A local time that falls into a daylight-saving
 * gap resolves to the instant the gap ends; one that falls into an overlap resolves to the earlier
 * of its two instants.
 */
@Component
public class RecurrenceCalculator {

  public Instant nextRun(RecurrenceSpec spec, Instant referenceNow) {
    LocalDate today = LocalDate.ofInstant(referenceNow, spec.zone());
    return switch (spec.frequency()) {
      case DAILY -> firstOccurrenceAfter(spec, today, 1, referenceNow);
      case WEEKLY ->
          firstOccurrenceAfter(
              spec, today.with(TemporalAdjusters.nextOrSame(spec.weekday())), 7, referenceNow);
      case BIWEEKLY -> nextBiweekly(spec, today, referenceNow);
      case MONTHLY -> nextMonthly(spec, today, referenceNow);
    };
  }

  /**
   * Biweekly runs are pinned to the cycle that starts on the first matching weekday on or after the
   * anchor date, so consecutive computations never drift between the two candidate weeks.
   */
  private Instant nextBiweekly(RecurrenceSpec spec, LocalDate today, Instant referenceNow) {
    LocalDate origin = spec.anchorDate().with(TemporalAdjusters.nextOrSame(spec.weekday()));
    LocalDate start = origin;
    if (today.isAfter(origin)) {
      long cycles = ChronoUnit.DAYS.between(origin, today) / 14;
      start = origin.plusDays(cycles * 14);
    }
    return firstOccurrenceAfter(spec, start, 14, referenceNow);
  }

  /** Days past the end of a month clamp to its last day; they never roll into the next month. */
  private Instant nextMonthly(RecurrenceSpec spec, LocalDate today, Instant referenceNow) {
    YearMonth month = YearMonth.from(today);
    while (true) {
      LocalDate date = month.atDay(Math.min(spec.dayOfMonth(), month.lengthOfMonth()));
      Instant candidate = resolve(spec, date);
      if (candidate.isAfter(referenceNow)) {
        return candidate;
      }
      month = month.plusMonths(1);
    }
  }

  private Instant firstOccurrenceAfter(
      RecurrenceSpec spec, LocalDate date, int stepDays, Instant referenceNow) {
    Instant candidate = resolve(spec, date);
    while (!candidate.isAfter(referenceNow)) {
      date = date.plusDays(stepDays);
      candidate = resolve(spec, date);
    }
    return candidate;
  }

  Instant resolve(RecurrenceSpec spec, LocalDate date) {
    LocalDateTime local = date.atTime(spec.timeOfDay());
    var rules = spec.zone().getRules();
    if (rules.getValidOffsets(local).isEmpty()) {
      // Gap: the nominal time does not exist, the first valid instant after it is the transition.
      return rules.getTransition(local).getInstant();
    }
    // ofLocal without a preferred offset picks the earlier offset inside an overlap.
    return ZonedDateTime.ofLocal(local, spec.zone(), null).toInstant();
  }
}
