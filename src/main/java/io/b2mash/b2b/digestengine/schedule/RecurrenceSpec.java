package io.b2mash.b2b.digestengine.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * When a schedule fires. {@code dayOfWeek} uses 0 = Sunday through 6 = Saturday. {@code anchorDate}
 * is the origin of the biweekly cycle: runs fall on the configured weekday of the anchor's week and
 * every 14 days after it.
 */
public record RecurrenceSpec(
    Frequency frequency,
    Integer dayOfWeek,
    Integer dayOfMonth,
    LocalTime timeOfDay,
    ZoneId zone,
    LocalDate anchorDate) {

  public RecurrenceSpec {
    Objects.requireNonNull(frequency, "frequency");
    Objects.requireNonNull(timeOfDay, "timeOfDay");
    Objects.requireNonNull(zone, "zone");
    if (frequency.requiresDayOfWeek() && (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6)) {
      throw new IllegalArgumentException(frequency.wireName() + " requires dayOfWeek 0-6");
    }
    if (frequency.requiresDayOfMonth()
        && (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31)) {
      throw new IllegalArgumentException("monthly requires dayOfMonth 1-31");
    }
    if (frequency == Frequency.BIWEEKLY) {
      Objects.requireNonNull(anchorDate, "biweekly requires an anchorDate");
    }
    timeOfDay = timeOfDay.withSecond(0).withNano(0);
  }

  public static RecurrenceSpec daily(LocalTime timeOfDay, ZoneId zone) {
    return new RecurrenceSpec(Frequency.DAILY, null, null, timeOfDay, zone, null);
  }

  public static RecurrenceSpec weekly(int dayOfWeek, LocalTime timeOfDay, ZoneId zone) {
    return new RecurrenceSpec(Frequency.WEEKLY, dayOfWeek, null, timeOfDay, zone, null);
  }

  public static RecurrenceSpec biweekly(
      int dayOfWeek, LocalTime timeOfDay, ZoneId zone, LocalDate anchorDate) {
    return new RecurrenceSpec(Frequency.BIWEEKLY, dayOfWeek, null, timeOfDay, zone, anchorDate);
  }

  public static RecurrenceSpec monthly(int dayOfMonth, LocalTime timeOfDay, ZoneId zone) {
    return new RecurrenceSpec(Frequency.MONTHLY, null, dayOfMonth, timeOfDay, zone, null);
  }

  /** The configured weekday; only meaningful for weekly and biweekly specs. */
  public DayOfWeek weekday() {
    return toDayOfWeek(dayOfWeek);
  }

  /** Maps the 0 = Sunday convention onto {@link DayOfWeek}. */
  public static DayOfWeek toDayOfWeek(int sundayZeroIndex) {
    return DayOfWeek.of(sundayZeroIndex == 0 ? 7 : sundayZeroIndex);
  }

  /** Short human description, e.g. "Every two weeks on Monday at 09:00". */
  public String describe() {
    String time = timeOfDay.toString();
    return switch (frequency) {
      case DAILY -> "Daily at " + time;
      case WEEKLY -> "Weekly on " + weekdayName() + " at " + time;
      case BIWEEKLY -> "Every two weeks on " + weekdayName() + " at " + time;
      case MONTHLY -> "Monthly on day " + dayOfMonth + " at " + time;
    };
  }

  private String weekdayName() {
    return weekday().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
  }
}
