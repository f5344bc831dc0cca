package io.taskline.recurring;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;

/**
 * When a recurring job becomes due, as a pure function of its last run time.
 *
 * <p>{@link #nextDue(Instant)} returns the first occurrence strictly after the last run.
 * Occurrences missed while no scheduler was running collapse into a single due time;
 * they are never replayed one by one.
 *
 * <pre>{@code
 * CadenceRule.every(Duration.ofHours(6));
 * CadenceRule.daily(LocalTime.of(2, 0), zone);
 * CadenceRule.weekly(DayOfWeek.SUNDAY, LocalTime.of(3, 0), zone);
 * CadenceRule.parse("weekly SUNDAY 03:00", zone);
 * }</pre>
 */
public sealed interface CadenceRule permits CadenceRule.Interval, CadenceRule.Daily, CadenceRule.Weekly {

  /**
   * Returns the first occurrence strictly after {@code lastRun}.
   *
   * @param lastRun the last time a job was enqueued for this rule
   * @return the next due time
   */
  Instant nextDue(Instant lastRun);

  /**
   * Returns the rule in the form accepted by {@link #parse(String, ZoneId)}.
   */
  String describe();

  static CadenceRule every(Duration period) {
    return new Interval(period);
  }

  static CadenceRule daily(LocalTime time, ZoneId zone) {
    return new Daily(time, zone);
  }

  static CadenceRule weekly(DayOfWeek day, LocalTime time, ZoneId zone) {
    return new Weekly(day, time, zone);
  }

  /**
   * Parses {@code "every <n><s|m|h|d>"}, {@code "daily HH:mm"} or {@code "weekly <DAY> HH:mm"}.
   *
   * @param expression the cadence expression, case-insensitive
   * @param zone       zone for daily and weekly rules
   * @return the rule
   * @throws IllegalArgumentException if the expression is malformed
   */
  static CadenceRule parse(String expression, ZoneId zone) {
    Objects.requireNonNull(expression, "expression");
    String[] parts = expression.trim().split("\\s+");
    String kind = parts[0].toLowerCase(Locale.ROOT);
    try {
      if (kind.equals("every") && parts.length == 2) {
        return new Interval(parseDuration(parts[1]));
      }
      if (kind.equals("daily") && parts.length == 2) {
        return new Daily(LocalTime.parse(parts[1]), zone);
      }
      if (kind.equals("weekly") && parts.length == 3) {
        return new Weekly(DayOfWeek.valueOf(parts[1].toUpperCase(Locale.ROOT)), LocalTime.parse(parts[2]), zone);
      }
    } catch (DateTimeParseException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid cadence expression: '" + expression + "'", e);
    }
    throw new IllegalArgumentException("Invalid cadence expression: '" + expression
        + "' (expected 'every 6h', 'daily 02:00' or 'weekly SUNDAY 03:00')");
  }

  private static Duration parseDuration(String text) {
    if (text.length() < 2) {
      throw new IllegalArgumentException("Invalid duration: " + text);
    }
    long amount = Long.parseLong(text.substring(0, text.length() - 1));
    char unit = Character.toLowerCase(text.charAt(text.length() - 1));
    switch (unit) {
      case 's':
        return Duration.ofSeconds(amount);
      case 'm':
        return Duration.ofMinutes(amount);
      case 'h':
        return Duration.ofHours(amount);
      case 'd':
        return Duration.ofDays(amount);
      default:
        throw new IllegalArgumentException("Unknown duration unit '" + unit + "' in " + text);
    }
  }

  /**
   * Fixed period after the last run.
   *
   * @param period time between runs (&gt; 0)
   */
  record Interval(Duration period) implements CadenceRule {
    public Interval {
      Objects.requireNonNull(period, "period");
      if (period.isNegative() || period.isZero()) {
        throw new IllegalArgumentException("period must be positive");
      }
    }

    @Override
    public Instant nextDue(Instant lastRun) {
      return lastRun.plus(period);
    }

    @Override
    public String describe() {
      long seconds = period.getSeconds();
      if (period.getNano() != 0) {
        return "every " + period;
      }
      if (seconds % 86_400 == 0) {
        return "every " + seconds / 86_400 + "d";
      }
      if (seconds % 3_600 == 0) {
        return "every " + seconds / 3_600 + "h";
      }
      if (seconds % 60 == 0) {
        return "every " + seconds / 60 + "m";
      }
      return "every " + seconds + "s";
    }
  }

  /**
   * Once a day at a wall-clock time.
   *
   * @param time local time of day
   * @param zone zone the time is interpreted in
   */
  record Daily(LocalTime time, ZoneId zone) implements CadenceRule {
    public Daily {
      Objects.requireNonNull(time, "time");
      Objects.requireNonNull(zone, "zone");
    }

    @Override
    public Instant nextDue(Instant lastRun) {
      LocalDate day = lastRun.atZone(zone).toLocalDate();
      Instant candidate = ZonedDateTime.of(day, time, zone).toInstant();
      if (candidate.isAfter(lastRun)) {
        return candidate;
      }
      return ZonedDateTime.of(day.plusDays(1), time, zone).toInstant();
    }

    @Override
    public String describe() {
      return "daily " + time;
    }
  }

  /**
   * Once a week on a given day at a wall-clock time.
   *
   * @param day  day of the week
   * @param time local time of day
   * @param zone zone the day and time are interpreted in
   */
  record Weekly(DayOfWeek day, LocalTime time, ZoneId zone) implements CadenceRule {
    public Weekly {
      Objects.requireNonNull(day, "day");
      Objects.requireNonNull(time, "time");
      Objects.requireNonNull(zone, "zone");
    }

    @Override
    public Instant nextDue(Instant lastRun) {
      LocalDate date = lastRun.atZone(zone).toLocalDate().with(TemporalAdjusters.nextOrSame(day));
      Instant candidate = ZonedDateTime.of(date, time, zone).toInstant();
      if (candidate.isAfter(lastRun)) {
        return candidate;
      }
      return ZonedDateTime.of(date.plusWeeks(1), time, zone).toInstant();
    }

    @Override
    public String describe() {
      return "weekly " + day + " " + time;
    }
  }
}
