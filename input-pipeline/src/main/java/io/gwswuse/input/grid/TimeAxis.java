package io.gwswuse.input.grid;

import io.gwswuse.core.TimeFrequency;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Time coordinate arithmetic shared by the checks and the aligner.
 * Periods are identified by their first day: the 1st of the month for monthly
 * data and January 1st for annual data.
 */
public final class TimeAxis {

  static final long MIN_MONTH_DAYS = 28;
  static final long MAX_MONTH_DAYS = 31;
  static final long MIN_YEAR_DAYS = 365;
  static final long MAX_YEAR_DAYS = 366;

  private TimeAxis() {}

  /**
   * Infers the reporting frequency from consecutive timestamp spacing. Every
   * delta must fall in the month window (28 to 31 days) or every delta in the
   * year window (365 to 366 days); anything else is irregular and yields empty.
   * A single timestamp is taken as annual.
   */
  public static Optional<TimeFrequency> inferFrequency(List<LocalDate> time) {
    if (time.isEmpty()) return Optional.empty();
    if (time.size() == 1) return Optional.of(TimeFrequency.annual);

    boolean monthly = true;
    boolean annual = true;
    for (int i = 1; i < time.size(); i++) {
      long days = ChronoUnit.DAYS.between(time.get(i - 1), time.get(i));
      monthly &= days >= MIN_MONTH_DAYS && days <= MAX_MONTH_DAYS;
      annual &= days >= MIN_YEAR_DAYS && days <= MAX_YEAR_DAYS;
    }
    if (monthly) return Optional.of(TimeFrequency.monthly);
    if (annual) return Optional.of(TimeFrequency.annual);
    return Optional.empty();
  }

  /** True when every timestamp is strictly later than the one before it. */
  public static boolean isStrictlyAscending(List<LocalDate> time) {
    for (int i = 1; i < time.size(); i++) {
      if (!time.get(i).isAfter(time.get(i - 1))) return false;
    }
    return true;
  }

  /** First day of the period containing {@code date}. */
  public static LocalDate periodStart(LocalDate date, TimeFrequency frequency) {
    return frequency == TimeFrequency.monthly ? date.withDayOfMonth(1) : date.withDayOfYear(1);
  }

  public static LocalDate firstPeriod(int year) {
    return LocalDate.of(year, 1, 1);
  }

  public static LocalDate lastPeriod(int year, TimeFrequency frequency) {
    return frequency == TimeFrequency.monthly ? LocalDate.of(year, 12, 1) : LocalDate.of(year, 1, 1);
  }

  /** Every period start from January of {@code startYear} to the last period of {@code endYear}. */
  public static List<LocalDate> periods(int startYear, int endYear, TimeFrequency frequency) {
    List<LocalDate> out = new ArrayList<>((endYear - startYear + 1) * frequency.periodsPerYear());
    LocalDate last = lastPeriod(endYear, frequency);
    for (LocalDate d = firstPeriod(startYear); !d.isAfter(last); d = next(d, frequency)) {
      out.add(d);
    }
    return out;
  }

  private static LocalDate next(LocalDate period, TimeFrequency frequency) {
    return frequency == TimeFrequency.monthly ? period.plusMonths(1) : period.plusYears(1);
  }
}
