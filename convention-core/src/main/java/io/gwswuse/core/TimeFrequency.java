package io.gwswuse.core;

/**
 * Reporting cadence of a sector's time-variant input.
 */
public enum TimeFrequency {
  monthly(12), annual(1);

  private final int periodsPerYear;

  TimeFrequency(int periodsPerYear) {
    this.periodsPerYear = periodsPerYear;
  }

  public int periodsPerYear() {
    return periodsPerYear;
  }

  public static boolean isValid(String s) {
    return fromName(s) != null;
  }

  /** Resolves a convention {@code time_freq} value; "yearly" is accepted for annual. */
  public static TimeFrequency fromName(String s) {
    if (s == null) return null;
    if ("yearly".equals(s)) return annual;
    for (TimeFrequency f : values()) {
      if (f.name().equals(s)) return f;
    }
    return null;
  }
}
