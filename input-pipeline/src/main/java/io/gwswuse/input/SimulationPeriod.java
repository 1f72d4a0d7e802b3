package io.gwswuse.input;

/**
 * Inclusive range of simulation years.
 */
public final class SimulationPeriod {

  private final int startYear;
  private final int endYear;

  public SimulationPeriod(int startYear, int endYear) {
    if (startYear > endYear) {
      throw new IllegalArgumentException("start year " + startYear + " is after end year " + endYear);
    }
    this.startYear = startYear;
    this.endYear = endYear;
  }

  public static SimulationPeriod of(int startYear, int endYear) {
    return new SimulationPeriod(startYear, endYear);
  }

  public int getStartYear() {
    return startYear;
  }

  public int getEndYear() {
    return endYear;
  }

  public boolean contains(int year) {
    return year >= startYear && year <= endYear;
  }

  public int getYears() {
    return endYear - startYear + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SimulationPeriod)) return false;
    SimulationPeriod that = (SimulationPeriod) o;
    return startYear == that.startYear && endYear == that.endYear;
  }

  @Override
  public int hashCode() {
    return 31 * startYear + endYear;
  }

  @Override
  public String toString() {
    return startYear + "-" + endYear;
  }
}
