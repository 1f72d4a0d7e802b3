package io.gwswuse.input.grid;

import java.util.Objects;

/**
 * Identifies one (sector, variable) pair of the input tree.
 */
public final class DatasetKey implements Comparable<DatasetKey> {

  private final String sector;
  private final String variable;

  public DatasetKey(String sector, String variable) {
    this.sector = Objects.requireNonNull(sector, "sector is required");
    this.variable = Objects.requireNonNull(variable, "variable is required");
  }

  public static DatasetKey of(String sector, String variable) {
    return new DatasetKey(sector, variable);
  }

  public String getSector() {
    return sector;
  }

  public String getVariable() {
    return variable;
  }

  @Override
  public int compareTo(DatasetKey o) {
    int c = sector.compareTo(o.sector);
    return c != 0 ? c : variable.compareTo(o.variable);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DatasetKey)) return false;
    DatasetKey that = (DatasetKey) o;
    return sector.equals(that.sector) && variable.equals(that.variable);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sector, variable);
  }

  /** Same form as the input folder path, e.g. {@code irrigation/consumptive_use_tot}. */
  @Override
  public String toString() {
    return sector + "/" + variable;
  }
}
