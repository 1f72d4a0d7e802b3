package io.gwswuse.input.check;

import io.gwswuse.input.grid.DatasetKey;

import java.util.Objects;

/**
 * One recorded input problem. {@code variable}, {@code found} and
 * {@code expected} are {@code null} where the category has no such detail.
 */
public final class Finding {

  private final FindingCategory category;
  private final String sector;
  private final String variable;
  private final String found;
  private final String expected;
  private final String message;

  public Finding(FindingCategory category, String sector, String variable,
                 String found, String expected, String message) {
    this.category = Objects.requireNonNull(category, "category is required");
    this.sector = Objects.requireNonNull(sector, "sector is required");
    this.variable = variable;
    this.found = found;
    this.expected = expected;
    this.message = Objects.requireNonNull(message, "message is required");
  }

  public static Finding ofSector(FindingCategory category, String sector) {
    return new Finding(category, sector, null, null, null, sector);
  }

  public static Finding of(FindingCategory category, DatasetKey key, String detail) {
    return new Finding(category, key.getSector(), key.getVariable(), null, null, key + ": " + detail);
  }

  public static Finding mismatch(FindingCategory category, DatasetKey key, String found, String expected) {
    return new Finding(category, key.getSector(), key.getVariable(), found, expected,
        key + ": found " + found + ", expected " + expected);
  }

  public FindingCategory getCategory() {
    return category;
  }

  public String getSector() {
    return sector;
  }

  public String getVariable() {
    return variable;
  }

  public String getFound() {
    return found;
  }

  public String getExpected() {
    return expected;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Finding)) return false;
    Finding that = (Finding) o;
    return category == that.category && sector.equals(that.sector)
        && Objects.equals(variable, that.variable) && Objects.equals(found, that.found)
        && Objects.equals(expected, that.expected) && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, sector, variable, found, expected, message);
  }

  @Override
  public String toString() {
    return message;
  }
}
