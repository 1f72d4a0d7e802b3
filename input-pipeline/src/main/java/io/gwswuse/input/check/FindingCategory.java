package io.gwswuse.input.check;

/**
 * Kinds of input problems. Names are the report keys.
 */
public enum FindingCategory {
  missing_sectors,
  missing_variables,
  unreadable_input,
  unknown_variable_names,
  missing_unit,
  unit_mismatch,
  missing_time_coords,
  frequency_mismatch,
  time_range_mismatch,
  lat_lon_inconsistency,
  malformed_time_axis,
  insufficient_coverage;

  public String key() {
    return name();
  }
}
