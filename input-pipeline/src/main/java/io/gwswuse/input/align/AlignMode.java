package io.gwswuse.input.align;

/**
 * How a dataset's time axis is reconciled with the simulation period.
 */
public enum AlignMode {
  /** Keep only periods inside the simulation period. */
  trim,
  /** Cover every period of the simulation period, repeating boundary values outside the data. */
  extend;

  public static AlignMode fromExtendFlag(boolean timeExtendMode) {
    return timeExtendMode ? extend : trim;
  }
}
