package io.gwswuse.input.grid;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One logical (time, lat, lon) grid holding a single data variable.
 *
 * <p>Instances are read-only. The public constructor copies the arrays it is
 * given; time slices are then shared between a dataset and the datasets
 * derived from it and are never written after construction. A static grid has
 * an empty time axis and exactly one slice.</p>
 */
public final class GridDataset {

  private final DatasetKey key;
  private final String variableName;
  private final String units;
  private final List<LocalDate> time;
  private final double[] lat;
  private final double[] lon;
  private final double[][][] values;

  public GridDataset(DatasetKey key,
                     String variableName,
                     String units,
                     List<LocalDate> time,
                     double[] lat,
                     double[] lon,
                     double[][][] values) {
    this(key, variableName, units, time, lat, lon, values, true);
  }

  private GridDataset(DatasetKey key,
                      String variableName,
                      String units,
                      List<LocalDate> time,
                      double[] lat,
                      double[] lon,
                      double[][][] values,
                      boolean copy) {
    this.key = Objects.requireNonNull(key, "key is required");
    this.variableName = variableName;
    this.units = units;
    this.time = time == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(time));
    Objects.requireNonNull(lat, "lat is required");
    Objects.requireNonNull(lon, "lon is required");
    Objects.requireNonNull(values, "values are required");

    int expectedSlices = this.time.isEmpty() ? 1 : this.time.size();
    if (values.length != expectedSlices) {
      throw new IllegalArgumentException(key + ": expected " + expectedSlices + " time slices, got " + values.length);
    }
    for (double[][] slice : values) {
      if (slice.length != lat.length) {
        throw new IllegalArgumentException(key + ": slice has " + slice.length + " rows, lat has " + lat.length);
      }
      for (double[] row : slice) {
        if (row.length != lon.length) {
          throw new IllegalArgumentException(key + ": slice row has " + row.length + " columns, lon has " + lon.length);
        }
      }
    }
    this.lat = copy ? lat.clone() : lat;
    this.lon = copy ? lon.clone() : lon;
    this.values = copy ? deepCopy(values) : values;
  }

  private static double[][][] deepCopy(double[][][] values) {
    double[][][] out = new double[values.length][][];
    for (int t = 0; t < values.length; t++) out[t] = copyOf(values[t]);
    return out;
  }

  private static double[][] copyOf(double[][] slice) {
    double[][] out = new double[slice.length][];
    for (int i = 0; i < slice.length; i++) out[i] = slice[i].clone();
    return out;
  }

  /** A dataset with the same grid and metadata but a different time axis. */
  public GridDataset withTimeAxis(List<LocalDate> newTime, double[][][] newValues) {
    return new GridDataset(key, variableName, units, newTime, lat, lon, newValues);
  }

  /**
   * Derives a dataset whose slice {@code k} is this dataset's slice
   * {@code sourceIndex[k]}, stamped with {@code newTime.get(k)}. Slices are shared, not copied.
   */
  public GridDataset selectSlices(List<LocalDate> newTime, int[] sourceIndex) {
    if (newTime.size() != sourceIndex.length) {
      throw new IllegalArgumentException(key + ": " + newTime.size() + " timestamps for " + sourceIndex.length + " slices");
    }
    double[][][] selected = new double[sourceIndex.length][][];
    for (int k = 0; k < sourceIndex.length; k++) {
      selected[k] = values[sourceIndex[k]];
    }
    return new GridDataset(key, variableName, units, newTime, lat, lon, selected, false);
  }

  /**
   * Returns this grid with latitude descending and longitude ascending,
   * permuting the values to match. Returns {@code this} when already ordered.
   */
  public GridDataset inCanonicalSpatialOrder() {
    Integer[] latOrder = order(lat, true);
    Integer[] lonOrder = order(lon, false);
    if (isIdentity(latOrder) && isIdentity(lonOrder)) {
      return this;
    }
    double[] sortedLat = new double[lat.length];
    double[] sortedLon = new double[lon.length];
    for (int i = 0; i < lat.length; i++) sortedLat[i] = lat[latOrder[i]];
    for (int j = 0; j < lon.length; j++) sortedLon[j] = lon[lonOrder[j]];

    double[][][] sorted = new double[values.length][lat.length][lon.length];
    for (int t = 0; t < values.length; t++) {
      for (int i = 0; i < lat.length; i++) {
        for (int j = 0; j < lon.length; j++) {
          sorted[t][i][j] = values[t][latOrder[i]][lonOrder[j]];
        }
      }
    }
    return new GridDataset(key, variableName, units, time, sortedLat, sortedLon, sorted, false);
  }

  private static Integer[] order(double[] coords, boolean descending) {
    Integer[] idx = new Integer[coords.length];
    for (int i = 0; i < idx.length; i++) idx[i] = i;
    Comparator<Integer> byCoord = (a, b) -> Double.compare(coords[a], coords[b]);
    Arrays.sort(idx, descending ? byCoord.reversed() : byCoord);
    return idx;
  }

  private static boolean isIdentity(Integer[] idx) {
    for (int i = 0; i < idx.length; i++) {
      if (idx[i] != i) return false;
    }
    return true;
  }

  public DatasetKey getKey() {
    return key;
  }

  /** Name of the data variable inside the grid files, checked against the reference names. */
  public String getVariableName() {
    return variableName;
  }

  /** Declared unit, or {@code null} when the files carry none. */
  public String getUnits() {
    return units;
  }

  public boolean hasTimeAxis() {
    return !time.isEmpty();
  }

  public List<LocalDate> getTime() {
    return time;
  }

  public int getTimeSteps() {
    return values.length;
  }

  public double[] getLatitudes() {
    return lat.clone();
  }

  public double[] getLongitudes() {
    return lon.clone();
  }

  public boolean hasSameGrid(GridDataset other) {
    return Arrays.equals(lat, other.lat) && Arrays.equals(lon, other.lon);
  }

  public double getValue(int timeIndex, int latIndex, int lonIndex) {
    return values[timeIndex][latIndex][lonIndex];
  }

  /** Copy of one time slice. */
  public double[][] getSlice(int timeIndex) {
    return copyOf(values[timeIndex]);
  }

  /** True when time axis, grid, units and every value are equal. */
  public boolean contentEquals(GridDataset other) {
    return other != null
        && Objects.equals(variableName, other.variableName)
        && Objects.equals(units, other.units)
        && time.equals(other.time)
        && hasSameGrid(other)
        && Arrays.deepEquals(values, other.values);
  }

  @Override
  public String toString() {
    String range = time.isEmpty() ? "static" : time.get(0) + ".." + time.get(time.size() - 1);
    return "GridDataset[" + key + ", " + variableName + ", " + units + ", " + range
        + ", " + lat.length + "x" + lon.length + "]";
  }
}
