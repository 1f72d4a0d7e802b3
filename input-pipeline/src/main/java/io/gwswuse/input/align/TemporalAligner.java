package io.gwswuse.input.align;

import io.gwswuse.core.TimeFrequency;
import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.SimulationPeriod;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;
import io.gwswuse.input.grid.TimeAxis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Reshapes dataset time axes to the simulation period at the sector's
 * frequency. Values are copied, never rescaled, and units are kept.
 *
 * <p>{@link AlignMode#trim} drops periods outside the simulation years.
 * {@link AlignMode#extend} produces every period of the simulation years:
 * periods before the data repeat the first data year (month by month for
 * monthly sectors), periods after it repeat the last data year, and gaps
 * inside the data carry the nearest earlier period forward.</p>
 *
 * <p>Both modes stamp every output slice with the start of its period and
 * keep one slice per period: the earliest input slice falling in it. Data
 * finer than the sector frequency, such as monthly data for an annual sector,
 * therefore keeps only the first slice of each year. Such datasets are
 * reported as {@code frequency_mismatch} by the input checks.</p>
 */
public class TemporalAligner {

  private static final Logger log = LogManager.getLogger(TemporalAligner.class);

  /**
   * Aligns every dataset. The first dataset that cannot be aligned aborts the
   * call; use {@link #alignDataset} to handle failures one dataset at a time.
   */
  public Map<DatasetKey, GridDataset> align(Map<DatasetKey, GridDataset> discovered,
                                            ConventionSchema schema,
                                            SimulationPeriod period,
                                            AlignMode mode) {
    Map<DatasetKey, GridDataset> aligned = new LinkedHashMap<>();
    for (Map.Entry<DatasetKey, GridDataset> e : discovered.entrySet()) {
      aligned.put(e.getKey(), alignDataset(e.getValue(), schema, period, mode));
    }
    return aligned;
  }

  /**
   * Aligns one discovered dataset using its sector's frequency. Static grids
   * of variables that are not time-variant pass through unchanged.
   */
  public GridDataset alignDataset(GridDataset dataset,
                                  ConventionSchema schema,
                                  SimulationPeriod period,
                                  AlignMode mode) {
    DatasetKey key = dataset.getKey();
    ConventionSchema.SectorSpec spec = schema.getSector(key.getSector());
    if (spec == null) {
      throw new IllegalArgumentException(key + ": sector is not part of the convention");
    }
    if (!dataset.hasTimeAxis()) {
      if (schema.isTimeVariant(key.getVariable())) {
        throw new MalformedTimeAxisException(key, "time-variant variable has no time coordinate");
      }
      return dataset;
    }
    return align(dataset, spec.getTimeFrequency(), period, mode);
  }

  public GridDataset align(GridDataset dataset, TimeFrequency frequency, SimulationPeriod period, AlignMode mode) {
    DatasetKey key = dataset.getKey();
    if (!dataset.hasTimeAxis()) {
      return dataset;
    }
    if (!TimeAxis.isStrictlyAscending(dataset.getTime())) {
      throw new MalformedTimeAxisException(key, "timestamps are not strictly ascending");
    }
    GridDataset aligned = mode == AlignMode.extend
        ? extend(dataset, frequency, period)
        : trim(dataset, frequency, period);
    log.debug("{}: {} to {} gives {} time steps", key, mode, period, aligned.getTimeSteps());
    return aligned;
  }

  GridDataset trim(GridDataset dataset, TimeFrequency frequency, SimulationPeriod period) {
    List<LocalDate> time = dataset.getTime();
    List<LocalDate> kept = new ArrayList<>();
    List<Integer> source = new ArrayList<>();
    for (int t = 0; t < time.size(); t++) {
      if (!period.contains(time.get(t).getYear())) continue;
      LocalDate p = TimeAxis.periodStart(time.get(t), frequency);
      if (kept.isEmpty() || !kept.get(kept.size() - 1).equals(p)) {
        kept.add(p);
        source.add(t);
      }
    }
    if (kept.isEmpty()) {
      throw new InsufficientCoverageException(dataset.getKey(), "data covering " + time.get(0).getYear()
          + "-" + time.get(time.size() - 1).getYear() + " does not overlap simulation period " + period);
    }
    if (kept.equals(time)) {
      return dataset;
    }
    return dataset.selectSlices(kept, toArray(source));
  }

  GridDataset extend(GridDataset dataset, TimeFrequency frequency, SimulationPeriod period) {
    List<LocalDate> target = TimeAxis.periods(period.getStartYear(), period.getEndYear(), frequency);
    if (target.equals(dataset.getTime())) {
      return dataset;
    }

    // period start -> first input slice in that period
    NavigableMap<LocalDate, Integer> byPeriod = new TreeMap<>();
    List<LocalDate> time = dataset.getTime();
    for (int t = 0; t < time.size(); t++) {
      byPeriod.putIfAbsent(TimeAxis.periodStart(time.get(t), frequency), t);
    }
    LocalDate firstPeriod = TimeAxis.periodStart(time.get(0), frequency);
    LocalDate lastPeriod = TimeAxis.periodStart(time.get(time.size() - 1), frequency);

    int[] source = new int[target.size()];
    for (int k = 0; k < target.size(); k++) {
      LocalDate p = target.get(k);
      Integer direct = byPeriod.get(p);
      if (direct != null) {
        source[k] = direct;
      } else if (p.isBefore(firstPeriod)) {
        source[k] = boundarySlice(byPeriod, firstPeriod.getYear(), p, frequency, 0);
      } else if (p.isAfter(lastPeriod)) {
        source[k] = boundarySlice(byPeriod, lastPeriod.getYear(), p, frequency, time.size() - 1);
      } else {
        // gap inside the data
        source[k] = byPeriod.lowerEntry(p).getValue();
      }
    }
    return dataset.selectSlices(target, source);
  }

  /** The slice of {@code boundaryYear} in the same calendar month as {@code p}, else {@code fallback}. */
  private static int boundarySlice(Map<LocalDate, Integer> byPeriod, int boundaryYear, LocalDate p,
                                   TimeFrequency frequency, int fallback) {
    if (frequency == TimeFrequency.annual) {
      return fallback;
    }
    Integer sameMonth = byPeriod.get(LocalDate.of(boundaryYear, p.getMonthValue(), 1));
    return sameMonth != null ? sameMonth : fallback;
  }

  private static int[] toArray(List<Integer> list) {
    int[] out = new int[list.size()];
    for (int i = 0; i < out.length; i++) out[i] = list.get(i);
    return out;
  }
}
