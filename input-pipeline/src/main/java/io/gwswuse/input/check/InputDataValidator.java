package io.gwswuse.input.check;

import io.gwswuse.core.TimeFrequency;
import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.SimulationPeriod;
import io.gwswuse.input.align.AlignMode;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;
import io.gwswuse.input.grid.TimeAxis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks discovered datasets against the convention and collects every
 * problem as a {@link Finding}. Nothing here throws for bad input data, and the
 * datasets are never modified.
 *
 * <p>A sector with no dataset at all is reported once under
 * {@code missing_sectors}; its variables are then not listed individually.
 * Pairs whose files exist but could not be read are reported by discovery,
 * so they count as present here and are not listed as missing.</p>
 */
public class InputDataValidator {

  private static final Logger log = LogManager.getLogger(InputDataValidator.class);

  public CheckResult validate(Map<DatasetKey, GridDataset> discovered,
                              ConventionSchema schema,
                              SimulationPeriod period,
                              AlignMode mode) {
    return validate(discovered, Set.of(), schema, period, mode);
  }

  /**
   * @param unreadable pairs whose files exist on disk but could not be loaded
   */
  public CheckResult validate(Map<DatasetKey, GridDataset> discovered,
                              Set<DatasetKey> unreadable,
                              ConventionSchema schema,
                              SimulationPeriod period,
                              AlignMode mode) {
    CheckResult.Builder result = CheckResult.builder();
    GridDataset gridReference = null;

    for (Map.Entry<String, ConventionSchema.SectorSpec> entry : schema.getSectorRequirements().entrySet()) {
      String sector = entry.getKey();
      ConventionSchema.SectorSpec spec = entry.getValue();

      if (discovered.keySet().stream().noneMatch(k -> k.getSector().equals(sector))
          && unreadable.stream().noneMatch(k -> k.getSector().equals(sector))) {
        result.add(Finding.ofSector(FindingCategory.missing_sectors, sector));
        continue;
      }

      for (String variable : spec.getExpectedVars()) {
        DatasetKey key = DatasetKey.of(sector, variable);
        GridDataset dataset = discovered.get(key);
        if (dataset == null) {
          if (unreadable.contains(key)) continue;
          result.add(Finding.of(FindingCategory.missing_variables, key, "no input data"));
          continue;
        }
        if (gridReference == null) {
          gridReference = dataset;
        }
        result.addAll(checkDataset(key, dataset, spec, schema, period, mode, gridReference));
      }
    }

    CheckResult checks = result.build();
    log.info("Input data checks finished with {} findings", checks.count());
    return checks;
  }

  /** All checks for one (sector, variable) pair, independent of every other pair. */
  List<Finding> checkDataset(DatasetKey key,
                             GridDataset dataset,
                             ConventionSchema.SectorSpec spec,
                             ConventionSchema schema,
                             SimulationPeriod period,
                             AlignMode mode,
                             GridDataset gridReference) {
    List<Finding> findings = new ArrayList<>();

    if (!schema.isReferenceName(dataset.getVariableName())) {
      findings.add(new Finding(FindingCategory.unknown_variable_names, key.getSector(), key.getVariable(),
          dataset.getVariableName(), null,
          key + ": data variable '" + dataset.getVariableName() + "' is not a reference name"));
    }

    if (spec.requiresUnit(key.getVariable())) {
      checkUnit(key, dataset, spec, findings);
    }

    if (dataset != gridReference && !dataset.hasSameGrid(gridReference)) {
      findings.add(Finding.of(FindingCategory.lat_lon_inconsistency, key,
          "lat/lon coordinates differ from " + gridReference.getKey()));
    }

    if (schema.isTimeVariant(key.getVariable())) {
      if (!dataset.hasTimeAxis()) {
        findings.add(Finding.of(FindingCategory.missing_time_coords, key, "no time coordinate"));
      } else {
        checkFrequency(key, dataset, spec.getTimeFrequency(), findings);
        if (mode == AlignMode.trim) {
          checkCoverage(key, dataset, spec.getTimeFrequency(), period, findings);
        }
      }
    }

    findings.forEach(f -> log.warn("{}: {}", f.getCategory().key(), f.getMessage()));
    return findings;
  }

  private static void checkUnit(DatasetKey key, GridDataset dataset, ConventionSchema.SectorSpec spec,
                                List<Finding> findings) {
    String expected = spec.getExpectedUnits().toString();
    String unit = dataset.getUnits();
    if (unit == null) {
      findings.add(new Finding(FindingCategory.missing_unit, key.getSector(), key.getVariable(), null, expected,
          key + ": no unit declared, expected " + expected));
    } else if (!spec.acceptsUnit(unit)) {
      findings.add(new Finding(FindingCategory.unit_mismatch, key.getSector(), key.getVariable(), unit, expected,
          key + ": found unit '" + unit + "', expected " + expected));
    }
  }

  private static void checkFrequency(DatasetKey key, GridDataset dataset, TimeFrequency declared,
                                     List<Finding> findings) {
    Optional<TimeFrequency> observed = TimeAxis.inferFrequency(dataset.getTime());
    if (observed.isEmpty() || observed.get() != declared) {
      String found = observed.map(Enum::name).orElse("irregular");
      findings.add(Finding.mismatch(FindingCategory.frequency_mismatch, key, found, declared.name()));
    }
  }

  private static void checkCoverage(DatasetKey key, GridDataset dataset, TimeFrequency frequency,
                                    SimulationPeriod period, List<Finding> findings) {
    List<LocalDate> time = dataset.getTime();
    LocalDate first = TimeAxis.periodStart(Collections.min(time), frequency);
    LocalDate last = TimeAxis.periodStart(Collections.max(time), frequency);
    boolean coversStart = !first.isAfter(TimeAxis.firstPeriod(period.getStartYear()));
    boolean coversEnd = !last.isBefore(TimeAxis.lastPeriod(period.getEndYear(), frequency));
    if (!coversStart || !coversEnd) {
      String found = first + ".." + last;
      findings.add(new Finding(FindingCategory.time_range_mismatch, key.getSector(), key.getVariable(),
          found, period.toString(),
          key + ": data covers " + found + ", simulation period is " + period));
    }
  }
}
