package io.gwswuse.cli;

import io.gwswuse.input.SimulationPeriod;
import io.gwswuse.input.align.AlignMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Settings of one ingestion run, taken from the configuration file and the
 * command line. Call {@link #validate()} before use.
 */
public class RunSettings {

  private static final Logger log = LogManager.getLogger(RunSettings.class);

  static final int EXTEND_WARNING_YEAR = 2050;

  public String inputData;
  public String convention;
  public String outputDir;
  public Integer startYear;
  public Integer endYear;
  public Boolean timeExtendMode;

  static RunSettings from(SimulationConfig c) {
    RunSettings s = new RunSettings();
    if (c.filePath != null) {
      s.outputDir = c.filePath.outputDir;
      if (c.filePath.inputDir != null) {
        s.inputData = c.filePath.inputDir.inputData;
        s.convention = c.filePath.inputDir.convention;
      }
    }
    if (c.runtimeOptions != null) {
      if (c.runtimeOptions.simulationPeriod != null) {
        s.startYear = c.runtimeOptions.simulationPeriod.start;
        s.endYear = c.runtimeOptions.simulationPeriod.end;
      }
      if (c.runtimeOptions.simulationOption != null) {
        s.timeExtendMode = c.runtimeOptions.simulationOption.timeExtendMode;
      }
    }
    return s;
  }

  public void validate() {
    if (isBlank(inputData)) fail("'input_data' path required");
    if (isBlank(convention)) fail("'gwswuse_convention' path required");
    if (!convention.endsWith(".json")) fail("Invalid 'gwswuse_convention' path: must end with '.json'");
    if (startYear == null || endYear == null) fail("'start' and 'end' years required");
    if (startYear > endYear) fail("'start' year must not be after 'end' year");
    if (timeExtendMode == null) fail("'time_extend_mode' must be a boolean");

    if (timeExtendMode && endYear > EXTEND_WARNING_YEAR) {
      log.warn("'time_extend_mode' is enabled with an end year after {}: input data will be repeated up to {}",
          EXTEND_WARNING_YEAR, endYear);
    }
  }

  public Path getInputDir() {
    return Path.of(inputData);
  }

  public Path getConventionPath() {
    return Path.of(convention);
  }

  public SimulationPeriod getPeriod() {
    return SimulationPeriod.of(startYear, endYear);
  }

  public AlignMode getAlignMode() {
    return AlignMode.fromExtendFlag(timeExtendMode);
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new ConfigException(msg); }
}
