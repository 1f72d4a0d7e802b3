package io.gwswuse.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Binding of the parts of the simulation configuration file that input data
 * ingestion reads. Sector model options in the same file are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationConfig {
  @JsonProperty("FilePath")
  public FilePath filePath;

  @JsonProperty("RuntimeOptions")
  public RuntimeOptions runtimeOptions;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FilePath {
    @JsonProperty("inputDir")
    public InputDir inputDir;

    @JsonProperty("outputDir")
    public String outputDir;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class InputDir {
    @JsonProperty("input_data")
    public String inputData;

    @JsonProperty("gwswuse_convention")
    public String convention;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RuntimeOptions {
    @JsonProperty("SimulationPeriod")
    public Period simulationPeriod;

    @JsonProperty("SimulationOption")
    public Options simulationOption;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Period {
    public Integer start;
    public Integer end;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Options {
    @JsonProperty("time_extend_mode")
    public Boolean timeExtendMode;
  }
}
