package io.gwswuse.cli;

import io.gwswuse.core.SchemaMalformedException;
import io.gwswuse.core.SchemaNotFoundException;
import io.gwswuse.input.InputDataPipeline;
import io.gwswuse.input.PipelineResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * CLI entry point: checks and preprocesses the input data of a simulation.
 *
 * Usage:
 *   java -jar gwswuse-cli.jar --config <gwswuse_config.json> [overrides]
 *   java -jar gwswuse-cli.jar --input <dir> --convention <file.json> --start <year> --end <year> [--extend]
 *
 * Overrides: --input, --convention, --output, --start, --end, --extend, --trim
 *
 * Exit codes: 0 run completed (findings may exist), 1 usage, configuration or
 * I/O error, 2 convention file missing or malformed.
 */
public class Main {

  private static final Logger log = LogManager.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_SCHEMA = 2;

  private static final String USAGE = "Usage: java -jar gwswuse-cli.jar [--config <path>] [--input <dir>] "
      + "[--convention <path>] [--output <dir>] [--start <year>] [--end <year>] [--extend | --trim]";

  private final InputDataPipeline pipeline;
  private final ReportPrinter printer;
  private final PrintStream out;
  private final PrintStream err;

  Main(InputDataPipeline pipeline, ReportPrinter printer, PrintStream out, PrintStream err) {
    this.pipeline = pipeline;
    this.printer = printer;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int code = new Main(new InputDataPipeline(), new ReportPrinter(), System.out, System.err).run(args);
    System.exit(code);
  }

  int run(String[] args) {
    RunSettings settings;
    try {
      settings = parse(args);
      settings.validate();
    } catch (ConfigException | IOException e) {
      err.println("Error: " + e.getMessage());
      err.println(USAGE);
      return EXIT_ERROR;
    }

    try {
      PipelineResult result = pipeline.run(
          settings.getInputDir(), settings.getConventionPath(), settings.getPeriod(), settings.getAlignMode());
      printer.print(result.getCheckResult(), out);
      if (settings.outputDir != null && !settings.outputDir.isEmpty()) {
        Path report = printer.write(result.getCheckResult(), Path.of(settings.outputDir));
        log.info("Check results written to {}", report);
      }
      return EXIT_OK;
    } catch (SchemaNotFoundException | SchemaMalformedException e) {
      log.error("Input data convention unusable: {}", e.getMessage());
      err.println("Error: " + e.getMessage());
      return EXIT_SCHEMA;
    } catch (IOException e) {
      log.error("Input data could not be read", e);
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  static RunSettings parse(String[] args) throws IOException {
    String configFile = null;
    for (int i = 0; i < args.length; i++) {
      if ("--config".equals(args[i])) {
        configFile = value(args, ++i, "--config");
      }
    }
    RunSettings s = configFile != null ? ConfigLoader.load(Path.of(configFile)) : new RunSettings();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--config":
          i++;
          break;
        case "--input":
          s.inputData = value(args, ++i, "--input");
          break;
        case "--convention":
          s.convention = value(args, ++i, "--convention");
          break;
        case "--output":
          s.outputDir = value(args, ++i, "--output");
          break;
        case "--start":
          s.startYear = year(value(args, ++i, "--start"));
          break;
        case "--end":
          s.endYear = year(value(args, ++i, "--end"));
          break;
        case "--extend":
          s.timeExtendMode = true;
          break;
        case "--trim":
          s.timeExtendMode = false;
          break;
        default:
          throw new ConfigException("Unknown argument " + args[i]);
      }
    }
    if (s.timeExtendMode == null && configFile == null) {
      s.timeExtendMode = false;
    }
    return s;
  }

  private static String value(String[] args, int i, String flag) {
    if (i >= args.length) throw new ConfigException(flag + " requires a value");
    return args[i];
  }

  private static int year(String s) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new ConfigException("Not a year: " + s, e);
    }
  }
}
