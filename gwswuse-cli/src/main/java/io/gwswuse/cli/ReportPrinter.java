package io.gwswuse.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.gwswuse.input.check.CheckResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Presents check results: a plain listing for the console and a JSON file
 * for the output directory.
 */
public class ReportPrinter {

  public static final String REPORT_FILE = "input_data_check_results.json";

  private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public void print(CheckResult result, PrintStream out) {
    for (Map.Entry<String, List<String>> e : result.asMap().entrySet()) {
      out.println(e.getKey() + ":");
      if (e.getValue().isEmpty()) {
        out.println("  none");
      } else {
        e.getValue().forEach(item -> out.println("  - " + item));
      }
    }
    out.println();
    out.println(result.isClean()
        ? "Input data check passed"
        : "Input data check found " + result.count() + " issue(s)");
  }

  public Path write(CheckResult result, Path outputDir) throws IOException {
    Files.createDirectories(outputDir);
    Path file = outputDir.resolve(REPORT_FILE);
    mapper.writeValue(file.toFile(), result.asMap());
    return file;
  }
}
