package io.gwswuse.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gwswuse.input.check.CheckResult;
import io.gwswuse.input.check.Finding;
import io.gwswuse.input.check.FindingCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class ReportPrinterTest {

  @TempDir
  Path tempDir;

  private final ReportPrinter printer = new ReportPrinter();

  private final CheckResult result = CheckResult.builder()
      .add(Finding.ofSector(FindingCategory.missing_sectors, "domestic"))
      .build();

  @Test
  void listsEveryCategory() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    printer.print(result, new PrintStream(buffer, true, StandardCharsets.UTF_8));

    String text = buffer.toString(StandardCharsets.UTF_8);
    assertThat(text).contains("missing_sectors:\n  - domestic\n");
    assertThat(text).contains("unit_mismatch:\n  none\n");
    assertThat(text).contains("Input data check found 1 issue(s)");
  }

  @Test
  void writesJsonReport() throws Exception {
    Path file = printer.write(result, tempDir.resolve("out"));

    JsonNode json = new ObjectMapper().readTree(file.toFile());
    assertThat(file.getFileName().toString()).isEqualTo(ReportPrinter.REPORT_FILE);
    assertThat(json.get("missing_sectors").get(0).asText()).isEqualTo("domestic");
    assertThat(json.get("frequency_mismatch").isEmpty()).isTrue();
  }
}
