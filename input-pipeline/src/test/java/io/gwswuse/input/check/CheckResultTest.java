package io.gwswuse.input.check;

import io.gwswuse.input.grid.DatasetKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class CheckResultTest {

  @Test
  void emptyResultListsEveryCategory() {
    CheckResult result = CheckResult.builder().build();

    assertThat(result.asMap()).hasSize(FindingCategory.values().length);
    assertThat(result.isClean()).isTrue();
    for (FindingCategory c : FindingCategory.values()) {
      assertThat(result.get(c)).isEmpty();
    }
  }

  @Test
  void mergesBatchesWithoutLosingFindings() {
    DatasetKey key = DatasetKey.of("livestock", "consumptive_use_tot");
    CheckResult partial = CheckResult.builder()
        .add(Finding.ofSector(FindingCategory.missing_sectors, "domestic"))
        .build();

    CheckResult merged = CheckResult.builder()
        .addAll(List.of(
            Finding.of(FindingCategory.missing_variables, key, "no input data"),
            Finding.mismatch(FindingCategory.frequency_mismatch, key, "monthly", "annual")))
        .merge(partial)
        .build();

    assertThat(merged.count()).isEqualTo(3);
    assertThat(merged.messages(FindingCategory.missing_sectors)).containsExactly("domestic");
    assertThat(merged.messages(FindingCategory.frequency_mismatch))
        .containsExactly("livestock/consumptive_use_tot: found monthly, expected annual");
  }

  @Test
  void builtResultIsReadOnly() {
    CheckResult result = CheckResult.builder().build();

    assertThatThrownBy(() -> result.get(FindingCategory.unit_mismatch).add(
        Finding.ofSector(FindingCategory.unit_mismatch, "x")))
      .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> result.asMap().clear())
      .isInstanceOf(UnsupportedOperationException.class);
  }
}
