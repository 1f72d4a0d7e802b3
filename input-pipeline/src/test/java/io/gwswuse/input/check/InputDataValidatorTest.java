package io.gwswuse.input.check;

import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.GridFixtures;
import io.gwswuse.input.SimulationPeriod;
import io.gwswuse.input.align.AlignMode;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.gwswuse.input.GridFixtures.annual;
import static io.gwswuse.input.GridFixtures.dataset;
import static io.gwswuse.input.GridFixtures.monthly;
import static org.assertj.core.api.Assertions.*;

public class InputDataValidatorTest {

  private static final SimulationPeriod PERIOD = SimulationPeriod.of(2000, 2002);
  private static final DatasetKey IRR_CU = DatasetKey.of("irrigation", "consumptive_use_tot");
  private static final DatasetKey DOM_CU = DatasetKey.of("domestic", "consumptive_use_tot");
  private static final DatasetKey DOM_WU = DatasetKey.of("domestic", "abstraction_tot");

  private final InputDataValidator validator = new InputDataValidator();
  private ConventionSchema schema;
  private Map<DatasetKey, GridDataset> input;

  @BeforeEach
  void setUp() {
    schema = GridFixtures.schema();
    input = new LinkedHashMap<>(GridFixtures.completeInput(2000, 2002));
  }

  private CheckResult check(AlignMode mode) {
    return validator.validate(input, schema, PERIOD, mode);
  }

  @Test
  void completeInputHasNoFindings() {
    CheckResult result = check(AlignMode.trim);

    assertThat(result.isClean()).isTrue();
    assertThat(result.asMap().keySet()).containsExactly(
        "missing_sectors", "missing_variables", "unreadable_input", "unknown_variable_names", "missing_unit",
        "unit_mismatch", "missing_time_coords", "frequency_mismatch", "time_range_mismatch", "lat_lon_inconsistency",
        "malformed_time_axis", "insufficient_coverage");
    assertThat(result.asMap().values()).allMatch(List::isEmpty);
  }

  @Test
  void reportsWrongUnitWithFoundAndExpected() {
    input.put(IRR_CU, dataset("irrigation", "consumptive_use_tot", "irr_cu", "m3/year", monthly(2000, 2002)));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.get(FindingCategory.unit_mismatch)).singleElement().satisfies(f -> {
      assertThat(f.getSector()).isEqualTo("irrigation");
      assertThat(f.getVariable()).isEqualTo("consumptive_use_tot");
      assertThat(f.getFound()).isEqualTo("m3/year");
      assertThat(f.getExpected()).isEqualTo("[m3/month]");
    });
    assertThat(result.count()).isEqualTo(1);
  }

  @Test
  void reportsMissingUnitSeparately() {
    input.put(DOM_WU, dataset("domestic", "abstraction_tot", "dom_wu", null, annual(2000, 2002)));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.messages(FindingCategory.missing_unit))
        .containsExactly("domestic/abstraction_tot: no unit declared, expected [m3/year]");
    assertThat(result.get(FindingCategory.unit_mismatch)).isEmpty();
  }

  @Test
  void ignoresUnitOfVariablesWithoutUnitObligation() {
    input.put(DatasetKey.of("irrigation", "fraction_aai_aei"),
        dataset("irrigation", "fraction_aai_aei", "irr_frac_aai_aei", "percent", monthly(2000, 2002)));

    assertThat(check(AlignMode.trim).isClean()).isTrue();
  }

  @Test
  void wholeMissingSectorIsReportedOnceAtSectorLevel() {
    input.remove(DOM_CU);
    input.remove(DOM_WU);

    CheckResult result = check(AlignMode.trim);

    assertThat(result.messages(FindingCategory.missing_sectors)).containsExactly("domestic");
    assertThat(result.get(FindingCategory.missing_variables)).isEmpty();
  }

  @Test
  void unreadablePairsAreNotReportedAsMissing() {
    input.remove(DOM_CU);
    input.remove(DOM_WU);

    CheckResult result = validator.validate(input, Set.of(DOM_CU), schema, PERIOD, AlignMode.trim);

    assertThat(result.get(FindingCategory.missing_sectors)).isEmpty();
    assertThat(result.messages(FindingCategory.missing_variables))
        .containsExactly("domestic/abstraction_tot: no input data");
  }

  @Test
  void everyMissingPairIsReportedExactlyOnce() {
    input.remove(DOM_WU);
    input.remove(DatasetKey.of("irrigation", "gw_fraction"));
    input.remove(DatasetKey.of("irrigation", "fraction_aai_aei"));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.messages(FindingCategory.missing_variables)).containsExactlyInAnyOrder(
        "irrigation/fraction_aai_aei: no input data",
        "irrigation/gw_fraction: no input data",
        "domestic/abstraction_tot: no input data");
    assertThat(result.get(FindingCategory.missing_sectors)).isEmpty();
  }

  @Test
  void badVariableDoesNotHideOtherFindings() {
    input.put(IRR_CU, dataset("irrigation", "consumptive_use_tot", "ptotuse", "m3/year", annual(2000, 2002)));
    input.remove(DOM_WU);
    input.put(DOM_CU, dataset("domestic", "consumptive_use_tot", "dom_cu", "m3/month", annual(2001, 2002)));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.get(FindingCategory.unknown_variable_names)).extracting(Finding::getFound)
        .containsExactly("ptotuse");
    assertThat(result.get(FindingCategory.unit_mismatch)).extracting(Finding::getVariable, Finding::getSector)
        .containsExactlyInAnyOrder(tuple("consumptive_use_tot", "irrigation"), tuple("consumptive_use_tot", "domestic"));
    assertThat(result.get(FindingCategory.frequency_mismatch)).extracting(Finding::getFound)
        .containsExactly("annual");
    assertThat(result.messages(FindingCategory.missing_variables)).containsExactly("domestic/abstraction_tot: no input data");
    assertThat(result.messages(FindingCategory.time_range_mismatch)).containsExactly(
        "irrigation/consumptive_use_tot: data covers 2000-01-01..2002-01-01, simulation period is 2000-2002",
        "domestic/consumptive_use_tot: data covers 2001-01-01..2002-01-01, simulation period is 2000-2002");
  }

  @Test
  void reportsIrregularTimeSpacing() {
    List<LocalDate> time = new ArrayList<>(annual(2000, 2002));
    time.remove(1);
    input.put(DOM_CU, dataset("domestic", "consumptive_use_tot", "dom_cu", "m3/year", time));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.get(FindingCategory.frequency_mismatch)).singleElement()
        .satisfies(f -> assertThat(f.getFound()).isEqualTo("irregular"));
  }

  @Test
  void rangeMismatchIsOnlyReportedWhenNotExtending() {
    input.put(DOM_CU, dataset("domestic", "consumptive_use_tot", "dom_cu", "m3/year", annual(2001, 2005)));
    input.put(IRR_CU, dataset("irrigation", "consumptive_use_tot", "irr_cu", "m3/month", monthly(1990, 2001)));

    assertThat(check(AlignMode.trim).get(FindingCategory.time_range_mismatch)).extracting(Finding::getSector)
        .containsExactly("irrigation", "domestic");
    assertThat(check(AlignMode.extend).get(FindingCategory.time_range_mismatch)).isEmpty();
  }

  @Test
  void monthlyDataEndingMidYearDoesNotCoverEndYear() {
    List<LocalDate> time = monthly(2000, 2002).subList(0, 30);
    input.put(IRR_CU, dataset("irrigation", "consumptive_use_tot", "irr_cu", "m3/month", time));

    assertThat(check(AlignMode.trim).get(FindingCategory.time_range_mismatch)).hasSize(1);
  }

  @Test
  void reportsTimeVariantVariableWithoutTimeAxis() {
    input.put(DOM_WU, GridFixtures.staticDataset("domestic", "abstraction_tot", "dom_wu"));

    CheckResult result = check(AlignMode.trim);

    assertThat(result.messages(FindingCategory.missing_time_coords))
        .containsExactly("domestic/abstraction_tot: no time coordinate");
  }

  @Test
  void reportsGridDifferingFromFirstDataset() {
    GridDataset shifted = new GridDataset(DOM_WU, "dom_wu", "m3/year", annual(2000, 2002),
        new double[] {0.75, 0.25}, GridFixtures.LON.clone(),
        new double[3][2][2]);
    input.put(DOM_WU, shifted);

    CheckResult result = check(AlignMode.trim);

    assertThat(result.messages(FindingCategory.lat_lon_inconsistency))
        .containsExactly("domestic/abstraction_tot: lat/lon coordinates differ from irrigation/consumptive_use_tot");
  }

  @Test
  void doesNotModifyInputAndCanBeRepeated() {
    input.put(IRR_CU, dataset("irrigation", "consumptive_use_tot", "irr_cu", "m3/year", monthly(2000, 2002)));
    Map<DatasetKey, GridDataset> before = new LinkedHashMap<>(input);

    CheckResult first = check(AlignMode.trim);
    CheckResult second = check(AlignMode.trim);

    assertThat(input).isEqualTo(before);
    assertThat(second.asMap()).isEqualTo(first.asMap());
  }
}
