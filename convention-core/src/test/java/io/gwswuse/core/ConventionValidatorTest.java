package io.gwswuse.core;

import io.gwswuse.core.model.ConventionFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class ConventionValidatorTest {

  private ConventionFile c;
  private ConventionFile.SectorEntry irrigation;

  @BeforeEach
  void setUp() {
    c = new ConventionFile();
    c.referenceNames = List.of("ptotuse");
    c.timeVariantVars = List.of("consumptive_use_tot");

    irrigation = new ConventionFile.SectorEntry();
    irrigation.timeFreq = "monthly";
    irrigation.expectedUnits = List.of("m3/month");
    irrigation.expectedVars = new ArrayList<>(List.of("consumptive_use_tot", "gw_mask"));
    irrigation.unitVars = List.of("consumptive_use_tot");

    c.sectorRequirements = new LinkedHashMap<>();
    c.sectorRequirements.put("irrigation", irrigation);
  }

  @Test
  void validatesHappyPath() {
    assertThatCode(() -> ConventionValidator.validate(c)).doesNotThrowAnyException();
  }

  @Test
  void acceptsYearlyAsAnnual() {
    irrigation.timeFreq = "yearly";

    assertThatCode(() -> ConventionValidator.validate(c)).doesNotThrowAnyException();
  }

  @Test
  void rejectsMissingReferenceNames() {
    c.referenceNames = null;

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("reference_names required");
  }

  @Test
  void rejectsMissingSectorRequirements() {
    c.sectorRequirements = null;

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("sector_requirements required");
  }

  @Test
  void rejectsMissingTimeFreq() {
    irrigation.timeFreq = null;

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("irrigation: time_freq required");
  }

  @Test
  void rejectsUnsupportedTimeFreq() {
    irrigation.timeFreq = "daily";

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("unsupported time_freq daily");
  }

  @Test
  void rejectsMissingExpectedUnits() {
    irrigation.expectedUnits = null;

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("irrigation: expected_units required");
  }

  @Test
  void rejectsMissingExpectedVars() {
    irrigation.expectedVars = null;

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("irrigation: expected_vars required");
  }

  @Test
  void rejectsDuplicateExpectedVariable() {
    irrigation.expectedVars.add("gw_mask");

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("duplicate expected variable gw_mask");
  }

  @Test
  void rejectsUnitVarOutsideExpectedVars() {
    irrigation.unitVars = List.of("abstraction_tot");

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("irrigation.abstraction_tot: unit variable is not an expected variable");
  }

  @Test
  void rejectsNullSectorEntry() {
    c.sectorRequirements.put("livestock", null);

    assertThatThrownBy(() -> ConventionValidator.validate(c))
      .isInstanceOf(SchemaMalformedException.class)
      .hasMessageContaining("livestock: sector entry is empty");
  }
}
