package io.gwswuse.core;

import io.gwswuse.core.model.ConventionFile;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ConventionValidator {

  private ConventionValidator() {}

  public static void validate(ConventionFile c) {
    if (c.referenceNames == null) fail("reference_names required");
    if (c.timeVariantVars == null) fail("time_variant_vars required");
    if (c.sectorRequirements == null) fail("sector_requirements required");
    if (c.sectorRequirements.isEmpty()) fail("sector_requirements must name at least one sector");

    checkEntries("reference_names", c.referenceNames);
    checkEntries("time_variant_vars", c.timeVariantVars);

    for (Map.Entry<String, ConventionFile.SectorEntry> entry : c.sectorRequirements.entrySet()) {
      String sector = entry.getKey();
      ConventionFile.SectorEntry s = entry.getValue();
      if (!Sector.isValid(sector)) fail("unknown sector " + sector);
      if (s == null) fail(sector + ": sector entry is empty");

      if (isBlank(s.timeFreq)) fail(sector + ": time_freq required");
      if (!TimeFrequency.isValid(s.timeFreq)) fail(sector + ": unsupported time_freq " + s.timeFreq);
      if (s.expectedUnits == null) fail(sector + ": expected_units required");
      if (s.expectedVars == null) fail(sector + ": expected_vars required");
      if (s.unitVars == null) fail(sector + ": unit_vars required");

      checkEntries(sector + ".expected_units", s.expectedUnits);
      checkEntries(sector + ".unit_vars", s.unitVars);

      Set<String> vars = new HashSet<>();
      for (String v : s.expectedVars) {
        if (isBlank(v)) fail(sector + ": expected_vars entries cannot be empty");
        if (!vars.add(v)) fail(sector + ": duplicate expected variable " + v);
      }
      for (String v : s.unitVars) {
        if (!vars.contains(v)) fail(sector + "." + v + ": unit variable is not an expected variable");
      }
    }
  }

  private static void checkEntries(String key, List<String> values) {
    for (String v : values) {
      if (isBlank(v)) fail(key + " entries cannot be empty");
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new SchemaMalformedException(msg); }
}
