package io.gwswuse.core.model;

import io.gwswuse.core.TimeFrequency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable convention: the variable vocabulary, the time-variant variables and
 * the requirements of every sector. Built once from a validated {@link ConventionFile}.
 */
public final class ConventionSchema {

  private final Set<String> referenceNames;
  private final Set<String> timeVariantVars;
  private final Map<String, SectorSpec> sectorRequirements;

  public ConventionSchema(Set<String> referenceNames,
                          Set<String> timeVariantVars,
                          Map<String, SectorSpec> sectorRequirements) {
    this.referenceNames = Collections.unmodifiableSet(new LinkedHashSet<>(referenceNames));
    this.timeVariantVars = Collections.unmodifiableSet(new LinkedHashSet<>(timeVariantVars));
    this.sectorRequirements = Collections.unmodifiableMap(new LinkedHashMap<>(sectorRequirements));
  }

  /** Freezes an already validated binding. */
  public static ConventionSchema from(ConventionFile file) {
    Map<String, SectorSpec> sectors = new LinkedHashMap<>();
    file.sectorRequirements.forEach((name, entry) -> sectors.put(name, new SectorSpec(
        TimeFrequency.fromName(entry.timeFreq),
        entry.expectedUnits,
        entry.expectedVars,
        entry.unitVars)));
    return new ConventionSchema(
        new LinkedHashSet<>(file.referenceNames),
        new LinkedHashSet<>(file.timeVariantVars),
        sectors);
  }

  public Set<String> getReferenceNames() {
    return referenceNames;
  }

  public Set<String> getTimeVariantVars() {
    return timeVariantVars;
  }

  /** Sector name to requirements, in document order. */
  public Map<String, SectorSpec> getSectorRequirements() {
    return sectorRequirements;
  }

  public SectorSpec getSector(String sector) {
    return sectorRequirements.get(sector);
  }

  public boolean hasSector(String sector) {
    return sectorRequirements.containsKey(sector);
  }

  public boolean isReferenceName(String name) {
    return referenceNames.contains(name);
  }

  public boolean isTimeVariant(String variable) {
    return timeVariantVars.contains(variable);
  }

  /** Requirements for one sector. */
  public static final class SectorSpec {
    private final TimeFrequency timeFrequency;
    private final Set<String> expectedUnits;
    private final List<String> expectedVars;
    private final Set<String> unitVars;

    public SectorSpec(TimeFrequency timeFrequency,
                      List<String> expectedUnits,
                      List<String> expectedVars,
                      List<String> unitVars) {
      this.timeFrequency = timeFrequency;
      this.expectedUnits = Collections.unmodifiableSet(new LinkedHashSet<>(expectedUnits));
      this.expectedVars = List.copyOf(expectedVars);
      this.unitVars = Collections.unmodifiableSet(new LinkedHashSet<>(unitVars));
      if (!this.expectedVars.containsAll(this.unitVars)) {
        throw new IllegalArgumentException("unit_vars must be a subset of expected_vars: " + unitVars);
      }
    }

    public TimeFrequency getTimeFrequency() {
      return timeFrequency;
    }

    public Set<String> getExpectedUnits() {
      return expectedUnits;
    }

    public List<String> getExpectedVars() {
      return expectedVars;
    }

    public Set<String> getUnitVars() {
      return unitVars;
    }

    public boolean expects(String variable) {
      return expectedVars.contains(variable);
    }

    public boolean requiresUnit(String variable) {
      return unitVars.contains(variable);
    }

    public boolean acceptsUnit(String unit) {
      return expectedUnits.contains(unit);
    }
  }
}
