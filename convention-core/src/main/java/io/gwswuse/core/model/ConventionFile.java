package io.gwswuse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw binding of a convention JSON document, before it is checked and frozen
 * into a {@link ConventionSchema}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConventionFile {
  @JsonProperty("reference_names")
  public List<String> referenceNames;

  @JsonProperty("time_variant_vars")
  public List<String> timeVariantVars;

  @JsonProperty("sector_requirements")
  public Map<String, SectorEntry> sectorRequirements;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SectorEntry {
    @JsonProperty("time_freq")
    public String timeFreq;

    @JsonProperty("expected_units")
    public List<String> expectedUnits;

    @JsonProperty("expected_vars")
    public List<String> expectedVars;

    @JsonProperty("unit_vars")
    public List<String> unitVars;
  }
}
