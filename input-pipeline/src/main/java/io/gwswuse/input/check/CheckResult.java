package io.gwswuse.input.check;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Findings of one pipeline run, grouped by category. Every category is
 * present; an empty list means its checks ran and passed.
 */
public final class CheckResult {

  private final Map<FindingCategory, List<Finding>> findings;

  private CheckResult(Map<FindingCategory, List<Finding>> findings) {
    this.findings = findings;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Finding> get(FindingCategory category) {
    return findings.get(category);
  }

  /** Finding messages of one category, in recording order. */
  public List<String> messages(FindingCategory category) {
    return findings.get(category).stream().map(Finding::getMessage).collect(Collectors.toList());
  }

  /** Report form: category key to finding messages, every category included. */
  public Map<String, List<String>> asMap() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (FindingCategory c : FindingCategory.values()) {
      out.put(c.key(), messages(c));
    }
    return Collections.unmodifiableMap(out);
  }

  public int count() {
    return findings.values().stream().mapToInt(List::size).sum();
  }

  public boolean isClean() {
    return count() == 0;
  }

  /**
   * Accumulates findings. Callers collect the findings of each (sector,
   * variable) pair separately and hand them over with {@link #addAll}.
   */
  public static final class Builder {
    private final Map<FindingCategory, List<Finding>> findings = new EnumMap<>(FindingCategory.class);

    private Builder() {
      for (FindingCategory c : FindingCategory.values()) {
        findings.put(c, new ArrayList<>());
      }
    }

    public Builder add(Finding finding) {
      findings.get(finding.getCategory()).add(finding);
      return this;
    }

    public Builder addAll(Collection<Finding> batch) {
      batch.forEach(this::add);
      return this;
    }

    public Builder merge(CheckResult other) {
      other.findings.values().forEach(this::addAll);
      return this;
    }

    public CheckResult build() {
      Map<FindingCategory, List<Finding>> frozen = new EnumMap<>(FindingCategory.class);
      findings.forEach((c, list) -> frozen.put(c, List.copyOf(list)));
      return new CheckResult(Collections.unmodifiableMap(frozen));
    }
  }
}
