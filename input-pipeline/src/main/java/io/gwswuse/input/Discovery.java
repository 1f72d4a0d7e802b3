package io.gwswuse.input;

import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Datasets found under an input directory, plus the pairs whose files exist
 * but could not be read or combined.
 */
public class Discovery {

  private final Map<DatasetKey, GridDataset> datasets;
  private final Map<DatasetKey, String> failures;

  public Discovery(Map<DatasetKey, GridDataset> datasets, Map<DatasetKey, String> failures) {
    this.datasets = Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  /** Loaded datasets keyed by (sector, variable), in convention order. */
  public Map<DatasetKey, GridDataset> getDatasets() {
    return datasets;
  }

  /** Reason each unreadable pair was left out, in convention order. */
  public Map<DatasetKey, String> getFailures() {
    return failures;
  }

  public GridDataset get(DatasetKey key) {
    return datasets.get(key);
  }
}
