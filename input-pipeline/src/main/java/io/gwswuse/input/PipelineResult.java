package io.gwswuse.input;

import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.check.CheckResult;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one ingestion run.
 */
public class PipelineResult {

  private final Map<DatasetKey, GridDataset> preprocessed;
  private final CheckResult checkResult;
  private final Map<DatasetKey, GridDataset> discovered;
  private final ConventionSchema schema;

  public PipelineResult(Map<DatasetKey, GridDataset> preprocessed,
                        CheckResult checkResult,
                        Map<DatasetKey, GridDataset> discovered,
                        ConventionSchema schema) {
    this.preprocessed = Collections.unmodifiableMap(new LinkedHashMap<>(preprocessed));
    this.checkResult = checkResult;
    this.discovered = Collections.unmodifiableMap(new LinkedHashMap<>(discovered));
    this.schema = schema;
  }

  /** Aligned datasets; datasets that failed alignment are absent and reported in the check result. */
  public Map<DatasetKey, GridDataset> getPreprocessed() {
    return preprocessed;
  }

  public CheckResult getCheckResult() {
    return checkResult;
  }

  /** Datasets as loaded from disk, before alignment. */
  public Map<DatasetKey, GridDataset> getDiscovered() {
    return discovered;
  }

  public ConventionSchema getSchema() {
    return schema;
  }

  public GridDataset getPreprocessed(String sector, String variable) {
    return preprocessed.get(DatasetKey.of(sector, variable));
  }
}
