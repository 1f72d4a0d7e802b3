package io.gwswuse.input;

import io.gwswuse.core.ConventionLoader;
import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.align.AlignMode;
import io.gwswuse.input.align.AlignmentException;
import io.gwswuse.input.align.InsufficientCoverageException;
import io.gwswuse.input.align.TemporalAligner;
import io.gwswuse.input.check.CheckResult;
import io.gwswuse.input.check.Finding;
import io.gwswuse.input.check.FindingCategory;
import io.gwswuse.input.check.InputDataValidator;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single entry point of input data ingestion: load the convention, discover
 * the input datasets, check them and align them to the simulation period.
 *
 * <p>Only convention problems abort a run. Failed checks are returned as
 * findings. A pair whose grid files cannot be read, or a dataset that cannot
 * be aligned, is reported and left out of the preprocessed data while the
 * others go on.</p>
 */
public class InputDataPipeline {

  private static final Logger log = LogManager.getLogger(InputDataPipeline.class);

  private final DatasetDiscoverer discoverer;
  private final InputDataValidator validator;
  private final TemporalAligner aligner;

  public InputDataPipeline() {
    this(new DatasetDiscoverer(), new InputDataValidator(), new TemporalAligner());
  }

  public InputDataPipeline(DatasetDiscoverer discoverer, InputDataValidator validator, TemporalAligner aligner) {
    this.discoverer = discoverer;
    this.validator = validator;
    this.aligner = aligner;
  }

  /**
   * @throws io.gwswuse.core.SchemaNotFoundException if the convention file does not exist
   * @throws io.gwswuse.core.SchemaMalformedException if the convention is incomplete
   * @throws IOException if the convention file cannot be read
   */
  public PipelineResult run(Path rootDir, Path schemaPath, SimulationPeriod period, AlignMode mode)
      throws IOException {
    ConventionSchema schema = ConventionLoader.load(schemaPath);
    return run(rootDir, schema, period, mode);
  }

  public PipelineResult run(Path rootDir, ConventionSchema schema, SimulationPeriod period, AlignMode mode) {
    Discovery discovery = discoverer.discover(rootDir, schema);
    Map<DatasetKey, GridDataset> discovered = discovery.getDatasets();

    log.info("Check and preprocess input data for {} ({})", period, mode);
    CheckResult.Builder report = CheckResult.builder();
    discovery.getFailures().forEach((key, reason) ->
        report.add(Finding.of(FindingCategory.unreadable_input, key, reason)));
    report.merge(validator.validate(discovered, discovery.getFailures().keySet(), schema, period, mode));

    Map<DatasetKey, GridDataset> preprocessed = new LinkedHashMap<>();
    for (Map.Entry<DatasetKey, GridDataset> e : discovered.entrySet()) {
      try {
        preprocessed.put(e.getKey(), aligner.alignDataset(e.getValue(), schema, period, mode));
      } catch (AlignmentException ex) {
        log.error("Excluding {} from preprocessed data: {}", e.getKey(), ex.getMessage());
        FindingCategory category = ex instanceof InsufficientCoverageException
            ? FindingCategory.insufficient_coverage
            : FindingCategory.malformed_time_axis;
        report.add(new Finding(category, e.getKey().getSector(), e.getKey().getVariable(),
            null, null, ex.getMessage()));
      }
    }

    CheckResult checkResult = report.build();
    log.info("Preprocessed {} of {} datasets, {} findings",
        preprocessed.size(), discovered.size(), checkResult.count());
    return new PipelineResult(preprocessed, checkResult, discovered, schema);
  }
}
