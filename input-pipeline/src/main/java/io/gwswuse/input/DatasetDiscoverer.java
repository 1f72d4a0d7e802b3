package io.gwswuse.input;

import io.gwswuse.core.model.ConventionSchema;
import io.gwswuse.input.grid.DatasetKey;
import io.gwswuse.input.grid.GridDataset;
import io.gwswuse.input.grid.GridFileException;
import io.gwswuse.input.grid.GridFileReader;
import io.gwswuse.input.grid.JsonGridFileReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the grid files of every (sector, variable) pair the convention asks
 * for under {@code root/<sector>/<variable>/} and loads each pair as one
 * dataset sorted by time.
 *
 * <p>Directories the convention does not name are skipped, and pairs missing
 * on disk are simply left out of the result; reporting them is the job of the
 * input checks. A pair whose files cannot be listed, decoded or combined is
 * left out too and recorded as a failure, so one bad file never stops the
 * other pairs from loading.</p>
 */
public class DatasetDiscoverer {

  private static final Logger log = LogManager.getLogger(DatasetDiscoverer.class);

  private final GridFileReader reader;

  public DatasetDiscoverer() {
    this(new JsonGridFileReader());
  }

  public DatasetDiscoverer(GridFileReader reader) {
    this.reader = Objects.requireNonNull(reader, "reader is required");
  }

  public Discovery discover(Path rootDir, ConventionSchema schema) {
    Map<DatasetKey, GridDataset> datasets = new LinkedHashMap<>();
    Map<DatasetKey, String> failures = new LinkedHashMap<>();
    if (!Files.isDirectory(rootDir)) {
      log.warn("Input data directory {} does not exist", rootDir);
      return new Discovery(datasets, failures);
    }
    log.info("Loading input data from {}", rootDir);
    logIgnoredSectors(rootDir, schema);

    for (Map.Entry<String, ConventionSchema.SectorSpec> sector : schema.getSectorRequirements().entrySet()) {
      Path sectorDir = rootDir.resolve(sector.getKey());
      if (!Files.isDirectory(sectorDir)) {
        log.debug("No directory for sector {}", sector.getKey());
        continue;
      }
      for (String variable : sector.getValue().getExpectedVars()) {
        Path variableDir = sectorDir.resolve(variable);
        if (!Files.isDirectory(variableDir)) continue;

        DatasetKey key = DatasetKey.of(sector.getKey(), variable);
        try {
          List<Path> files = listGridFiles(variableDir);
          if (files.isEmpty()) {
            log.debug("No grid files in {}", variableDir);
            continue;
          }
          datasets.put(key, load(key, files));
        } catch (IOException e) {
          log.error("{}: input data left out: {}", key, e.getMessage());
          failures.put(key, e.getMessage());
        }
      }
    }
    log.info("Discovered {} input datasets, {} unreadable", datasets.size(), failures.size());
    return new Discovery(datasets, failures);
  }

  private void logIgnoredSectors(Path rootDir, ConventionSchema schema) {
    try (Stream<Path> entries = Files.list(rootDir)) {
      entries.filter(Files::isDirectory)
          .map(p -> p.getFileName().toString())
          .filter(name -> !schema.hasSector(name))
          .sorted()
          .forEach(name -> log.debug("Ignoring directory {}: not a sector of the convention", name));
    } catch (IOException e) {
      log.warn("Cannot list {}: {}", rootDir, e.getMessage());
    }
  }

  private List<Path> listGridFiles(Path variableDir) throws IOException {
    try (Stream<Path> entries = Files.list(variableDir)) {
      return entries.filter(Files::isRegularFile)
          .filter(reader::accepts)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    }
  }

  /** Reads every file of one pair and concatenates them along time. */
  GridDataset load(DatasetKey key, List<Path> files) throws IOException {
    GridDataset first = null;
    List<Slice> slices = new ArrayList<>();

    for (Path file : files) {
      log.debug("Reading {} for {}", file, key);
      GridDataset part = reader.read(file, key).inCanonicalSpatialOrder();
      if (first == null) {
        first = part;
      } else {
        checkCompatible(file, first, part);
      }
      for (int t = 0; t < part.getTimeSteps(); t++) {
        slices.add(new Slice(part.hasTimeAxis() ? part.getTime().get(t) : null, part, t));
      }
    }

    if (!first.hasTimeAxis()) {
      if (files.size() > 1) {
        log.warn("{}: {} static grid files found, using {}", key, files.size(), files.get(0).getFileName());
      }
      return first;
    }
    return concatenate(key, first, slices);
  }

  private static void checkCompatible(Path file, GridDataset first, GridDataset part) throws GridFileException {
    if (!Objects.equals(first.getVariableName(), part.getVariableName())) {
      throw new GridFileException(file, "data variable " + part.getVariableName()
          + " differs from " + first.getVariableName());
    }
    if (first.hasTimeAxis() != part.hasTimeAxis()) {
      throw new GridFileException(file, "mixes static and time-variant grids");
    }
    if (!first.hasSameGrid(part)) {
      throw new GridFileException(file, "lat/lon grid differs from the other files");
    }
    if (!Objects.equals(first.getUnits(), part.getUnits())) {
      log.warn("{}: unit {} differs from {}, keeping {}", file, part.getUnits(), first.getUnits(), first.getUnits());
    }
  }

  private static GridDataset concatenate(DatasetKey key, GridDataset first, List<Slice> slices) {
    // stable: on equal timestamps the earlier file wins
    slices.sort(Comparator.comparing(s -> s.time));

    List<LocalDate> time = new ArrayList<>(slices.size());
    List<double[][]> values = new ArrayList<>(slices.size());
    int dropped = 0;
    for (Slice s : slices) {
      if (!time.isEmpty() && time.get(time.size() - 1).equals(s.time)) {
        dropped++;
        continue;
      }
      time.add(s.time);
      values.add(s.source.getSlice(s.index));
    }
    if (dropped > 0) {
      log.warn("{}: dropped {} duplicate time steps", key, dropped);
    }
    return first.withTimeAxis(time, values.toArray(new double[0][][]));
  }

  private static final class Slice {
    final LocalDate time;
    final GridDataset source;
    final int index;

    Slice(LocalDate time, GridDataset source, int index) {
      this.time = time;
      this.source = source;
      this.index = index;
    }
  }
}
