package io.gwswuse.input.grid;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes one grid file. Implementations handle one on-disk format each.
 */
public interface GridFileReader {

  /** Whether {@code file} is in this reader's format, judged by its name. */
  boolean accepts(Path file);

  /**
   * Reads a single file as a dataset for {@code key}. The time axis is returned
   * in file order; sorting and merging across files is up to the caller.
   */
  GridDataset read(Path file, DatasetKey key) throws IOException;
}
