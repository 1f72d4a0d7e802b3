package io.gwswuse.input.grid;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A grid file could not be decoded, or the files of one (sector, variable)
 * pair cannot be combined into a single dataset.
 */
public class GridFileException extends IOException {

  private final Path file;

  public GridFileException(Path file, String message) {
    super(file + ": " + message);
    this.file = file;
  }

  public GridFileException(Path file, String message, Throwable cause) {
    super(file + ": " + message, cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
