package io.gwswuse.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The convention path does not resolve to a readable file.
 */
public class SchemaNotFoundException extends IOException {

  private final Path path;

  public SchemaNotFoundException(Path path) {
    super("Convention file not found: " + path);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
