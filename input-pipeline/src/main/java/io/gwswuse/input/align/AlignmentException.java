package io.gwswuse.input.align;

import io.gwswuse.input.grid.DatasetKey;

/**
 * A dataset cannot be aligned to the simulation period. Fatal for that dataset only.
 */
public abstract class AlignmentException extends RuntimeException {

  private final DatasetKey key;

  protected AlignmentException(DatasetKey key, String message) {
    super(key + ": " + message);
    this.key = key;
  }

  public DatasetKey getKey() {
    return key;
  }
}
