package io.gwswuse.input.align;

import io.gwswuse.input.grid.DatasetKey;

/**
 * Trimming would leave no period inside the simulation period.
 */
public class InsufficientCoverageException extends AlignmentException {

  public InsufficientCoverageException(DatasetKey key, String message) {
    super(key, message);
  }
}
