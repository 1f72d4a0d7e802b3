package io.gwswuse.input.align;

import io.gwswuse.input.grid.DatasetKey;

/**
 * The time axis is missing, unsorted or holds duplicate timestamps.
 */
public class MalformedTimeAxisException extends AlignmentException {

  public MalformedTimeAxisException(DatasetKey key, String message) {
    super(key, message);
  }
}
