package io.gwswuse.core;

/**
 * The convention document is unreadable or lacks a required key. No partial
 * convention is ever accepted.
 */
public class SchemaMalformedException extends IllegalArgumentException {

  public SchemaMalformedException(String message) {
    super(message);
  }

  public SchemaMalformedException(String message, Throwable cause) {
    super(message, cause);
  }
}
