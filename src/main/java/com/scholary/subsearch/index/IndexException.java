package com.scholary.subsearch.index;

/**
 * Base exception for subtitle index failures.
 *
 * <p>Failures opening or creating an index are fatal for the whole operation. Per-file failures
 * while adding are reported and skipped instead of thrown.
 */
public class IndexException extends RuntimeException {

  public IndexException(String message) {
    super(message);
  }

  public IndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
