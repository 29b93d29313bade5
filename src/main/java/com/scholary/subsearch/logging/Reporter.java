package com.scholary.subsearch.logging;

import org.slf4j.Logger;

/**
 * Caller-supplied channel for progress and per-item failures during batch operations.
 *
 * <p>The core reports through this instead of aborting, so one bad file or one failed render
 * never stops the rest of the batch. The caller decides where reports go.
 */
public interface Reporter {

  /** Report progress, e.g. the file currently being indexed. */
  void progress(String message);

  /** Report a failure that was skipped over. */
  void failure(String message, Throwable cause);

  /** A reporter that drops everything. */
  static Reporter silent() {
    return new Reporter() {
      @Override
      public void progress(String message) {}

      @Override
      public void failure(String message, Throwable cause) {}
    };
  }

  /** A reporter writing progress at info and failures at warn to the given logger. */
  static Reporter logging(Logger logger) {
    return new Reporter() {
      @Override
      public void progress(String message) {
        logger.info(message);
      }

      @Override
      public void failure(String message, Throwable cause) {
        logger.warn("{}: {}", message, cause.getMessage(), cause);
      }
    };
  }
}
