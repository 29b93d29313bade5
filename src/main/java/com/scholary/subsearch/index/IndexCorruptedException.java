package com.scholary.subsearch.index;

/** Thrown when an index's configuration or index files cannot be read. */
public class IndexCorruptedException extends IndexException {

  public IndexCorruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
