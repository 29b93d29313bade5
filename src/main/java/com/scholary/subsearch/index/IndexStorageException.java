package com.scholary.subsearch.index;

/**
 * Thrown when index storage cannot be created or written.
 *
 * <p>This includes failing to take the index write lock because another process is writing.
 */
public class IndexStorageException extends IndexException {

  public IndexStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
