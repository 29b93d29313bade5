package com.scholary.subsearch.cache;

/**
 * Exception thrown when the analysis cache cannot be created or written.
 *
 * <p>Unreadable entries are treated as misses instead, so a corrupt blob is recomputed and
 * overwritten on the next {@code getOrCompute}.
 */
public class CacheException extends RuntimeException {

  public CacheException(String message) {
    super(message);
  }

  public CacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
