package com.scholary.subsearch.media;

/**
 * Exception thrown when the media tool fails or produces output we cannot use.
 *
 * <p>Callers processing a batch of files or search results catch this per item, report it, and
 * move on.
 */
public class MediaProcessingException extends RuntimeException {

  public MediaProcessingException(String message) {
    super(message);
  }

  public MediaProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
