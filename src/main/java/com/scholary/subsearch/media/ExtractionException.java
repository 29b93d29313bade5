package com.scholary.subsearch.media;

/** Thrown when a file has no usable subtitle track or subtitle extraction fails. */
public class ExtractionException extends MediaProcessingException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
