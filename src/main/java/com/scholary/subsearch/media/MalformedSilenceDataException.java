package com.scholary.subsearch.media;

/**
 * Thrown when silence detection output is inconsistent, e.g. a different number of silence starts
 * than silence ends.
 */
public class MalformedSilenceDataException extends MediaProcessingException {

  public MalformedSilenceDataException(String message) {
    super(message);
  }
}
