package com.scholary.subsearch.render;

import com.scholary.subsearch.media.MediaProcessingException;

/** Reported when every render strategy failed for a match. */
public class RenderFailedException extends MediaProcessingException {

  public RenderFailedException(String message) {
    super(message);
  }
}
