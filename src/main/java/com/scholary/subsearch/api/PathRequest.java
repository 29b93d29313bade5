package com.scholary.subsearch.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for adding a media file or directory to the index, or removing it.
 *
 * @param path media file or directory
 * @param relative path storage policy for this call ({@code null}: the index's own policy)
 * @param withAudioAnalysis precompute silence analysis for added files (ignored on removal)
 * @param wiggle tolerance window the analysis is tuned for, in seconds ({@code null}: configured
 *     default)
 */
public record PathRequest(
    @NotBlank String path,
    Boolean relative,
    Boolean withAudioAnalysis,
    @PositiveOrZero Double wiggle) {

  public PathRequest {
    if (withAudioAnalysis == null) {
      withAudioAnalysis = false;
    }
  }
}
