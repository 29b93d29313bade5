package com.scholary.subsearch.service;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for searching the index and rendering matches.
 *
 * @param query query text in Lucene syntax
 * @param mode what to render per match
 * @param wiggle clip tolerance window in seconds ({@code null}: configured default)
 * @param limit maximum number of matches ({@code null}: configured default)
 */
public record SearchRequest(
    @NotBlank String query,
    RenderMode mode,
    @PositiveOrZero Double wiggle,
    @Min(1) @Max(1000) Integer limit) {

  public SearchRequest {
    if (mode == null) {
      mode = RenderMode.STILL;
    }
  }
}
