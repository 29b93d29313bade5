package com.scholary.subsearch.service;

import com.scholary.subsearch.clip.ClipWindow;
import com.scholary.subsearch.index.SubtitleEvent;
import java.util.List;

/**
 * Outcome for one search match.
 *
 * @param index position of the match in the result list
 * @param event the matched subtitle event
 * @param window clip window in seconds (null for stills and list-only searches)
 * @param rendered whether an output file was produced
 * @param strategy rendering strategy that succeeded (null if none)
 * @param output rendered file path (null if none)
 * @param errors failures encountered for this match
 */
public record ClipResult(
    int index,
    SubtitleEvent event,
    ClipWindow window,
    boolean rendered,
    String strategy,
    String output,
    List<String> errors) {

  public ClipResult {
    errors = List.copyOf(errors);
  }

  static ClipResult listed(int index, SubtitleEvent event) {
    return new ClipResult(index, event, null, false, null, null, List.of());
  }
}
