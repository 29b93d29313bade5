package com.scholary.subsearch.service;

/** What a search session renders for each match. */
public enum RenderMode {
  /** Nothing; only list matches. */
  NONE,
  /** A still frame at the event midpoint. */
  STILL,
  /** A clip around the event with default boundaries. */
  CLIP,
  /** A clip whose boundaries snap to nearby silences. */
  SILENCE_AWARE_CLIP
}
