package com.scholary.subsearch.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.file.Path;

/**
 * One indexed subtitle line, as returned by a search.
 *
 * @param path filesystem path of the media file, usable as-is for reading it
 * @param start event start in milliseconds
 * @param end event end in milliseconds
 * @param content plain subtitle text
 */
public record SubtitleEvent(String path, long start, long end, String content) {

  public SubtitleEvent {
    if (end < start) {
      throw new IllegalArgumentException("Event end must be >= start");
    }
  }

  /** Midpoint of the event in milliseconds. */
  public double midpoint() {
    return (start + end) / 2.0;
  }

  @JsonIgnore
  public Path file() {
    return Path.of(path);
  }
}
