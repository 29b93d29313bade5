package com.scholary.subsearch.api;

import com.scholary.subsearch.index.SubtitleEvent;

/** One subtitle event matching a query. Times are in milliseconds. */
public record SearchHit(String path, long start, long end, String content) {

  static SearchHit from(SubtitleEvent event) {
    return new SearchHit(event.path(), event.start(), event.end(), event.content());
  }
}
