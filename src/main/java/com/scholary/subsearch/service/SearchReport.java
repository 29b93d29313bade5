package com.scholary.subsearch.service;

import java.util.List;

/**
 * Result of a search session.
 *
 * @param correlationId id tying together the session's log lines
 * @param query the query text
 * @param mode what was rendered
 * @param results one entry per match, in relevance order
 */
public record SearchReport(
    String correlationId, String query, RenderMode mode, List<ClipResult> results) {

  public long renderedCount() {
    return results.stream().filter(ClipResult::rendered).count();
  }
}
