package com.scholary.subsearch.render;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of rendering with a list of strategies.
 *
 * @param success whether some strategy produced the output
 * @param strategy name of the strategy that succeeded (null on failure)
 * @param output the rendered file (null on failure)
 * @param failures one message per failed attempt, in the order tried
 */
public record RenderOutcome(boolean success, String strategy, Path output, List<String> failures) {

  public static RenderOutcome rendered(String strategy, Path output, List<String> failures) {
    return new RenderOutcome(true, strategy, output, List.copyOf(failures));
  }

  public static RenderOutcome failed(List<String> failures) {
    return new RenderOutcome(false, null, null, List.copyOf(failures));
  }
}
