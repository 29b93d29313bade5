package com.scholary.subsearch.render;

import java.util.List;

/**
 * One way of rendering a still or clip with ffmpeg.
 *
 * <p>Strategies differ in how subtitles end up in the picture:
 *
 * <ul>
 *   <li>Burned in with the {@code subtitles} filter (text subtitle tracks)
 *   <li>Overlaid from the subtitle stream (bitmap subtitle tracks)
 *   <li>Not at all (last resort)
 * </ul>
 */
public interface RenderStrategy {

  /**
   * Build the ffmpeg arguments for a request.
   *
   * @param request what to render
   * @return arguments following ffmpeg's common flags
   */
  List<String> buildArguments(RenderRequest request);

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
