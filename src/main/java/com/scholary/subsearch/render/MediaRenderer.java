package com.scholary.subsearch.render;

import com.scholary.subsearch.media.FfmpegRunner;
import com.scholary.subsearch.media.MediaProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders stills and clips by trying each {@link RenderStrategy} in order.
 *
 * <p>The first strategy whose ffmpeg run succeeds wins. A failed attempt's partial output is
 * deleted before the next strategy runs. If every strategy fails, the outcome lists why.
 */
@Component
public class MediaRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaRenderer.class);

  private final FfmpegRunner runner;
  private final List<RenderStrategy> strategies;

  public MediaRenderer(FfmpegRunner runner, List<RenderStrategy> strategies) {
    if (strategies.isEmpty()) {
      throw new IllegalArgumentException("At least one render strategy is required");
    }
    this.runner = runner;
    this.strategies = List.copyOf(strategies);
  }

  /**
   * Render a request.
   *
   * @param request what to render
   * @return the tagged outcome; never throws for a failed ffmpeg run
   */
  public RenderOutcome render(RenderRequest request) {
    List<String> failures = new ArrayList<>();

    for (RenderStrategy strategy : strategies) {
      LOGGER.debug(
          "Rendering {} of {} with {}", request.kind(), request.source(), strategy.getStrategyName());
      try {
        FfmpegRunner.Result result = runner.run("error", strategy.buildArguments(request));
        if (result.succeeded() && Files.exists(request.output())) {
          return RenderOutcome.rendered(strategy.getStrategyName(), request.output(), failures);
        }
        failures.add(
            String.format(
                "%s: exit code %d: %s",
                strategy.getStrategyName(), result.exitCode(), result.stderr().strip()));
      } catch (MediaProcessingException e) {
        failures.add(strategy.getStrategyName() + ": " + e.getMessage());
      }

      LOGGER.warn(
          "Strategy {} failed for {}, trying next", strategy.getStrategyName(), request.source());
      deletePartialOutput(request.output());
    }

    return RenderOutcome.failed(failures);
  }

  private static void deletePartialOutput(Path output) {
    try {
      Files.deleteIfExists(output);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial output {}", output, e);
    }
  }
}
