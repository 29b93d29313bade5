package com.scholary.subsearch.service;

import com.scholary.subsearch.clip.ClipBoundaryResolver;
import com.scholary.subsearch.clip.ClipWindow;
import com.scholary.subsearch.clip.InvalidClipDurationException;
import com.scholary.subsearch.clip.SilenceInterval;
import com.scholary.subsearch.index.SubtitleEvent;
import com.scholary.subsearch.index.SubtitleIndex;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.logging.StructuredLogger;
import com.scholary.subsearch.render.MediaRenderer;
import com.scholary.subsearch.render.RenderFailedException;
import com.scholary.subsearch.render.RenderOutcome;
import com.scholary.subsearch.render.RenderRequest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a query against an index and renders each match.
 *
 * <p>Per match, depending on the {@link RenderMode}:
 *
 * <ul>
 *   <li>STILL: one frame at the event midpoint
 *   <li>CLIP: the event padded by the wiggle
 *   <li>SILENCE_AWARE_CLIP: the event with edges snapped to cached silences
 * </ul>
 *
 * <p>Output files are named after the query (spaces become {@code +}) plus the match number, e.g.
 * {@code hello+there00.png}. A failure on one match is reported and recorded in the report; the
 * remaining matches are still rendered.
 */
public class SearchSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchSession.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ClipBoundaryResolver resolver;
  private final SilenceAnalysisService silenceAnalysis;
  private final MediaRenderer renderer;
  private final Path outputDir;
  private final double defaultWiggle;
  private final int defaultLimit;

  public SearchSession(
      ClipBoundaryResolver resolver,
      SilenceAnalysisService silenceAnalysis,
      MediaRenderer renderer,
      Path outputDir,
      double defaultWiggle,
      int defaultLimit) {
    this.resolver = resolver;
    this.silenceAnalysis = silenceAnalysis;
    this.renderer = renderer;
    this.outputDir = outputDir;
    this.defaultWiggle = defaultWiggle;
    this.defaultLimit = defaultLimit;

    try {
      Files.createDirectories(this.outputDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create output directory: " + outputDir, e);
    }
  }

  /**
   * Search and render.
   *
   * @param index the index to search
   * @param request query and rendering options
   * @param reporter receives per-match failures
   * @return one result per match
   */
  public SearchReport run(SubtitleIndex index, SearchRequest request, Reporter reporter) {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setSessionContext(correlationId, request.query());

    try {
      double wiggle = request.wiggle() != null ? request.wiggle() : defaultWiggle;
      int limit = request.limit() != null ? request.limit() : defaultLimit;
      String baseName = outputBaseName(request.query());

      LOGGER.info(
          "Starting search session: query='{}', mode={}, wiggle={}s, limit={}",
          request.query(),
          request.mode(),
          wiggle,
          limit);

      List<ClipResult> results = new ArrayList<>();
      int resultIndex = 0;
      for (SubtitleEvent event : index.search(request.query(), limit)) {
        LOGGER.debug("Match {}: path={}, content={}", resultIndex, event.path(), event.content());
        Path output = outputDir.resolve(String.format("%s%02d", baseName, resultIndex));
        results.add(
            processMatch(index, request.mode(), resultIndex, event, output, wiggle, reporter));
        resultIndex++;
      }

      SearchReport report = new SearchReport(correlationId, request.query(), request.mode(), results);
      LOGGER.info(
          "Search session completed: {} matches, {} rendered",
          results.size(),
          report.renderedCount());
      return report;
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  private ClipResult processMatch(
      SubtitleIndex index,
      RenderMode mode,
      int resultIndex,
      SubtitleEvent event,
      Path output,
      double wiggle,
      Reporter reporter) {
    if (mode == RenderMode.NONE) {
      return ClipResult.listed(resultIndex, event);
    }

    ClipWindow window = null;
    try {
      RenderRequest renderRequest;
      if (mode == RenderMode.STILL) {
        renderRequest = RenderRequest.still(event.file(), Math.round(event.midpoint()), output);
      } else {
        List<SilenceInterval> silences =
            mode == RenderMode.SILENCE_AWARE_CLIP
                ? silenceAnalysis.silencesFor(index.getCache(), event.file(), wiggle, reporter)
                : List.of();
        window = resolver.resolve(event.start(), event.end(), silences, wiggle);
        structuredLogger.logClipResolved(
            resultIndex, event.start(), event.end(), window.start(), window.duration(),
            silences.size());
        renderRequest = RenderRequest.clip(event.file(), window, output);
      }

      long started = System.currentTimeMillis();
      RenderOutcome outcome = renderer.render(renderRequest);
      if (!outcome.success()) {
        String message = String.join("; ", outcome.failures());
        structuredLogger.logRenderFailed(resultIndex, outcome.failures().size(), message);
        reporter.failure(
            "Rendering match " + resultIndex + " failed", new RenderFailedException(message));
        return new ClipResult(resultIndex, event, window, false, null, null, outcome.failures());
      }

      structuredLogger.logRenderFinished(
          resultIndex,
          outcome.strategy(),
          outcome.output().toString(),
          System.currentTimeMillis() - started);
      return new ClipResult(
          resultIndex,
          event,
          window,
          true,
          outcome.strategy(),
          outcome.output().toString(),
          outcome.failures());
    } catch (InvalidClipDurationException e) {
      reporter.failure("Match " + resultIndex + " has an invalid clip window", e);
      return new ClipResult(resultIndex, event, window, false, null, null, List.of(e.getMessage()));
    }
  }

  /** Query text made safe for a file name: trimmed, spaces to '+', separators dropped. */
  static String outputBaseName(String query) {
    return query.strip().replace(' ', '+').replace('/', '_').replace('\\', '_');
  }
}
