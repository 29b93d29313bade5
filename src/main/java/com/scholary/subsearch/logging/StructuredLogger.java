package com.scholary.subsearch.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of one log call so log shippers can
 * index them.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a file whose subtitle events were committed to the index. */
  public void logFileIndexed(String storedPath, int events, int skippedComments) {
    try {
      MDC.put("event_type", "file_indexed");
      MDC.put("path", storedPath);
      MDC.put("events", String.valueOf(events));
      MDC.put("skippedComments", String.valueOf(skippedComments));

      logger.info(
          "File indexed: path={}, events={}, skippedComments={}",
          storedPath,
          events,
          skippedComments);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file whose documents were deleted from the index. */
  public void logFileRemoved(String storedPath) {
    try {
      MDC.put("event_type", "file_removed");
      MDC.put("path", storedPath);

      logger.info("File removed: path={}", storedPath);
    } finally {
      clearEventFields();
    }
  }

  /** Log a resolved clip window for one search result. */
  public void logClipResolved(
      int resultIndex, long eventStartMs, long eventEndMs, double clipStart, double clipDuration,
      int silences) {
    try {
      MDC.put("event_type", "clip_resolved");
      MDC.put("result_index", String.valueOf(resultIndex));
      MDC.put("eventStartMs", String.valueOf(eventStartMs));
      MDC.put("eventEndMs", String.valueOf(eventEndMs));
      MDC.put("clipStart", String.valueOf(clipStart));
      MDC.put("clipDuration", String.valueOf(clipDuration));
      MDC.put("silences", String.valueOf(silences));

      logger.debug(
          "Clip resolved: result={}, event=[{}-{}]ms, clip={}s+{}s, silences={}",
          resultIndex,
          eventStartMs,
          eventEndMs,
          clipStart,
          clipDuration,
          silences);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of rendering one search result. */
  public void logRenderFinished(int resultIndex, String strategy, String output, long renderMs) {
    try {
      MDC.put("event_type", "render_finished");
      MDC.put("result_index", String.valueOf(resultIndex));
      MDC.put("strategy", strategy);
      MDC.put("output", output);
      MDC.put("renderMs", String.valueOf(renderMs));

      logger.info(
          "Render finished: result={}, strategy={}, output={}, render={}ms",
          resultIndex,
          strategy,
          output,
          renderMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a rendering failure after every strategy was tried. */
  public void logRenderFailed(int resultIndex, int attempts, String message) {
    try {
      MDC.put("event_type", "render_failed");
      MDC.put("result_index", String.valueOf(resultIndex));
      MDC.put("attempts", String.valueOf(attempts));

      logger.error("Render failed: result={}, attempts={}, message={}", resultIndex, attempts, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String correlationId, String query) {
    MDC.put("correlationId", correlationId);
    MDC.put("query", query);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("correlationId");
    MDC.remove("query");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("path");
    MDC.remove("events");
    MDC.remove("skippedComments");
    MDC.remove("result_index");
    MDC.remove("eventStartMs");
    MDC.remove("eventEndMs");
    MDC.remove("clipStart");
    MDC.remove("clipDuration");
    MDC.remove("silences");
    MDC.remove("strategy");
    MDC.remove("output");
    MDC.remove("renderMs");
    MDC.remove("attempts");
  }
}
