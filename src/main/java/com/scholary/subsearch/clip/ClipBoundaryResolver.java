package com.scholary.subsearch.clip;

import java.util.List;
import java.util.ListIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes clip cut points around a subtitle event.
 *
 * <p>Without silence data the clip is the event padded by half the wiggle on each side. With
 * silence data each edge may snap to a nearby silence so the clip starts and ends on a pause
 * instead of mid-word:
 *
 * <ol>
 *   <li>Pre-roll: the first silence (ascending) whose end lies within wiggle of the event start
 *       moves the start to just before that silence ends.
 *   <li>Post-roll: the first silence (descending) whose start lies within wiggle of the event end
 *       moves the end to just after that silence starts.
 * </ol>
 *
 * <p>The two scans run in opposite directions, so pre-roll picks the earliest qualifying silence
 * and post-roll the latest one, not the ones closest to the event. The start never drops below
 * {@code eventStart - wiggle} or zero, and the end never passes {@code eventEnd + wiggle}.
 */
@Component
public class ClipBoundaryResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipBoundaryResolver.class);

  /**
   * Resolve the clip window for an event.
   *
   * @param eventStartMs event start in milliseconds
   * @param eventEndMs event end in milliseconds
   * @param silences silence intervals sorted ascending by start (may be empty)
   * @param wiggle tolerance window in seconds
   * @return the clip window in seconds
   */
  public ClipWindow resolve(
      long eventStartMs, long eventEndMs, List<SilenceInterval> silences, double wiggle) {
    if (wiggle < 0) {
      throw new IllegalArgumentException("Wiggle must not be negative: " + wiggle);
    }

    double eventStart = eventStartMs / 1000.0;
    double eventEnd = eventEndMs / 1000.0;

    double clipStart = eventStart - wiggle / 2;
    double clipDuration = (eventEnd - eventStart) + wiggle;

    SilenceInterval preRoll = findPreRoll(eventStart, silences, wiggle);
    if (preRoll != null) {
      clipStart =
          Math.max(Math.max(preRoll.end() - preRoll.padding(wiggle), eventStart - wiggle), 0);
      LOGGER.debug(
          "Snapped clip start to {}s (silence: {}s-{}s)", clipStart, preRoll.start(), preRoll.end());
    }

    SilenceInterval postRoll = findPostRoll(eventEnd, silences, wiggle);
    if (postRoll != null) {
      double snappedEnd = postRoll.start() + postRoll.padding(wiggle);
      clipDuration = Math.max(Math.min(snappedEnd - clipStart, (eventEnd + wiggle) - clipStart), 0);
      LOGGER.debug(
          "Snapped clip end to {}s (silence: {}s-{}s)",
          clipStart + clipDuration,
          postRoll.start(),
          postRoll.end());
    }

    return new ClipWindow(clipStart, clipDuration);
  }

  private SilenceInterval findPreRoll(
      double eventStart, List<SilenceInterval> silences, double wiggle) {
    for (SilenceInterval silence : silences) {
      if (silence.end() >= eventStart - wiggle && silence.end() <= eventStart + wiggle) {
        return silence;
      }
    }
    return null;
  }

  private SilenceInterval findPostRoll(
      double eventEnd, List<SilenceInterval> silences, double wiggle) {
    ListIterator<SilenceInterval> it = silences.listIterator(silences.size());
    while (it.hasPrevious()) {
      SilenceInterval silence = it.previous();
      if (silence.start() >= eventEnd - wiggle && silence.start() <= eventEnd + wiggle) {
        return silence;
      }
    }
    return null;
  }
}
