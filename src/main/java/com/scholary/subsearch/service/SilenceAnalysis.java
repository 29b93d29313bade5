package com.scholary.subsearch.service;

import com.scholary.subsearch.clip.SilenceInterval;
import java.util.List;

/**
 * Cached silence detection result, with the detector parameters it was computed with.
 *
 * @param noiseDb silence threshold used
 * @param minDurationSeconds shortest silence reported
 * @param silences detected silences sorted by start
 */
public record SilenceAnalysis(
    double noiseDb, double minDurationSeconds, List<SilenceInterval> silences) {

  private static final double EPSILON = 1e-6;

  public SilenceAnalysis {
    silences = List.copyOf(silences);
  }

  /** Whether this result was computed with the given parameters. */
  public boolean matches(double noiseDb, double minDurationSeconds) {
    return Math.abs(this.noiseDb - noiseDb) < EPSILON
        && Math.abs(this.minDurationSeconds - minDurationSeconds) < EPSILON;
  }
}
