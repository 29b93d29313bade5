package com.scholary.subsearch.clip;

/**
 * A detected silence interval in a media file's audio track, in seconds.
 *
 * <p>{@code duration} is carried as reported by the detector rather than recomputed from the
 * bounds. Lists of intervals are kept sorted ascending by {@link #start()}.
 */
public record SilenceInterval(double start, double end, double duration) {

  public SilenceInterval {
    if (end <= start) {
      throw new IllegalArgumentException("Silence end must be after its start");
    }
  }

  /** Interval whose duration is derived from its bounds. */
  public static SilenceInterval of(double start, double end) {
    return new SilenceInterval(start, end, end - start);
  }

  /**
   * Get the portion of this silence that may be kept next to speech when snapping a clip edge.
   *
   * @param wiggle the tolerance window in seconds
   * @return a third of the silence, capped at half the wiggle
   */
  public double padding(double wiggle) {
    return Math.min(duration / 3.0, wiggle / 2.0);
  }
}
