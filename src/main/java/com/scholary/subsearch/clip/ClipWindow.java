package com.scholary.subsearch.clip;

/**
 * A clip cut, as a start offset and a duration in seconds.
 *
 * <p>The duration may be zero when clamping collapses the window.
 */
public record ClipWindow(double start, double duration) {

  public double end() {
    return start + duration;
  }

  /**
   * Check that this window can be handed to a renderer.
   *
   * @return this window
   * @throws InvalidClipDurationException if the duration is negative
   */
  public ClipWindow requireRenderable() {
    if (duration < 0) {
      throw new InvalidClipDurationException(this);
    }
    return this;
  }
}
