package com.scholary.subsearch.clip;

/**
 * Thrown when a clip window with a negative duration is about to be rendered.
 *
 * <p>The resolver clamps durations to zero, so this only fires if a window was built some other
 * way. It is fatal for the one result being rendered, not for the whole search.
 */
public class InvalidClipDurationException extends RuntimeException {

  private final transient ClipWindow window;

  public InvalidClipDurationException(ClipWindow window) {
    super(
        String.format(
            "Clip duration must not be negative: start=%.3fs, duration=%.3fs",
            window.start(), window.duration()));
    this.window = window;
  }

  public ClipWindow getWindow() {
    return window;
  }
}
