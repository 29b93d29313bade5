package com.scholary.subsearch.clip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ClipWindowTest {

  @Test
  void end_shouldAddDurationToStart() {
    assertThat(new ClipWindow(1.5, 2.0).end()).isEqualTo(3.5);
  }

  @Test
  void requireRenderable_shouldAcceptZeroDuration() {
    ClipWindow window = new ClipWindow(4.0, 0.0);
    assertThat(window.requireRenderable()).isSameAs(window);
  }

  @Test
  void requireRenderable_shouldRejectNegativeDuration() {
    ClipWindow window = new ClipWindow(4.0, -0.1);
    assertThatThrownBy(window::requireRenderable)
        .isInstanceOf(InvalidClipDurationException.class)
        .extracting(e -> ((InvalidClipDurationException) e).getWindow())
        .isEqualTo(window);
  }
}
