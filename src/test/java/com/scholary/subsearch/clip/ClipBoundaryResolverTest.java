package com.scholary.subsearch.clip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class ClipBoundaryResolverTest {

  private static final double EPS = 1e-9;

  private final ClipBoundaryResolver resolver = new ClipBoundaryResolver();

  @Test
  void resolve_withoutSilences_shouldPadEventByHalfWiggle() {
    ClipWindow window = resolver.resolve(1000, 3000, List.of(), 1.0);

    assertThat(window.start()).isCloseTo(0.5, within(EPS));
    assertThat(window.duration()).isCloseTo(3.0, within(EPS));
  }

  @Test
  void resolve_withZeroWiggle_shouldMatchEventExactly() {
    ClipWindow window = resolver.resolve(1000, 3000, List.of(), 0.0);

    assertThat(window.start()).isCloseTo(1.0, within(EPS));
    assertThat(window.duration()).isCloseTo(2.0, within(EPS));
  }

  @Test
  void resolve_shouldSnapStartToSilenceEndingNearEventStart() {
    List<SilenceInterval> silences = List.of(new SilenceInterval(9.2, 9.6, 0.4));

    ClipWindow window = resolver.resolve(10_000, 12_000, silences, 1.0);

    // 9.6 - min(0.4 / 3, 0.5)
    assertThat(window.start()).isCloseTo(9.6 - 0.4 / 3, within(EPS));
    assertThat(window.start()).isCloseTo(9.467, within(0.001));
  }

  @Test
  void resolve_shouldNotMoveStartBeforeEventStartMinusWiggle() {
    List<SilenceInterval> silences = List.of(SilenceInterval.of(5.0, 9.0));

    ClipWindow window = resolver.resolve(10_000, 12_000, silences, 1.0);

    assertThat(window.start()).isCloseTo(9.0, within(EPS));
  }

  @Test
  void resolve_shouldSnapEndToSilenceStartingNearEventEnd() {
    List<SilenceInterval> silences = List.of(SilenceInterval.of(12.2, 13.0));

    ClipWindow window = resolver.resolve(10_000, 12_000, silences, 1.0);

    assertThat(window.start()).isCloseTo(9.5, within(EPS));
    assertThat(window.end()).isCloseTo(12.2 + 0.8 / 3, within(1e-6));
  }

  @Test
  void resolve_shouldIgnoreSilencesOutsideTheWiggleWindow() {
    List<SilenceInterval> silences =
        List.of(SilenceInterval.of(1.0, 2.0), SilenceInterval.of(20.0, 21.0));

    ClipWindow window = resolver.resolve(10_000, 12_000, silences, 1.0);

    assertThat(window.start()).isCloseTo(9.5, within(EPS));
    assertThat(window.duration()).isCloseTo(3.0, within(EPS));
  }

  @Test
  void resolve_shouldPickEarliestPreRollAndLatestPostRoll() {
    List<SilenceInterval> silences =
        List.of(
            SilenceInterval.of(9.0, 9.2),
            SilenceInterval.of(9.5, 9.8),
            SilenceInterval.of(11.5, 11.7),
            SilenceInterval.of(12.5, 12.9));

    ClipWindow window = resolver.resolve(10_000, 12_000, silences, 1.0);

    // Pre-roll takes (9.0, 9.2), not the closer (9.5, 9.8)
    assertThat(window.start()).isCloseTo(9.2 - 0.2 / 3, within(1e-6));
    // Post-roll takes (12.5, 12.9), not the closer (11.5, 11.7)
    assertThat(window.end()).isCloseTo(12.5 + 0.4 / 3, within(1e-6));
  }

  @Test
  void resolve_shouldClampNegativeDurationToZero() {
    // One silence qualifies for both edges and pushes the start past the snapped end
    List<SilenceInterval> silences = List.of(SilenceInterval.of(10.6, 10.9));

    ClipWindow window = resolver.resolve(10_000, 10_100, silences, 1.0);

    assertThat(window.start()).isCloseTo(10.8, within(1e-6));
    assertThat(window.duration()).isZero();
    assertThat(window.requireRenderable()).isSameAs(window);
  }

  @Test
  void resolve_shouldRejectNegativeWiggle() {
    assertThatThrownBy(() -> resolver.resolve(1000, 3000, List.of(), -0.5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Wiggle");
  }
}
