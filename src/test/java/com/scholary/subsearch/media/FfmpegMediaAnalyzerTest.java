package com.scholary.subsearch.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.subsearch.clip.SilenceInterval;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FfmpegMediaAnalyzerTest {

  private static final String SILENCE_OUTPUT =
      """
      [silencedetect @ 0x55d] silence_start: 12.5
      [silencedetect @ 0x55d] silence_end: 14.0 | silence_duration: 1.5
      [silencedetect @ 0x55d] silence_start: -0.01
      [silencedetect @ 0x55d] silence_end: 0.8 | silence_duration: 0.81
      """;

  @Mock private FfmpegRunner runner;

  private FfmpegMediaAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    analyzer = new FfmpegMediaAnalyzer(runner, new AssEventParser());
  }

  @Test
  void parseSilenceOutput_shouldPairAndSortIntervals() {
    List<SilenceInterval> intervals = FfmpegMediaAnalyzer.parseSilenceOutput(SILENCE_OUTPUT);

    assertThat(intervals)
        .containsExactly(new SilenceInterval(0.0, 0.8, 0.81), new SilenceInterval(12.5, 14.0, 1.5));
  }

  @Test
  void parseSilenceOutput_shouldRejectMismatchedCounts() {
    String truncated = "silence_start: 1.0\nsilence_end: 2.0 | silence_duration: 1.0\n"
        + "silence_start: 5.0\n";

    assertThatThrownBy(() -> FfmpegMediaAnalyzer.parseSilenceOutput(truncated))
        .isInstanceOf(MalformedSilenceDataException.class)
        .hasMessageContaining("2 starts, 1 ends, 1 durations");
  }

  @Test
  void parseSilenceOutput_shouldReturnEmptyForNoSilence() {
    assertThat(FfmpegMediaAnalyzer.parseSilenceOutput("size=N/A time=00:10:00.00")).isEmpty();
  }

  @Test
  void parseVolumeOutput_shouldReadMeanAndMax() {
    VolumeStats stats =
        FfmpegMediaAnalyzer.parseVolumeOutput(
            "[Parsed_volumedetect_0 @ 0x1] mean_volume: -27.1 dB\n"
                + "[Parsed_volumedetect_0 @ 0x1] max_volume: -3.2 dB\n");

    assertThat(stats).isEqualTo(new VolumeStats(-27.1, -3.2));
  }

  @Test
  void parseVolumeOutput_shouldHandleSilentTrack() {
    VolumeStats stats =
        FfmpegMediaAnalyzer.parseVolumeOutput("mean_volume: -inf dB\nmax_volume: -inf dB\n");

    assertThat(stats.meanDb()).isEqualTo(Double.NEGATIVE_INFINITY);
  }

  @Test
  void extractSubtitleText_shouldParseAssFromStdout() {
    String ass =
        "[Events]\nFormat: Start, End, Text\nDialogue: 0:00:01.00,0:00:02.00,hi\n";
    when(runner.run(eq("error"), anyList())).thenReturn(new FfmpegRunner.Result(0, ass, ""));

    List<SubtitleCue> cues = analyzer.extractSubtitleText(Path.of("/media/a.mkv"));

    assertThat(cues).containsExactly(new SubtitleCue(1000, 2000, false, "hi"));
  }

  @Test
  void extractSubtitleText_shouldFailWithoutSubtitleTrack() {
    when(runner.run(eq("error"), anyList()))
        .thenReturn(new FfmpegRunner.Result(1, "", "Output file #0 does not contain any stream"));

    assertThatThrownBy(() -> analyzer.extractSubtitleText(Path.of("/media/a.mkv")))
        .isInstanceOf(ExtractionException.class)
        .hasMessageContaining("does not contain any stream");
  }

  @Test
  void detectSilences_shouldPassThresholdsToFilter() {
    when(runner.run(
            eq("info"), argThat(args -> args.contains("silencedetect=noise=-40.50dB:d=0.500"))))
        .thenReturn(new FfmpegRunner.Result(0, "", SILENCE_OUTPUT));

    List<SilenceInterval> intervals =
        analyzer.detectSilences(Path.of("/media/a.mkv"), -40.5, 0.5);

    assertThat(intervals).hasSize(2);
  }
}
