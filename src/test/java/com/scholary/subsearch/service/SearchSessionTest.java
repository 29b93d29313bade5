package com.scholary.subsearch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subsearch.clip.ClipBoundaryResolver;
import com.scholary.subsearch.clip.SilenceInterval;
import com.scholary.subsearch.index.SubtitleIndex;
import com.scholary.subsearch.index.SubtitleIndexFactory;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.media.MediaAnalyzer;
import com.scholary.subsearch.media.MediaProcessingException;
import com.scholary.subsearch.media.SubtitleCue;
import com.scholary.subsearch.media.VolumeStats;
import com.scholary.subsearch.render.MediaRenderer;
import com.scholary.subsearch.render.RenderFailedException;
import com.scholary.subsearch.render.RenderOutcome;
import com.scholary.subsearch.render.RenderRequest;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class SearchSessionTest {

  @TempDir Path tempDir;

  private MediaAnalyzer analyzer;
  private MediaRenderer renderer;
  private Reporter reporter;
  private SubtitleIndex index;
  private SearchSession session;
  private Path media;

  @BeforeEach
  void setUp() {
    analyzer = mock(MediaAnalyzer.class);
    renderer = mock(MediaRenderer.class);
    reporter = mock(Reporter.class);
    media = tempDir.resolve("ep01.mkv");

    when(analyzer.extractSubtitleText(media))
        .thenReturn(
            List.of(
                new SubtitleCue(10_000, 12_000, false, "hello there"),
                new SubtitleCue(20_000, 21_000, false, "unrelated")));
    SubtitleIndexFactory factory = new SubtitleIndexFactory(new ObjectMapper(), 100, 10);
    index = factory.create(tempDir.resolve("index"), false);
    index.add(media, analyzer, null, Reporter.silent());

    when(renderer.render(any()))
        .thenAnswer(
            invocation -> {
              RenderRequest request = invocation.getArgument(0);
              return RenderOutcome.rendered("plain-video", request.output(), List.of());
            });

    session =
        new SearchSession(
            new ClipBoundaryResolver(),
            new SilenceAnalysisService(analyzer, 1.5, -50.0),
            renderer,
            tempDir.resolve("out"),
            1.0,
            20);
  }

  @AfterEach
  void tearDown() throws Exception {
    index.close();
  }

  @Test
  void run_shouldRenderStillAtEventMidpoint() {
    SearchReport report =
        session.run(index, new SearchRequest("hello there", RenderMode.STILL, null, null), reporter);

    ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
    verify(renderer).render(captor.capture());
    RenderRequest request = captor.getValue();
    assertThat(request.kind()).isEqualTo(RenderRequest.Kind.STILL);
    assertThat(request.seekSeconds()).isEqualTo(11.0);
    assertThat(request.output()).isEqualTo(tempDir.resolve("out").resolve("hello+there00.png"));

    assertThat(report.query()).isEqualTo("hello there");
    assertThat(report.correlationId()).isNotBlank();
    assertThat(report.results()).hasSize(1);
    assertThat(report.results().get(0).rendered()).isTrue();
    assertThat(report.renderedCount()).isEqualTo(1);
  }

  @Test
  void run_shouldPadClipWithoutAnalyzingAudio() {
    SearchReport report =
        session.run(index, new SearchRequest("hello", RenderMode.CLIP, 1.0, null), reporter);

    ClipResult result = report.results().get(0);
    assertThat(result.window().start()).isCloseTo(9.5, within(1e-9));
    assertThat(result.window().duration()).isCloseTo(3.0, within(1e-9));
    assertThat(result.output()).endsWith("hello00.mp4");
    verify(analyzer, never()).measureVolume(any());
  }

  @Test
  void run_shouldSnapClipToCachedSilences() {
    when(analyzer.measureVolume(media)).thenReturn(new VolumeStats(-30.0, -2.0));
    when(analyzer.detectSilences(media, -45.0, 0.5))
        .thenReturn(List.of(new SilenceInterval(9.2, 9.6, 0.4)));

    SearchReport report =
        session.run(
            index, new SearchRequest("hello", RenderMode.SILENCE_AWARE_CLIP, 1.0, null), reporter);
    session.run(
        index, new SearchRequest("hello", RenderMode.SILENCE_AWARE_CLIP, 1.0, null), reporter);

    assertThat(report.results().get(0).window().start()).isCloseTo(9.467, within(0.001));
    verify(analyzer).detectSilences(media, -45.0, 0.5);
  }

  @Test
  void run_shouldUseDefaultBoundsWhenAnalysisFails() {
    when(analyzer.measureVolume(media)).thenThrow(new MediaProcessingException("no audio"));

    SearchReport report =
        session.run(
            index, new SearchRequest("hello", RenderMode.SILENCE_AWARE_CLIP, 1.0, null), reporter);

    assertThat(report.results().get(0).window().start()).isCloseTo(9.5, within(1e-9));
    assertThat(report.results().get(0).rendered()).isTrue();
    verify(reporter).failure(contains("Silence analysis failed"), any());
  }

  @Test
  void run_shouldReportRenderFailureAndContinue() {
    when(analyzer.extractSubtitleText(tempDir.resolve("ep02.mkv")))
        .thenReturn(List.of(new SubtitleCue(0, 1000, false, "hello again")));
    index.add(tempDir.resolve("ep02.mkv"), analyzer, null, Reporter.silent());
    doReturn(RenderOutcome.failed(List.of("plain-video: exit code 1: boom")))
        .doAnswer(
            invocation -> {
              RenderRequest request = invocation.getArgument(0);
              return RenderOutcome.rendered("plain-video", request.output(), List.of());
            })
        .when(renderer)
        .render(any());

    SearchReport report =
        session.run(index, new SearchRequest("hello", RenderMode.STILL, null, null), reporter);

    assertThat(report.results()).hasSize(2);
    assertThat(report.results().get(0).rendered()).isFalse();
    assertThat(report.results().get(0).errors()).containsExactly("plain-video: exit code 1: boom");
    assertThat(report.results().get(1).rendered()).isTrue();
    verify(reporter).failure(contains("match 0"), any(RenderFailedException.class));
  }

  @Test
  void run_shouldOnlyListMatchesInNoneMode() {
    SearchReport report =
        session.run(index, new SearchRequest("unrelated", RenderMode.NONE, null, null), reporter);

    assertThat(report.results()).hasSize(1);
    assertThat(report.results().get(0).event().content()).isEqualTo("unrelated");
    assertThat(report.results().get(0).rendered()).isFalse();
    verifyNoInteractions(renderer);
  }

  @Test
  void run_shouldHonourLimit() {
    SearchReport report =
        session.run(
            index, new SearchRequest("hello OR unrelated", RenderMode.NONE, null, 1), reporter);

    assertThat(report.results()).hasSize(1);
  }

  @Test
  void constructor_shouldFailWhenOutputDirectoryCannotBeCreated() throws Exception {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

    assertThatThrownBy(
            () ->
                new SearchSession(
                    new ClipBoundaryResolver(),
                    new SilenceAnalysisService(analyzer, 1.5, -50.0),
                    renderer,
                    blocker.resolve("out"),
                    1.0,
                    20))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("output directory");
  }

  @Test
  void searchRequest_shouldDefaultToStill() {
    assertThat(new SearchRequest("x", null, null, null).mode()).isEqualTo(RenderMode.STILL);
  }

  @Test
  void outputBaseName_shouldReplaceSpacesAndSeparators() {
    assertThat(SearchSession.outputBaseName("  hello there ")).isEqualTo("hello+there");
    assertThat(SearchSession.outputBaseName("a/b\\c")).isEqualTo("a_b_c");
  }

  @Test
  void run_shouldNotAnalyzeWhenNoMatches() {
    SearchReport report =
        session.run(
            index, new SearchRequest("absent", RenderMode.SILENCE_AWARE_CLIP, null, null), reporter);

    assertThat(report.results()).isEmpty();
    verify(analyzer, never()).detectSilences(any(), anyDouble(), anyDouble());
  }
}
