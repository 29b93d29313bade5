package com.scholary.subsearch.media;

import com.scholary.subsearch.clip.SilenceInterval;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Media analysis backed by ffmpeg.
 *
 * <ul>
 *   <li>Subtitles: the default subtitle track is converted to ASS on stdout and parsed.
 *   <li>Silences: the silencedetect filter reports start/end/duration triples on stderr.
 *   <li>Volume: the volumedetect filter reports mean and max volume on stderr.
 * </ul>
 */
@Component
public class FfmpegMediaAnalyzer implements MediaAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaAnalyzer.class);

  // Example: [silencedetect @ 0x...] silence_start: 45.2
  // Example: [silencedetect @ 0x...] silence_end: 47.8 | silence_duration: 2.6
  private static final Pattern SILENCE_START_PATTERN =
      Pattern.compile("silence_start:\\s*(-?[0-9.]+)");
  private static final Pattern SILENCE_END_PATTERN = Pattern.compile("silence_end:\\s*([0-9.]+)");
  private static final Pattern SILENCE_DURATION_PATTERN =
      Pattern.compile("silence_duration:\\s*([0-9.]+)");

  // Example: [Parsed_volumedetect_0 @ 0x...] mean_volume: -27.1 dB
  private static final Pattern MEAN_VOLUME_PATTERN =
      Pattern.compile("mean_volume:\\s*(-?[0-9.]+|-inf) dB");
  private static final Pattern MAX_VOLUME_PATTERN =
      Pattern.compile("max_volume:\\s*(-?[0-9.]+|-inf) dB");

  private final FfmpegRunner runner;
  private final AssEventParser assParser;

  public FfmpegMediaAnalyzer(FfmpegRunner runner, AssEventParser assParser) {
    this.runner = runner;
    this.assParser = assParser;
  }

  @Override
  public List<SubtitleCue> extractSubtitleText(Path mediaFile) {
    LOGGER.info("Extracting subtitles from: {}", mediaFile);

    FfmpegRunner.Result result =
        runner.run("error", List.of("-i", mediaFile.toString(), "-f", "ass", "-"));
    if (!result.succeeded() || result.stdout().isBlank()) {
      throw new ExtractionException(
          String.format(
              "No usable subtitle track in %s (exit code %d): %s",
              mediaFile, result.exitCode(), result.stderr().strip()));
    }

    List<SubtitleCue> cues = assParser.parse(result.stdout());
    LOGGER.info("Extracted {} subtitle events from {}", cues.size(), mediaFile);
    return cues;
  }

  @Override
  public List<SilenceInterval> detectSilences(
      Path mediaFile, double noiseDb, double minDurationSeconds) {
    LOGGER.info(
        "Analyzing silence in file: {} (noise={}dB, d={}s)", mediaFile, noiseDb, minDurationSeconds);

    String filter =
        String.format(Locale.ROOT, "silencedetect=noise=%.2fdB:d=%.3f", noiseDb, minDurationSeconds);
    FfmpegRunner.Result result =
        runner.run("info", List.of("-i", mediaFile.toString(), "-af", filter, "-f", "null", "-"));
    if (!result.succeeded()) {
      throw new MediaProcessingException(
          "Silence detection failed for " + mediaFile + " (exit code " + result.exitCode() + ")");
    }

    List<SilenceInterval> intervals = parseSilenceOutput(result.stderr());
    LOGGER.info("Detected {} silence intervals", intervals.size());
    return intervals;
  }

  @Override
  public VolumeStats measureVolume(Path mediaFile) {
    LOGGER.info("Measuring volume of file: {}", mediaFile);

    FfmpegRunner.Result result =
        runner.run(
            "info", List.of("-i", mediaFile.toString(), "-af", "volumedetect", "-f", "null", "-"));
    if (!result.succeeded()) {
      throw new MediaProcessingException(
          "Volume detection failed for " + mediaFile + " (exit code " + result.exitCode() + ")");
    }
    return parseVolumeOutput(result.stderr());
  }

  /**
   * Parse silencedetect output into intervals.
   *
   * <p>Starts, ends and durations are collected separately and must pair up one to one.
   *
   * @return silence intervals sorted by start time
   */
  static List<SilenceInterval> parseSilenceOutput(String stderr) {
    List<Double> starts = collect(SILENCE_START_PATTERN, stderr);
    List<Double> ends = collect(SILENCE_END_PATTERN, stderr);
    List<Double> durations = collect(SILENCE_DURATION_PATTERN, stderr);

    if (starts.size() != ends.size() || ends.size() != durations.size()) {
      throw new MalformedSilenceDataException(
          String.format(
              "Mismatched silence detection output: %d starts, %d ends, %d durations",
              starts.size(), ends.size(), durations.size()));
    }

    List<SilenceInterval> intervals = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      double start = Math.max(starts.get(i), 0.0);
      double end = ends.get(i);
      if (end <= start) {
        throw new MalformedSilenceDataException(
            "Silence ends before it starts: " + start + "s-" + end + "s");
      }
      intervals.add(new SilenceInterval(start, end, durations.get(i)));
    }

    // ffmpeg reports in order already
    intervals.sort(Comparator.comparingDouble(SilenceInterval::start));
    return intervals;
  }

  static VolumeStats parseVolumeOutput(String stderr) {
    Matcher mean = MEAN_VOLUME_PATTERN.matcher(stderr);
    Matcher max = MAX_VOLUME_PATTERN.matcher(stderr);
    if (!mean.find() || !max.find()) {
      throw new MediaProcessingException("Volume detection reported no mean/max volume");
    }
    return new VolumeStats(decibels(mean.group(1)), decibels(max.group(1)));
  }

  private static double decibels(String value) {
    return "-inf".equals(value) ? Double.NEGATIVE_INFINITY : Double.parseDouble(value);
  }

  private static List<Double> collect(Pattern pattern, String text) {
    List<Double> values = new ArrayList<>();
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      values.add(Double.parseDouble(m.group(1)));
    }
    return values;
  }
}
