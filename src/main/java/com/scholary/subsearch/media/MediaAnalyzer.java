package com.scholary.subsearch.media;

import com.scholary.subsearch.clip.SilenceInterval;
import java.nio.file.Path;
import java.util.List;

/** Reads subtitle and audio information out of media files. */
public interface MediaAnalyzer {

  /**
   * Extract every event of the file's default subtitle track.
   *
   * @param mediaFile the media file
   * @return events in track order, comments included
   * @throws ExtractionException if there is no usable subtitle track or the tool fails
   */
  List<SubtitleCue> extractSubtitleText(Path mediaFile);

  /**
   * Detect silences in the file's audio track.
   *
   * @param mediaFile the media file
   * @param noiseDb level (in dB, usually negative) below which audio counts as silence
   * @param minDurationSeconds shortest silence to report
   * @return silences sorted ascending by start
   * @throws MalformedSilenceDataException if the detector output is inconsistent
   */
  List<SilenceInterval> detectSilences(Path mediaFile, double noiseDb, double minDurationSeconds);

  /**
   * Measure mean and peak volume of the file's audio track.
   *
   * @param mediaFile the media file
   * @return the volume stats
   * @throws MediaProcessingException if the tool fails or reports no volume
   */
  VolumeStats measureVolume(Path mediaFile);
}
