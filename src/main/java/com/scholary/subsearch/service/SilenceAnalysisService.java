package com.scholary.subsearch.service;

import com.scholary.subsearch.cache.AnalysisCache;
import com.scholary.subsearch.cache.CacheException;
import com.scholary.subsearch.cache.CacheKey;
import com.scholary.subsearch.clip.SilenceInterval;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.media.MediaAnalyzer;
import com.scholary.subsearch.media.MediaProcessingException;
import com.scholary.subsearch.media.VolumeStats;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces silence intervals for a media file, memoized in the index's analysis cache.
 *
 * <p>The silence threshold follows the file's loudness: mean volume times a fixed factor, so quiet
 * recordings get a lower threshold than loud ones. The shortest reported silence is half the
 * wiggle. Volume stats are cached under {@code (path, "volume_stats")} and silences under {@code
 * (path, "silences")}; cached silences computed with other parameters are recomputed.
 */
public class SilenceAnalysisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SilenceAnalysisService.class);

  private final MediaAnalyzer analyzer;
  private final double noiseFactor;
  private final double fallbackNoiseDb;

  /**
   * @param analyzer the media analysis collaborator
   * @param noiseFactor multiplier applied to the mean volume (in dB) to get the silence threshold
   * @param fallbackNoiseDb threshold used when the mean volume is not finite (silent track)
   */
  public SilenceAnalysisService(MediaAnalyzer analyzer, double noiseFactor, double fallbackNoiseDb) {
    this.analyzer = analyzer;
    this.noiseFactor = noiseFactor;
    this.fallbackNoiseDb = fallbackNoiseDb;
  }

  /**
   * Get the silences of a media file, computing and caching them on first use.
   *
   * <p>Analysis failures are reported and yield an empty list, which makes clips fall back to the
   * default boundaries.
   *
   * @param cache the cache of the index the file belongs to
   * @param mediaFile the media file
   * @param wiggle tolerance window in seconds
   * @param reporter receives analysis failures
   * @return silences sorted by start, possibly empty
   */
  public List<SilenceInterval> silencesFor(
      AnalysisCache cache, Path mediaFile, double wiggle, Reporter reporter) {
    try {
      VolumeStats volume =
          cache.getOrCompute(
              CacheKey.forMedia(mediaFile, CacheKey.VOLUME_STATS),
              VolumeStats.class,
              () -> analyzer.measureVolume(mediaFile));
      double noiseDb = noiseThreshold(volume);
      double minDuration = wiggle / 2;

      CacheKey silencesKey = CacheKey.forMedia(mediaFile, CacheKey.SILENCES);
      Optional<SilenceAnalysis> cached = cache.get(silencesKey, SilenceAnalysis.class);
      if (cached.isPresent() && cached.get().matches(noiseDb, minDuration)) {
        return cached.get().silences();
      }

      LOGGER.info(
          "Computing silences for {}: mean={}dB, noise={}dB, minDuration={}s",
          mediaFile,
          volume.meanDb(),
          noiseDb,
          minDuration);
      List<SilenceInterval> silences = analyzer.detectSilences(mediaFile, noiseDb, minDuration);
      return cache.set(silencesKey, new SilenceAnalysis(noiseDb, minDuration, silences)).silences();
    } catch (MediaProcessingException | CacheException e) {
      reporter.failure("Silence analysis failed for " + mediaFile + ", using default clip bounds", e);
      return List.of();
    }
  }

  double noiseThreshold(VolumeStats volume) {
    if (!Double.isFinite(volume.meanDb())) {
      return fallbackNoiseDb;
    }
    return volume.meanDb() * noiseFactor;
  }
}
