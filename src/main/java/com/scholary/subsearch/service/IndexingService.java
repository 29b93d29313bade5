package com.scholary.subsearch.service;

import com.scholary.subsearch.index.SubtitleIndex;
import com.scholary.subsearch.index.SubtitleIndexFactory;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.media.MediaAnalyzer;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Index lifecycle and mutations.
 *
 * <p>Index mutations are serialized here, since the index itself supports a single writer. Other
 * processes writing the same index are rejected by the index's write lock.
 */
public class IndexingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(IndexingService.class);

  private final SubtitleIndexFactory indexFactory;
  private final MediaAnalyzer analyzer;
  private final SilenceAnalysisService silenceAnalysis;
  private final ReentrantLock writeLock = new ReentrantLock();

  public IndexingService(
      SubtitleIndexFactory indexFactory,
      MediaAnalyzer analyzer,
      SilenceAnalysisService silenceAnalysis) {
    this.indexFactory = indexFactory;
    this.analyzer = analyzer;
    this.silenceAnalysis = silenceAnalysis;
  }

  public SubtitleIndex createIndex(Path location, boolean relative) {
    return indexFactory.create(location, relative);
  }

  public SubtitleIndex openIndex(Path location) {
    return indexFactory.open(location);
  }

  /**
   * Index a file or directory, optionally warming the silence cache for every indexed file.
   *
   * @param index the target index
   * @param path file or directory to add
   * @param relativeOverride path storage policy for this call ({@code null}: index default)
   * @param withAudioAnalysis whether to run silence analysis for indexed files now
   * @param wiggle tolerance window the analysis is tuned for, in seconds
   * @param reporter receives progress and per-file failures
   * @return the indexed media files
   */
  public List<Path> addPath(
      SubtitleIndex index,
      Path path,
      Boolean relativeOverride,
      boolean withAudioAnalysis,
      double wiggle,
      Reporter reporter) {
    writeLock.lock();
    try {
      List<Path> indexed = index.add(path, analyzer, relativeOverride, reporter);
      LOGGER.info("Indexed {} files from {}", indexed.size(), path);
      if (withAudioAnalysis) {
        for (Path file : indexed) {
          reporter.progress("analyzing: " + file);
          silenceAnalysis.silencesFor(index.getCache(), file, wiggle, reporter);
        }
      }
      return indexed;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Remove a file or directory from the index, along with its cached analysis.
   *
   * @param index the target index
   * @param path file or directory to remove
   * @param relativeOverride how the paths were stored ({@code null}: index default)
   * @param reporter receives progress
   */
  public void removePath(
      SubtitleIndex index, Path path, Boolean relativeOverride, Reporter reporter) {
    writeLock.lock();
    try {
      index.remove(path, relativeOverride, reporter);
    } finally {
      writeLock.unlock();
    }
  }
}
