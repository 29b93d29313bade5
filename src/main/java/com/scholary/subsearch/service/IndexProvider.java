package com.scholary.subsearch.service;

import com.scholary.subsearch.config.SubsearchProperties;
import com.scholary.subsearch.index.SubtitleIndex;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the application's single open index.
 *
 * <p>The index at {@code subsearch.index-dir} is opened on first use. Creating a new index closes
 * the current one first.
 */
@Component
public class IndexProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(IndexProvider.class);

  private final IndexingService indexingService;
  private final Path location;
  private SubtitleIndex current;

  public IndexProvider(IndexingService indexingService, SubsearchProperties properties) {
    this.indexingService = indexingService;
    this.location = Path.of(properties.indexDir());
  }

  /**
   * The open index, opening it if needed.
   *
   * @throws com.scholary.subsearch.index.IndexNotFoundException if no index has been created
   */
  public synchronized SubtitleIndex get() {
    if (current == null) {
      current = indexingService.openIndex(location);
    }
    return current;
  }

  /** Create a fresh index at the configured location, discarding the previous one. */
  public synchronized SubtitleIndex create(boolean relative) {
    closeCurrent();
    current = indexingService.createIndex(location, relative);
    return current;
  }

  @PreDestroy
  public synchronized void close() {
    closeCurrent();
  }

  private void closeCurrent() {
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close index at {}", current.getRoot(), e);
    } finally {
      current = null;
    }
  }
}
