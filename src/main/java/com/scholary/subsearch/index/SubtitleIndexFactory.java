package com.scholary.subsearch.index;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subsearch.cache.CacheException;
import com.scholary.subsearch.cache.FileAnalysisCache;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and opens subtitle indexes.
 *
 * <p>An index directory holds Lucene's files, the {@link IndexConfig} sidecar and a {@code cache}
 * subdirectory for the index's {@link FileAnalysisCache}.
 */
public class SubtitleIndexFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleIndexFactory.class);

  static final String CACHE_DIR = "cache";

  private final ObjectMapper objectMapper;
  private final long cacheMaxSize;
  private final int pageSize;

  /**
   * @param objectMapper mapper for the config sidecar and cache entries
   * @param cacheMaxSize decoded cache entries kept in memory per index
   * @param pageSize hits fetched per search page
   */
  public SubtitleIndexFactory(ObjectMapper objectMapper, long cacheMaxSize, int pageSize) {
    this.objectMapper = objectMapper;
    this.cacheMaxSize = cacheMaxSize;
    this.pageSize = pageSize;
  }

  /**
   * Create a new, empty index, replacing any index already at {@code location}.
   *
   * <p>Cached analysis of the replaced index is deleted along with its documents.
   *
   * @param location the index directory (created if missing)
   * @param relative whether paths are stored relative to the index directory
   * @return the open index
   * @throws IndexStorageException if the location cannot be created or written
   */
  public SubtitleIndex create(Path location, boolean relative) {
    Path root = location.toAbsolutePath().normalize();
    IndexConfig config = new IndexConfig(relative);
    Directory directory = null;
    try {
      Files.createDirectories(root);
      directory = FSDirectory.open(root);
      IndexWriterConfig writerConfig = new IndexWriterConfig(new StandardAnalyzer());
      writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
      try (IndexWriter writer = new IndexWriter(directory, writerConfig)) {
        writer.commit();
      }
      objectMapper.writeValue(root.resolve(IndexConfig.FILE_NAME).toFile(), config);
      SubtitleIndex index = assemble(root, directory, config, true);
      LOGGER.info("Created index: root={}, relative={}", root, relative);
      return index;
    } catch (IOException | CacheException e) {
      closeQuietly(directory);
      throw new IndexStorageException("Failed to create index at " + root, e);
    }
  }

  /**
   * Open an existing index.
   *
   * @param location the index directory
   * @return the open index
   * @throws IndexNotFoundException if there is no index at {@code location}
   * @throws IndexCorruptedException if the configuration or index files are unreadable
   */
  public SubtitleIndex open(Path location) {
    Path root = location.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new IndexNotFoundException("No index directory at " + root);
    }

    Directory directory = null;
    try {
      directory = FSDirectory.open(root);
      if (!DirectoryReader.indexExists(directory)) {
        throw new IndexNotFoundException("No index at " + root);
      }
      IndexConfig config = readConfig(root);
      SubtitleIndex index = assemble(root, directory, config, false);
      LOGGER.info("Opened index: root={}, relative={}", root, config.relative());
      return index;
    } catch (IndexException e) {
      closeQuietly(directory);
      throw e;
    } catch (CacheException e) {
      closeQuietly(directory);
      throw new IndexStorageException("Cannot open analysis cache of index " + root, e);
    } catch (IOException e) {
      closeQuietly(directory);
      throw new IndexCorruptedException("Unreadable index at " + root, e);
    }
  }

  private IndexConfig readConfig(Path root) {
    Path configFile = root.resolve(IndexConfig.FILE_NAME);
    try {
      return objectMapper.readValue(configFile.toFile(), IndexConfig.class);
    } catch (JacksonException e) {
      throw new IndexCorruptedException("Malformed index configuration " + configFile, e);
    } catch (IOException e) {
      if (!Files.exists(configFile)) {
        throw new IndexCorruptedException("Missing index configuration " + configFile, e);
      }
      throw new IndexCorruptedException("Unreadable index configuration " + configFile, e);
    }
  }

  /** Wire the cache and searcher; a fresh index drops the analysis left by its predecessor. */
  private SubtitleIndex assemble(
      Path root, Directory directory, IndexConfig config, boolean clearCache) throws IOException {
    FileAnalysisCache cache =
        FileAnalysisCache.open(root.resolve(CACHE_DIR), objectMapper, cacheMaxSize);
    if (clearCache) {
      cache.clear();
    }
    SearcherManager searcherManager = new SearcherManager(directory, null);
    return new SubtitleIndex(root, directory, config, cache, searcherManager, pageSize);
  }

  private static void closeQuietly(Directory directory) {
    if (directory == null) {
      return;
    }
    try {
      directory.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close index directory", e);
    }
  }
}
