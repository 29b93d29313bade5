package com.scholary.subsearch.index;

import com.scholary.subsearch.cache.AnalysisCache;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.logging.StructuredLogger;
import com.scholary.subsearch.media.MediaAnalyzer;
import com.scholary.subsearch.media.MediaProcessingException;
import com.scholary.subsearch.media.SubtitleCue;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent full-text index of subtitle events, backed by Lucene.
 *
 * <p>Each document is one subtitle event: the media file's stored path (exact match), start and
 * end in milliseconds, and the plain text (analyzed). A file's events are written and committed
 * together, so readers see all of them or none of them. Adding a file that is already indexed
 * replaces its events in the same commit.
 *
 * <p>Writers in one process are serialized by the caller (the index is single-threaded). Writers
 * in different processes are kept apart by Lucene's write lock: the second one fails with {@link
 * IndexStorageException} instead of waiting.
 *
 * <p>Use {@link SubtitleIndexFactory} to create or open an index.
 */
public class SubtitleIndex implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleIndex.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String PATH_FIELD = "path";
  static final String START_FIELD = "start";
  static final String END_FIELD = "end";
  static final String CONTENT_FIELD = "content";

  private final Path root;
  private final Directory directory;
  private final IndexConfig config;
  private final AnalysisCache cache;
  private final SearcherManager searcherManager;
  private final Analyzer analyzer = new StandardAnalyzer();
  private final int pageSize;

  SubtitleIndex(
      Path root,
      Directory directory,
      IndexConfig config,
      AnalysisCache cache,
      SearcherManager searcherManager,
      int pageSize) {
    this.root = root;
    this.directory = directory;
    this.config = config;
    this.cache = cache;
    this.searcherManager = searcherManager;
    this.pageSize = pageSize;
  }

  /**
   * Index a media file, or every file below a directory in lexicographic order.
   *
   * <p>A file whose subtitles cannot be extracted is reported and skipped; the remaining files are
   * still indexed. Files are committed one by one, so a concurrent reader may see some files of a
   * directory before others.
   *
   * @param path a media file or directory
   * @param extractor reads subtitle events out of media files
   * @param relativeOverride store paths relative to the index ({@code true}), absolute ({@code
   *     false}), or per the index configuration ({@code null})
   * @param reporter receives progress and skipped-file reports
   * @return the media files that were indexed
   * @throws IndexStorageException if the index cannot be written
   */
  public List<Path> add(
      Path path, MediaAnalyzer extractor, Boolean relativeOverride, Reporter reporter) {
    boolean relative = relativeOverride != null ? relativeOverride : config.relative();
    List<Path> indexed = new ArrayList<>();
    for (Path file : leafFiles(path, reporter)) {
      String storedPath = storedPath(file, relative);
      reporter.progress("adding: " + storedPath);
      try {
        List<SubtitleCue> cues = extractor.extractSubtitleText(file);
        writeFile(storedPath, cues);
        indexed.add(file.toAbsolutePath().normalize());
      } catch (MediaProcessingException e) {
        reporter.failure("Skipping " + file, e);
      }
    }
    return indexed;
  }

  /**
   * Remove a media file's events, or those of every file below a directory.
   *
   * <p>The file's analysis cache entries are evicted with it. Removing a file that was never
   * indexed does nothing. A directory that no longer exists on disk is removed by stored path
   * prefix, so its files' events go too.
   *
   * @param path a media file or directory
   * @param relativeOverride how the path was stored when added ({@code null}: index default)
   * @param reporter receives progress reports
   * @throws IndexStorageException if the index cannot be written
   */
  public void remove(Path path, Boolean relativeOverride, Reporter reporter) {
    boolean relative = relativeOverride != null ? relativeOverride : config.relative();
    for (Path file : leafFiles(path, reporter)) {
      String storedPath = storedPath(file, relative);
      Set<String> removed = new TreeSet<>();
      removed.add(storedPath);
      Query below = null;
      if (!Files.exists(file)) {
        below = new PrefixQuery(new Term(PATH_FIELD, storedPath + separator()));
        removed.addAll(storedPathsMatching(below));
      }

      reporter.progress("removing: " + storedPath);
      try (IndexWriter writer = openWriter()) {
        writer.deleteDocuments(new Term(PATH_FIELD, storedPath));
        if (below != null) {
          writer.deleteDocuments(below);
        }
        writer.commit();
      } catch (IOException e) {
        throw new IndexStorageException("Failed to remove " + storedPath + " from index", e);
      }
      refreshSearcher();

      for (String stored : removed) {
        cache.evictMedia(resolveStoredPath(stored));
        structuredLogger.logFileRemoved(stored);
      }
    }
  }

  /**
   * Search subtitle text.
   *
   * <p>The query uses Lucene's classic syntax against the subtitle text; plain words are OR'd.
   * Results come back in relevance order, one page at a time as they are iterated. A blank query
   * matches nothing.
   *
   * @param queryText the query
   * @return lazily paged results; iterating again re-runs the search
   * @throws InvalidQueryException if the query cannot be parsed
   */
  public SearchResults search(String queryText) {
    return search(queryText, Integer.MAX_VALUE);
  }

  /**
   * Search subtitle text, returning at most {@code limit} results.
   *
   * @see #search(String)
   */
  public SearchResults search(String queryText, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + limit);
    }
    return new SearchResults(this, queryText, limit);
  }

  public Path getRoot() {
    return root;
  }

  public IndexConfig getConfig() {
    return config;
  }

  public AnalysisCache getCache() {
    return cache;
  }

  SearcherManager searcherManager() {
    return searcherManager;
  }

  Analyzer analyzer() {
    return analyzer;
  }

  int pageSize() {
    return pageSize;
  }

  @Override
  public void close() throws IOException {
    try {
      searcherManager.close();
    } finally {
      directory.close();
    }
  }

  /** Path as it is stored in the index for the given policy. */
  String storedPath(Path file, boolean relative) {
    Path absolute = file.toAbsolutePath().normalize();
    if (relative) {
      return root.relativize(absolute).normalize().toString();
    }
    return absolute.toString();
  }

  /** Turn a stored path back into a usable filesystem path. */
  Path resolveStoredPath(String storedPath) {
    return root.resolve(storedPath).normalize();
  }

  private void writeFile(String storedPath, List<SubtitleCue> cues) {
    List<Document> documents = new ArrayList<>(cues.size());
    int comments = 0;
    for (SubtitleCue cue : cues) {
      if (cue.comment()) {
        comments++;
        continue;
      }
      documents.add(toDocument(storedPath, cue));
    }

    try (IndexWriter writer = openWriter()) {
      writer.deleteDocuments(new Term(PATH_FIELD, storedPath));
      writer.addDocuments(documents);
      writer.commit();
    } catch (IOException e) {
      throw new IndexStorageException("Failed to index " + storedPath, e);
    }
    refreshSearcher();
    structuredLogger.logFileIndexed(storedPath, documents.size(), comments);
  }

  private static Document toDocument(String storedPath, SubtitleCue cue) {
    Document doc = new Document();
    doc.add(new StringField(PATH_FIELD, storedPath, Field.Store.YES));
    doc.add(new LongPoint(START_FIELD, cue.startMs()));
    doc.add(new StoredField(START_FIELD, cue.startMs()));
    doc.add(new LongPoint(END_FIELD, cue.endMs()));
    doc.add(new StoredField(END_FIELD, cue.endMs()));
    doc.add(new TextField(CONTENT_FIELD, cue.plainText(), Field.Store.YES));
    return doc;
  }

  /** Writer that discards anything not explicitly committed when closed. */
  private IndexWriter openWriter() throws IOException {
    IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer);
    writerConfig.setOpenMode(IndexWriterConfig.OpenMode.APPEND);
    writerConfig.setCommitOnClose(false);
    return new IndexWriter(directory, writerConfig);
  }

  private Set<String> storedPathsMatching(Query query) {
    Set<String> paths = new TreeSet<>();
    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        int count = searcher.count(query);
        if (count == 0) {
          return paths;
        }
        StoredFields storedFields = searcher.storedFields();
        for (ScoreDoc hit : searcher.search(query, count).scoreDocs) {
          paths.add(storedFields.document(hit.doc).get(PATH_FIELD));
        }
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new IndexStorageException("Failed to look up stored paths in " + root, e);
    }
    return paths;
  }

  private String separator() {
    return root.getFileSystem().getSeparator();
  }

  private void refreshSearcher() {
    try {
      searcherManager.maybeRefreshBlocking();
    } catch (IOException e) {
      throw new IndexStorageException("Failed to refresh index searcher for " + root, e);
    }
  }

  /** Files below {@code path} in lexicographic order of entry names, or {@code path} itself. */
  private List<Path> leafFiles(Path path, Reporter reporter) {
    List<Path> files = new ArrayList<>();
    collectLeafFiles(path, files, reporter);
    return files;
  }

  private void collectLeafFiles(Path path, List<Path> files, Reporter reporter) {
    if (!Files.isDirectory(path)) {
      files.add(path);
      return;
    }
    List<Path> entries;
    try (Stream<Path> listing = Files.list(path)) {
      entries = listing.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
    } catch (IOException e) {
      reporter.failure("Cannot list directory " + path, e);
      return;
    }
    for (Path entry : entries) {
      collectLeafFiles(entry, files, reporter);
    }
  }
}
