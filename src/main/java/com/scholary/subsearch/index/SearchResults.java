package com.scholary.subsearch.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;

/**
 * Lazily paged results of one subtitle search.
 *
 * <p>Each call to {@link #iterator()} runs the search from the start, fetching one page of hits at
 * a time. A searcher is held only while a page is fetched, so abandoning an iteration leaks
 * nothing.
 */
public class SearchResults implements Iterable<SubtitleEvent> {

  private final SubtitleIndex index;
  private final int limit;
  private final Query query;

  SearchResults(SubtitleIndex index, String queryText, int limit) {
    this.index = index;
    this.limit = limit;
    this.query = parse(index, queryText);
  }

  @Override
  public Iterator<SubtitleEvent> iterator() {
    if (query == null) {
      return List.<SubtitleEvent>of().iterator();
    }
    return new PagingIterator();
  }

  public Stream<SubtitleEvent> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /** Run the search to completion. */
  public List<SubtitleEvent> toList() {
    List<SubtitleEvent> events = new ArrayList<>();
    forEach(events::add);
    return events;
  }

  private static Query parse(SubtitleIndex index, String queryText) {
    if (queryText == null || queryText.isBlank()) {
      return null;
    }
    QueryParser parser = new QueryParser(SubtitleIndex.CONTENT_FIELD, index.analyzer());
    try {
      return parser.parse(queryText);
    } catch (ParseException e) {
      throw new InvalidQueryException("Cannot parse query '" + queryText + "'", e);
    }
  }

  private class PagingIterator implements Iterator<SubtitleEvent> {

    private final List<SubtitleEvent> page = new ArrayList<>();
    private int pageIndex;
    private ScoreDoc after;
    private int returned;
    private boolean exhausted;

    @Override
    public boolean hasNext() {
      if (returned >= limit) {
        return false;
      }
      if (pageIndex < page.size()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      fetchPage();
      return pageIndex < page.size();
    }

    @Override
    public SubtitleEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      returned++;
      return page.get(pageIndex++);
    }

    private void fetchPage() {
      page.clear();
      pageIndex = 0;
      int size = Math.min(index.pageSize(), limit - returned);
      try {
        IndexSearcher searcher = index.searcherManager().acquire();
        try {
          TopDocs hits =
              after == null ? searcher.search(query, size) : searcher.searchAfter(after, query, size);
          StoredFields storedFields = searcher.storedFields();
          for (ScoreDoc hit : hits.scoreDocs) {
            page.add(toEvent(storedFields.document(hit.doc)));
          }
          if (hits.scoreDocs.length < size) {
            exhausted = true;
          } else {
            after = hits.scoreDocs[hits.scoreDocs.length - 1];
          }
        } finally {
          index.searcherManager().release(searcher);
        }
      } catch (IOException e) {
        throw new IndexStorageException("Failed to search index " + index.getRoot(), e);
      }
    }

    private SubtitleEvent toEvent(Document doc) {
      return new SubtitleEvent(
          index.resolveStoredPath(doc.get(SubtitleIndex.PATH_FIELD)).toString(),
          doc.getField(SubtitleIndex.START_FIELD).numericValue().longValue(),
          doc.getField(SubtitleIndex.END_FIELD).numericValue().longValue(),
          doc.get(SubtitleIndex.CONTENT_FIELD));
    }
  }
}
