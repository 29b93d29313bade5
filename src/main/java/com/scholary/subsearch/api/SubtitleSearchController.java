package com.scholary.subsearch.api;

import com.scholary.subsearch.config.SubsearchProperties;
import com.scholary.subsearch.index.SubtitleIndex;
import com.scholary.subsearch.logging.CollectingReporter;
import com.scholary.subsearch.service.IndexProvider;
import com.scholary.subsearch.service.IndexingService;
import com.scholary.subsearch.service.SearchReport;
import com.scholary.subsearch.service.SearchRequest;
import com.scholary.subsearch.service.SearchSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the subtitle index.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating the index
 *   <li>Adding and removing media files
 *   <li>Searching subtitle text
 *   <li>Rendering stills or clips for the matches of a search
 * </ul>
 *
 * <p>Per-file failures are returned in the response body, not as an error status.
 */
@RestController
@Tag(name = "Subtitles", description = "Subtitle indexing, search and clip rendering API")
public class SubtitleSearchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleSearchController.class);

  private final IndexProvider indexProvider;
  private final IndexingService indexingService;
  private final SearchSession searchSession;
  private final SubsearchProperties properties;

  public SubtitleSearchController(
      IndexProvider indexProvider,
      IndexingService indexingService,
      SearchSession searchSession,
      SubsearchProperties properties) {
    this.indexProvider = indexProvider;
    this.indexingService = indexingService;
    this.searchSession = searchSession;
    this.properties = properties;
  }

  @PostMapping("/api/index")
  @Operation(
      summary = "Create index",
      description = "Create an empty index at the configured location, replacing any existing one")
  public ResponseEntity<IndexResponse> createIndex(
      @RequestBody(required = false) CreateIndexRequest request) {
    boolean relative =
        request != null && request.relative() != null ? request.relative() : properties.relative();
    SubtitleIndex index = indexProvider.create(relative);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new IndexResponse(index.getRoot().toString(), index.getConfig().relative()));
  }

  @PostMapping("/api/index/paths")
  @Operation(
      summary = "Add media",
      description = "Index a media file or every file below a directory")
  public ResponseEntity<PathResponse> addPath(@Valid @RequestBody PathRequest request) {
    LOGGER.info("Add request: path={}, relative={}", request.path(), request.relative());
    CollectingReporter reporter = new CollectingReporter(LOGGER);
    List<Path> indexed =
        indexingService.addPath(
            indexProvider.get(),
            Path.of(request.path()),
            request.relative(),
            request.withAudioAnalysis(),
            wiggleOrDefault(request.wiggle()),
            reporter);
    return ResponseEntity.ok(
        new PathResponse(indexed.stream().map(Path::toString).toList(), reporter.getFailures()));
  }

  @DeleteMapping("/api/index/paths")
  @Operation(
      summary = "Remove media",
      description = "Remove a media file, or every file below a directory, and its cached analysis")
  public ResponseEntity<PathResponse> removePath(@Valid @RequestBody PathRequest request) {
    LOGGER.info("Remove request: path={}, relative={}", request.path(), request.relative());
    CollectingReporter reporter = new CollectingReporter(LOGGER);
    indexingService.removePath(
        indexProvider.get(), Path.of(request.path()), request.relative(), reporter);
    return ResponseEntity.ok(new PathResponse(List.of(request.path()), reporter.getFailures()));
  }

  @GetMapping("/api/search")
  @Operation(summary = "Search", description = "List subtitle events matching a query")
  public ResponseEntity<List<SearchHit>> search(
      @RequestParam("q") String query,
      @RequestParam(value = "limit", required = false) @Min(1) @Max(1000) Integer limit) {
    int effectiveLimit = limit != null ? limit : properties.search().defaultLimit();
    List<SearchHit> hits =
        indexProvider.get().search(query, effectiveLimit).stream().map(SearchHit::from).toList();
    LOGGER.info("Search '{}' returned {} hits", query, hits.size());
    return ResponseEntity.ok(hits);
  }

  @PostMapping("/api/clips")
  @Operation(
      summary = "Search and render",
      description = "Render a still or clip for every match of a query")
  public ResponseEntity<SearchReport> render(@Valid @RequestBody SearchRequest request) {
    CollectingReporter reporter = new CollectingReporter(LOGGER);
    SearchReport report = searchSession.run(indexProvider.get(), request, reporter);
    return ResponseEntity.ok(report);
  }

  private double wiggleOrDefault(Double wiggle) {
    return wiggle != null ? wiggle : properties.clip().wiggleSeconds();
  }
}
