package com.scholary.subsearch.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subsearch.config.SubsearchProperties;
import com.scholary.subsearch.index.IndexNotFoundException;
import com.scholary.subsearch.index.SubtitleIndex;
import com.scholary.subsearch.index.SubtitleIndexFactory;
import com.scholary.subsearch.logging.Reporter;
import com.scholary.subsearch.media.MediaAnalyzer;
import com.scholary.subsearch.media.SubtitleCue;
import com.scholary.subsearch.service.IndexProvider;
import com.scholary.subsearch.service.IndexingService;
import com.scholary.subsearch.service.RenderMode;
import com.scholary.subsearch.service.SearchReport;
import com.scholary.subsearch.service.SearchSession;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SubtitleSearchControllerTest {

  @TempDir Path tempDir;

  private IndexProvider indexProvider;
  private IndexingService indexingService;
  private SearchSession searchSession;
  private SubtitleIndex index;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    indexProvider = mock(IndexProvider.class);
    indexingService = mock(IndexingService.class);
    searchSession = mock(SearchSession.class);

    MediaAnalyzer analyzer = mock(MediaAnalyzer.class);
    when(analyzer.extractSubtitleText(any()))
        .thenReturn(List.of(new SubtitleCue(1000, 3000, false, "hello there")));
    index = new SubtitleIndexFactory(new ObjectMapper(), 100, 50).create(tempDir, false);
    index.add(tempDir.resolve("ep01.mkv"), analyzer, null, Reporter.silent());

    SubsearchProperties properties =
        new SubsearchProperties(
            tempDir.toString(),
            false,
            tempDir.resolve("out").toString(),
            new SubsearchProperties.ClipProperties(1.0, 1.5, -50.0),
            new SubsearchProperties.CacheProperties(100),
            new SubsearchProperties.SearchProperties(50, 20));

    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SubtitleSearchController(
                    indexProvider, indexingService, searchSession, properties))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @AfterEach
  void tearDown() throws Exception {
    index.close();
  }

  @Test
  void search_shouldReturnHits() throws Exception {
    when(indexProvider.get()).thenReturn(index);

    mockMvc
        .perform(get("/api/search").param("q", "hello"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].content").value("hello there"))
        .andExpect(jsonPath("$[0].start").value(1000))
        .andExpect(jsonPath("$[0].path").value(tempDir.resolve("ep01.mkv").toString()));
  }

  @Test
  void search_shouldMapMissingIndexToNotFound() throws Exception {
    when(indexProvider.get()).thenThrow(new IndexNotFoundException("No index at /nowhere"));

    mockMvc
        .perform(get("/api/search").param("q", "hello"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("INDEX_NOT_FOUND"))
        .andExpect(jsonPath("$.path").value("/api/search"));
  }

  @Test
  void search_shouldMapBadQueryToBadRequest() throws Exception {
    when(indexProvider.get()).thenReturn(index);

    mockMvc
        .perform(get("/api/search").param("q", "hello AND ("))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
  }

  @Test
  void createIndex_shouldUseConfiguredDefault() throws Exception {
    when(indexProvider.create(false)).thenReturn(index);

    mockMvc
        .perform(post("/api/index"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.relative").value(false));
  }

  @Test
  void addPath_shouldReturnIndexedFiles() throws Exception {
    Path media = tempDir.resolve("ep02.mkv");
    when(indexProvider.get()).thenReturn(index);
    when(indexingService.addPath(
            eq(index), eq(media), isNull(), anyBoolean(), anyDouble(), any()))
        .thenReturn(List.of(media));

    mockMvc
        .perform(
            post("/api/index/paths")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"" + media + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.files[0]").value(media.toString()))
        .andExpect(jsonPath("$.failures", hasSize(0)));
  }

  @Test
  void addPath_shouldRejectBlankPath() throws Exception {
    mockMvc
        .perform(
            post("/api/index/paths")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message", containsString("path")));
  }

  @Test
  void render_shouldReturnSessionReport() throws Exception {
    when(indexProvider.get()).thenReturn(index);
    when(searchSession.run(eq(index), any(), any()))
        .thenReturn(new SearchReport("id-1", "hello", RenderMode.CLIP, List.of()));

    mockMvc
        .perform(
            post("/api/clips")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hello\",\"mode\":\"CLIP\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.correlationId").value("id-1"))
        .andExpect(jsonPath("$.mode").value("CLIP"));
  }
}
