package com.scholary.subsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subsearch.clip.ClipBoundaryResolver;
import com.scholary.subsearch.index.SubtitleIndexFactory;
import com.scholary.subsearch.media.FfmpegProperties;
import com.scholary.subsearch.media.MediaAnalyzer;
import com.scholary.subsearch.render.MediaRenderer;
import com.scholary.subsearch.service.IndexingService;
import com.scholary.subsearch.service.SearchSession;
import com.scholary.subsearch.service.SilenceAnalysisService;
import java.nio.file.Path;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the index, analysis and search beans from {@link SubsearchProperties}.
 *
 * <p>Enables SubsearchProperties and FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({SubsearchProperties.class, FfmpegProperties.class})
public class SubsearchConfig {

  @Bean
  public SubtitleIndexFactory subtitleIndexFactory(
      ObjectMapper objectMapper, SubsearchProperties properties) {
    return new SubtitleIndexFactory(
        objectMapper, properties.cache().maxSize(), properties.search().pageSize());
  }

  @Bean
  public SilenceAnalysisService silenceAnalysisService(
      MediaAnalyzer mediaAnalyzer, SubsearchProperties properties) {
    return new SilenceAnalysisService(
        mediaAnalyzer, properties.clip().noiseFactor(), properties.clip().fallbackNoiseDb());
  }

  @Bean
  public IndexingService indexingService(
      SubtitleIndexFactory indexFactory,
      MediaAnalyzer mediaAnalyzer,
      SilenceAnalysisService silenceAnalysisService) {
    return new IndexingService(indexFactory, mediaAnalyzer, silenceAnalysisService);
  }

  @Bean
  public SearchSession searchSession(
      ClipBoundaryResolver clipBoundaryResolver,
      SilenceAnalysisService silenceAnalysisService,
      MediaRenderer mediaRenderer,
      SubsearchProperties properties) {
    return new SearchSession(
        clipBoundaryResolver,
        silenceAnalysisService,
        mediaRenderer,
        Path.of(properties.outputDir()),
        properties.clip().wiggleSeconds(),
        properties.search().defaultLimit());
  }
}
