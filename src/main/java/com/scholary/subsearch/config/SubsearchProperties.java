package com.scholary.subsearch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the subtitle index and search sessions.
 *
 * <p>{@code relative} is only the default for newly created indexes; an existing index keeps the
 * policy it was created with.
 */
@ConfigurationProperties(prefix = "subsearch")
@Validated
public record SubsearchProperties(
    @NotBlank String indexDir,
    boolean relative,
    @NotBlank String outputDir,
    @Valid ClipProperties clip,
    @Valid CacheProperties cache,
    @Valid SearchProperties search) {

  public record ClipProperties(
      @PositiveOrZero double wiggleSeconds, @Positive double noiseFactor, double fallbackNoiseDb) {}

  public record CacheProperties(@Positive long maxSize) {}

  public record SearchProperties(@Positive int pageSize, @Positive int defaultLimit) {}
}
