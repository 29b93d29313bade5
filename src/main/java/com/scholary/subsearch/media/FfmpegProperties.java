package com.scholary.subsearch.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg invocations.
 *
 * @param binary the ffmpeg executable, resolved on PATH if not absolute
 * @param timeoutSeconds upper bound for a single ffmpeg run
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @Positive long timeoutSeconds) {}
