package com.scholary.subsearch.media;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the ffmpeg binary and captures its output.
 *
 * <p>Every run gets {@code -nostdin -y -hide_banner -nostats} and the requested log level. Filters
 * such as silencedetect and volumedetect report at {@code info} level on stderr, so analysis runs
 * use {@code info} while extraction and rendering use {@code error}.
 */
@Component
public class FfmpegRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegRunner.class);

  private final FfmpegProperties properties;

  public FfmpegRunner(FfmpegProperties properties) {
    this.properties = properties;
  }

  /** Captured result of one ffmpeg run. */
  public record Result(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }

  /**
   * Run ffmpeg with the given arguments.
   *
   * @param logLevel ffmpeg log level, e.g. {@code info} or {@code error}
   * @param args arguments after the common flags
   * @return the captured result (a non-zero exit code is not thrown)
   * @throws MediaProcessingException if the process cannot be started, times out, or is
   *     interrupted
   */
  public Result run(String logLevel, List<String> args) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(List.of("-nostdin", "-y", "-hide_banner", "-nostats", "-loglevel", logLevel));
    command.addAll(args);

    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new MediaProcessingException("Failed to start " + properties.binary(), e);
    }

    // Drain both pipes off-thread so the timeout starts counting right away
    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
    try {
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        LOGGER.warn("ffmpeg timed out after {}s, killed", properties.timeoutSeconds());
        throw new MediaProcessingException(
            "ffmpeg did not finish within " + properties.timeoutSeconds() + "s");
      }
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        LOGGER.warn("ffmpeg exited with code {}", exitCode);
      }
      return new Result(exitCode, stdout.get(), stderr.get());
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new MediaProcessingException("ffmpeg run interrupted", e);
    } catch (ExecutionException e) {
      process.destroyForcibly();
      throw new MediaProcessingException("Failed to read ffmpeg output", e);
    }
  }

  private static String drain(InputStream stream) {
    try (InputStream in = stream) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
