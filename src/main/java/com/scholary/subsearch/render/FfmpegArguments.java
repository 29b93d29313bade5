package com.scholary.subsearch.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Shared pieces of the rendering command lines. */
final class FfmpegArguments {

  private FfmpegArguments() {}

  /**
   * Input seek followed by an output seek with copied timestamps.
   *
   * <p>Seeking the input is fast; keeping the original timestamps lets subtitle filters line up
   * with the picture.
   */
  static List<String> seekedInput(RenderRequest request) {
    String seek = seconds(request.seekSeconds());
    List<String> args = new ArrayList<>(List.of("-ss", seek, "-i", request.source().toString()));
    args.addAll(List.of("-copyts", "-ss", seek));
    return args;
  }

  /** Output options for the request kind, ending with the output file. */
  static List<String> output(RenderRequest request) {
    List<String> args = new ArrayList<>();
    if (request.kind() == RenderRequest.Kind.STILL) {
      args.addAll(List.of("-vframes", "1", "-f", "image2"));
    } else {
      args.addAll(
          List.of(
              "-t", seconds(request.durationSeconds()),
              "-c:v", "libx264", "-preset", "veryfast",
              "-c:a", "aac",
              "-movflags", "+faststart"));
    }
    args.add(request.output().toString());
    return args;
  }

  static String seconds(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  /** Escape a path for use inside a single-quoted filtergraph argument. */
  static String escapeFilterPath(String path) {
    return path.replace("\\", "\\\\").replace("'", "\\'").replace(":", "\\:");
  }
}
