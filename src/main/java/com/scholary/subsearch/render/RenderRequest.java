package com.scholary.subsearch.render;

import com.scholary.subsearch.clip.ClipWindow;
import java.nio.file.Path;

/**
 * What to render from a media file: a still frame or a short clip.
 *
 * @param source the media file
 * @param kind still frame or clip
 * @param seekSeconds still: the frame time; clip: the clip start
 * @param durationSeconds clip length (zero for stills)
 * @param output the file to write, with its extension
 */
public record RenderRequest(
    Path source, Kind kind, double seekSeconds, double durationSeconds, Path output) {

  public enum Kind {
    STILL,
    CLIP
  }

  public static RenderRequest still(Path source, long seekMs, Path outputWithoutExtension) {
    return new RenderRequest(
        source, Kind.STILL, seekMs / 1000.0, 0, withExtension(outputWithoutExtension, ".png"));
  }

  public static RenderRequest clip(Path source, ClipWindow window, Path outputWithoutExtension) {
    window.requireRenderable();
    return new RenderRequest(
        source,
        Kind.CLIP,
        window.start(),
        window.duration(),
        withExtension(outputWithoutExtension, ".mp4"));
  }

  private static Path withExtension(Path path, String extension) {
    return path.resolveSibling(path.getFileName() + extension);
  }
}
