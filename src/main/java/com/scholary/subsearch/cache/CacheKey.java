package com.scholary.subsearch.cache;

import java.nio.file.Path;
import java.util.List;

/**
 * Structured key for an analysis cache entry.
 *
 * <p>Keys are ordered string parts, e.g. {@code ["/media/ep01.mkv", "silences"]}. The cache hashes
 * their canonical JSON form, so callers never build storage file names by hand.
 */
public record CacheKey(List<String> parts) {

  public static final String VOLUME_STATS = "volume_stats";
  public static final String SILENCES = "silences";

  /** Analysis kinds stored per media file, evicted together when the file leaves the index. */
  public static final List<String> MEDIA_ANALYSIS_KINDS = List.of(VOLUME_STATS, SILENCES);

  public CacheKey {
    if (parts == null || parts.isEmpty()) {
      throw new IllegalArgumentException("Cache key must have at least one part");
    }
    parts = List.copyOf(parts);
  }

  public static CacheKey of(String... parts) {
    return new CacheKey(List.of(parts));
  }

  /**
   * Key for one kind of analysis of a media file.
   *
   * @param mediaFile the media file (made absolute and normalized)
   * @param kind the analysis kind, e.g. {@link #SILENCES}
   * @return the cache key
   */
  public static CacheKey forMedia(Path mediaFile, String kind) {
    return of(mediaFile.toAbsolutePath().normalize().toString(), kind);
  }
}
