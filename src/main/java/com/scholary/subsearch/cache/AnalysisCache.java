package com.scholary.subsearch.cache;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable cache for results of expensive media analysis.
 *
 * <p>Entries never expire. They live until {@link #pop} removes them, which happens when the
 * owning media file is removed from the index. Results computed before a media file changed on
 * disk are served stale.
 */
public interface AnalysisCache {

  /**
   * Look up an entry without side effects.
   *
   * @param key the entry key
   * @param type the value type to decode into
   * @return the cached value, or empty if never stored
   */
  <T> Optional<T> get(CacheKey key, Class<T> type);

  /**
   * Look up an entry, falling back to a caller default. Nothing is stored on a miss.
   *
   * @param key the entry key
   * @param type the value type to decode into
   * @param defaultValue returned unchanged on a miss
   * @return the cached value or {@code defaultValue}
   */
  default <T> T getOrDefault(CacheKey key, Class<T> type, T defaultValue) {
    return get(key, type).orElse(defaultValue);
  }

  /**
   * Look up an entry, computing and storing it on a miss.
   *
   * <p>{@code onMiss} runs at most once per call and its result is stored before being returned.
   *
   * @param key the entry key
   * @param type the value type to decode into
   * @param onMiss computes the value when absent
   * @return the cached or freshly computed value
   */
  default <T> T getOrCompute(CacheKey key, Class<T> type, Supplier<? extends T> onMiss) {
    Optional<T> cached = get(key, type);
    if (cached.isPresent()) {
      return cached.get();
    }
    return set(key, onMiss.get());
  }

  /**
   * Store a value, replacing any previous entry.
   *
   * @param key the entry key
   * @param value a JSON-serializable value
   * @return {@code value}, unchanged
   */
  <T> T set(CacheKey key, T value);

  /**
   * Remove an entry and return what it held.
   *
   * @param key the entry key
   * @param type the value type to decode into
   * @return the removed value, or empty if there was none
   */
  <T> Optional<T> pop(CacheKey key, Class<T> type);

  /**
   * Remove every analysis entry belonging to a media file.
   *
   * @param mediaFile the media file
   */
  default void evictMedia(Path mediaFile) {
    for (String kind : CacheKey.MEDIA_ANALYSIS_KINDS) {
      pop(CacheKey.forMedia(mediaFile, kind), Object.class);
    }
  }
}
