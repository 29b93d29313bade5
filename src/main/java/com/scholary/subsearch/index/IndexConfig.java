package com.scholary.subsearch.index;

/**
 * Durable per-index settings, stored next to the index files as {@code subsearch-config.json}.
 *
 * @param relative whether stored paths are relative to the index directory (otherwise absolute)
 */
public record IndexConfig(boolean relative) {

  public static final String FILE_NAME = "subsearch-config.json";
}
