package com.scholary.subsearch.api;

/**
 * Request for creating (or recreating) the index.
 *
 * @param relative store media paths relative to the index directory ({@code null}: configured
 *     default)
 */
public record CreateIndexRequest(Boolean relative) {}
