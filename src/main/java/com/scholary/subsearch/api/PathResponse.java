package com.scholary.subsearch.api;

import java.util.List;

/**
 * Result of adding or removing a path.
 *
 * @param files media files affected
 * @param failures files that were skipped, with the reason
 */
public record PathResponse(List<String> files, List<String> failures) {}
