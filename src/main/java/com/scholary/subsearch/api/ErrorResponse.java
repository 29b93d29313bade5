package com.scholary.subsearch.api;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * @param code machine-readable error code
 * @param message human-readable description
 * @param timestamp when the error occurred
 * @param path request path
 */
public record ErrorResponse(String code, String message, Instant timestamp, String path) {

  public static ErrorResponse of(String code, String message, String path) {
    return new ErrorResponse(code, message, Instant.now(), path);
  }
}
