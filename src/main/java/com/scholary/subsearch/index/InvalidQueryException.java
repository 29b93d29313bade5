package com.scholary.subsearch.index;

/** Thrown when a search query cannot be parsed. */
public class InvalidQueryException extends IllegalArgumentException {

  public InvalidQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
