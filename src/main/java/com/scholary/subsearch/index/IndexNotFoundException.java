package com.scholary.subsearch.index;

/** Thrown when opening a location that holds no subtitle index. */
public class IndexNotFoundException extends IndexException {

  public IndexNotFoundException(String message) {
    super(message);
  }
}
