package com.scholary.subsearch.logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;

/** Reporter that logs like {@link Reporter#logging(Logger)} and also keeps the failures. */
public class CollectingReporter implements Reporter {

  private final Reporter delegate;
  private final List<String> failures = Collections.synchronizedList(new ArrayList<>());

  public CollectingReporter(Logger logger) {
    this.delegate = Reporter.logging(logger);
  }

  @Override
  public void progress(String message) {
    delegate.progress(message);
  }

  @Override
  public void failure(String message, Throwable cause) {
    delegate.failure(message, cause);
    failures.add(message + ": " + cause.getMessage());
  }

  public List<String> getFailures() {
    return List.copyOf(failures);
  }
}
