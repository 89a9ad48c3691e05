package dev.codescope.search;

/**
 * Raised when an external dependency of the pipeline (embedding model, dense store, keyword
 * index) fails or times out. The message is prefixed with the failing stage so callers can tell a
 * failed search apart from a degraded one; the original failure is kept as the cause.
 */
public class SearchException extends RuntimeException {

  private final SearchStage stage;

  public SearchException(SearchStage stage, String message, Throwable cause) {
    super("Search failed at " + stage.label() + ": " + message, cause);
    this.stage = stage;
  }

  public SearchStage getStage() {
    return stage;
  }
}
