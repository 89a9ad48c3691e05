package dev.codescope.search;

/** Pipeline stage that talks to an external dependency and can therefore fail. */
public enum SearchStage {
  EMBEDDING("embedding"),
  DENSE_SEARCH("dense_search"),
  KEYWORD_SEARCH("keyword_search"),
  RERANK("rerank");

  private final String label;

  SearchStage(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
