package dev.codescope.search.rerank;

import java.util.List;

/**
 * Answer of a {@link Reranker}.
 *
 * @param reranked whether the reranker actually re-ordered anything
 * @param entries the returned ordering, most relevant first
 */
public record RerankResponse(boolean reranked, List<RerankedEntry> entries) {

  public RerankResponse {
    entries = List.copyOf(entries);
  }

  public static RerankResponse notReranked() {
    return new RerankResponse(false, List.of());
  }
}
