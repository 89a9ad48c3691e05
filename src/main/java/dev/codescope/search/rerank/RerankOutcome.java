package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import java.util.List;

/**
 * Result of the rerank stage.
 *
 * @param results the candidates in their final order
 * @param reranked whether the reranker's ordering was applied
 */
public record RerankOutcome(List<Candidate> results, boolean reranked) {

  public RerankOutcome {
    results = List.copyOf(results);
  }

  static RerankOutcome unchanged(List<Candidate> candidates) {
    return new RerankOutcome(candidates, false);
  }
}
