package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import java.util.List;

/**
 * External relevance model that re-orders a short candidate list for a query.
 *
 * <p>Implementations may block for a network round trip or a model inference. They may throw;
 * {@link RerankOrchestrator} treats any failure as a degradation.
 */
public interface Reranker {

  /** Whether the reranker is configured and able to serve requests. */
  boolean isEnabled();

  /**
   * Re-orders the shortlist.
   *
   * @param query the query text
   * @param shortlist the candidates to score, in current rank order
   * @param maxResults the maximum number of entries to return
   * @return the reranker's ordering, most relevant first
   */
  RerankResponse rerank(String query, List<Candidate> shortlist, int maxResults);
}
