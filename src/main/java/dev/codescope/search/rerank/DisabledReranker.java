package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import java.util.List;

/** Stand-in used when no reranking model is configured. */
public final class DisabledReranker implements Reranker {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public RerankResponse rerank(String query, List<Candidate> shortlist, int maxResults) {
    return RerankResponse.notReranked();
  }
}
