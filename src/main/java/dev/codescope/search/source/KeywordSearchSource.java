package dev.codescope.search.source;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchQuery;
import java.util.List;

/**
 * Lexical (BM25-style) search over the chunk index. Optional: without a bean of this type the
 * pipeline runs dense-only.
 */
public interface KeywordSearchSource {

  /**
   * @param query the query, including its filters
   * @param limit maximum number of candidates
   * @return candidates sorted by keyword score descending, scores on a 0.0-1.0 scale
   */
  List<Candidate> search(SearchQuery query, int limit);
}
