package dev.codescope.search.source;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchQuery;
import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/** Nearest-neighbour search over the chunk index. */
public interface DenseSearchSource {

  /**
   * Returns up to {@code query.limit()} chunks at or above {@code query.threshold()}, honouring
   * the query's language, chunk kind and file path filters.
   *
   * @param query the query
   * @param queryEmbedding the embedded query text
   * @return candidates sorted by similarity descending
   */
  List<Candidate> search(SearchQuery query, Embedding queryEmbedding);
}
