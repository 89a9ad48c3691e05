package dev.codescope.search.source;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchQuery;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link DenseSearchSource} over a LangChain4j {@link EmbeddingStore}: metadata filters for the
 * query's language, chunk kind and file path, minimum score set to the query threshold.
 */
@Component
public class EmbeddingStoreDenseSearch implements DenseSearchSource {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreDenseSearch.class);

  private final EmbeddingStore<TextSegment> embeddingStore;

  public EmbeddingStoreDenseSearch(EmbeddingStore<TextSegment> embeddingStore) {
    this.embeddingStore = embeddingStore;
  }

  @Override
  public List<Candidate> search(SearchQuery query, Embedding queryEmbedding) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(query.limit())
            .minScore(query.threshold());

    Filter filter = buildFilter(query);
    if (filter != null) {
      builder.filter(filter);
    }

    EmbeddingSearchResult<TextSegment> result = embeddingStore.search(builder.build());
    List<Candidate> candidates =
        result.matches().stream()
            .map(ChunkSegments::toCandidate)
            .sorted(Candidate.RANKING)
            .toList();
    log.debug("Dense search returned {} candidates", candidates.size());
    return candidates;
  }

  /**
   * Combines the query's filters with AND.
   *
   * @return the combined filter, or null if the query sets none
   */
  @Nullable Filter buildFilter(SearchQuery query) {
    List<Filter> filters = new ArrayList<>();
    if (query.language() != null) {
      filters.add(metadataKey(ChunkSegments.LANGUAGE).isEqualTo(query.language()));
    }
    if (query.chunkKind() != null) {
      filters.add(metadataKey(ChunkSegments.CHUNK_KIND).isEqualTo(query.chunkKind().value()));
    }
    if (query.filePath() != null) {
      filters.add(metadataKey(ChunkSegments.FILE_PATH).isEqualTo(query.filePath()));
    }
    return filters.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }
}
