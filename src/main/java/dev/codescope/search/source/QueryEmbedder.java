package dev.codescope.search.source;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns text into vectors with the configured {@link EmbeddingModel}.
 *
 * <p>Queries get the model's retrieval instruction prefix; documents are embedded as-is. The
 * default prefix is the one recommended for bge-small-en-v1.5.
 */
@Component
public class QueryEmbedder {

  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;
  private final String queryPrefix;

  public QueryEmbedder(
      EmbeddingModel embeddingModel,
      @Value("${codescope.embedding.query-prefix:" + BGE_QUERY_PREFIX + "}") String queryPrefix) {
    this.embeddingModel = embeddingModel;
    this.queryPrefix = queryPrefix;
  }

  public Embedding embedQuery(String text) {
    return embeddingModel.embed(queryPrefix + text).content();
  }

  public Embedding embedDocument(String text) {
    return embeddingModel.embed(text).content();
  }
}
