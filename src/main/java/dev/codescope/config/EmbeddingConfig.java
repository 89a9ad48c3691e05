package dev.codescope.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and the chunk store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The store defaults to an in-memory one; deployments that
 * index into a real vector database declare their own {@link EmbeddingStore} bean.
 *
 * @see dev.codescope.search.source.EmbeddingStoreDenseSearch
 */
@Configuration
public class EmbeddingConfig {

  @Bean
  @ConditionalOnMissingBean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  @Bean
  @ConditionalOnMissingBean
  public EmbeddingStore<TextSegment> embeddingStore() {
    return new InMemoryEmbeddingStore<>();
  }
}
