package dev.codescope.config;

import dev.codescope.search.rerank.CrossEncoderReranker;
import dev.codescope.search.rerank.DisabledReranker;
import dev.codescope.search.rerank.Reranker;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link Reranker}: a cross-encoder over the in-process ONNX {@link ScoringModel} when a
 * model is configured, otherwise a disabled stand-in so the pipeline runs without reranking.
 */
@Configuration
public class RerankerConfig {

  private static final Logger log = LoggerFactory.getLogger(RerankerConfig.class);

  /**
   * Provides the in-process ONNX cross-encoder scoring model (e.g. ms-marco-MiniLM-L-6-v2).
   *
   * @param properties model and tokenizer locations
   * @return a ready-to-use scoring model for cross-encoder reranking
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "codescope.reranker", name = "model-path")
  public ScoringModel scoringModel(RerankerProperties properties) {
    return new OnnxScoringModel(properties.getModelPath(), properties.getTokenizerPath());
  }

  @Bean
  @ConditionalOnMissingBean
  public Reranker reranker(
      ObjectProvider<ScoringModel> scoringModel, RerankerProperties properties) {
    ScoringModel model = scoringModel.getIfAvailable();
    if (model == null) {
      log.info("No reranker model configured, reranking disabled");
      return new DisabledReranker();
    }
    log.info("Cross-encoder reranker ready (enabled={})", properties.isEnabled());
    return new CrossEncoderReranker(model, properties.isEnabled());
  }
}
