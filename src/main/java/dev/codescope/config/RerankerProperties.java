package dev.codescope.config;

import jakarta.annotation.PostConstruct;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-encoder reranker model, bound from {@code codescope.reranker.*}.
 *
 * <p>Reranking is only available when {@code model-path} is set; {@code tokenizer-path} is then
 * required as well.
 */
@Configuration
@ConfigurationProperties(prefix = "codescope.reranker")
public class RerankerProperties {

  private boolean enabled = true;
  private @Nullable String modelPath;
  private @Nullable String tokenizerPath;

  @PostConstruct
  void validate() {
    if (isConfigured() && (tokenizerPath == null || tokenizerPath.isBlank())) {
      throw new IllegalStateException(
          "codescope.reranker.tokenizer-path is required when model-path is set");
    }
  }

  public boolean isConfigured() {
    return modelPath != null && !modelPath.isBlank();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public @Nullable String getModelPath() {
    return modelPath;
  }

  public void setModelPath(@Nullable String modelPath) {
    this.modelPath = modelPath;
  }

  public @Nullable String getTokenizerPath() {
    return tokenizerPath;
  }

  public void setTokenizerPath(@Nullable String tokenizerPath) {
    this.tokenizerPath = tokenizerPath;
  }
}
