package dev.codescope.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code codescope.search.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code alpha} - weight for dense scores in hybrid fusion (0.0 = keyword only, 1.0 = dense
 *       only; default 0.7)
 *   <li>{@code hybrid-enabled} - global hybrid fusion switch (default true)
 *   <li>{@code rerank-enabled} - global reranking switch (default true)
 *   <li>{@code rerank-timeout} - per-request time budget after which reranking is skipped or
 *       abandoned (default 45s)
 *   <li>{@code dense-timeout} / {@code keyword-timeout} - per-call timeouts for the external
 *       sources (default 10s each)
 *   <li>{@code rerank-candidates} - shortlist size sent to the reranker (default 10, bounded [2,
 *       50])
 *   <li>{@code max-per-file} - default per-file result cap (default 3)
 *   <li>{@code adaptive-alpha} - shift alpha by query shape (default false)
 *   <li>{@code executor-pool-size} - threads for the dense and keyword calls (default 6)
 *   <li>{@code rerank-pool-size} / {@code rerank-queue-capacity} - reranker threads and their
 *       bounded backlog (default 2 / 8); a full backlog skips reranking
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "codescope.search")
public class SearchProperties {

  private double alpha = 0.7;
  private boolean hybridEnabled = true;
  private boolean rerankEnabled = true;
  private Duration rerankTimeout = Duration.ofSeconds(45);
  private Duration denseTimeout = Duration.ofSeconds(10);
  private Duration keywordTimeout = Duration.ofSeconds(10);
  private int rerankCandidates = 10;
  private int maxPerFile = 3;
  private boolean adaptiveAlpha = false;
  private int executorPoolSize = 6;
  private int rerankPoolSize = 2;
  private int rerankQueueCapacity = 8;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalStateException(
          "codescope.search.alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (rerankCandidates < 2 || rerankCandidates > 50) {
      throw new IllegalStateException(
          "codescope.search.rerank-candidates must be in [2, 50], got: " + rerankCandidates);
    }
    if (maxPerFile < 1) {
      throw new IllegalStateException(
          "codescope.search.max-per-file must be at least 1, got: " + maxPerFile);
    }
    if (executorPoolSize < 2) {
      throw new IllegalStateException(
          "codescope.search.executor-pool-size must be at least 2, got: " + executorPoolSize);
    }
    if (rerankPoolSize < 1) {
      throw new IllegalStateException(
          "codescope.search.rerank-pool-size must be at least 1, got: " + rerankPoolSize);
    }
    if (rerankQueueCapacity < 0) {
      throw new IllegalStateException(
          "codescope.search.rerank-queue-capacity must not be negative, got: "
              + rerankQueueCapacity);
    }
    requirePositive("rerank-timeout", rerankTimeout);
    requirePositive("dense-timeout", denseTimeout);
    requirePositive("keyword-timeout", keywordTimeout);
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalStateException(
          "codescope.search." + name + " must be positive, got: " + value);
    }
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public boolean isHybridEnabled() {
    return hybridEnabled;
  }

  public void setHybridEnabled(boolean hybridEnabled) {
    this.hybridEnabled = hybridEnabled;
  }

  public boolean isRerankEnabled() {
    return rerankEnabled;
  }

  public void setRerankEnabled(boolean rerankEnabled) {
    this.rerankEnabled = rerankEnabled;
  }

  public Duration getRerankTimeout() {
    return rerankTimeout;
  }

  public void setRerankTimeout(Duration rerankTimeout) {
    this.rerankTimeout = rerankTimeout;
  }

  public Duration getDenseTimeout() {
    return denseTimeout;
  }

  public void setDenseTimeout(Duration denseTimeout) {
    this.denseTimeout = denseTimeout;
  }

  public Duration getKeywordTimeout() {
    return keywordTimeout;
  }

  public void setKeywordTimeout(Duration keywordTimeout) {
    this.keywordTimeout = keywordTimeout;
  }

  public int getRerankCandidates() {
    return rerankCandidates;
  }

  public void setRerankCandidates(int rerankCandidates) {
    this.rerankCandidates = rerankCandidates;
  }

  public int getMaxPerFile() {
    return maxPerFile;
  }

  public void setMaxPerFile(int maxPerFile) {
    this.maxPerFile = maxPerFile;
  }

  public boolean isAdaptiveAlpha() {
    return adaptiveAlpha;
  }

  public void setAdaptiveAlpha(boolean adaptiveAlpha) {
    this.adaptiveAlpha = adaptiveAlpha;
  }

  public int getExecutorPoolSize() {
    return executorPoolSize;
  }

  public void setExecutorPoolSize(int executorPoolSize) {
    this.executorPoolSize = executorPoolSize;
  }

  public int getRerankPoolSize() {
    return rerankPoolSize;
  }

  public void setRerankPoolSize(int rerankPoolSize) {
    this.rerankPoolSize = rerankPoolSize;
  }

  public int getRerankQueueCapacity() {
    return rerankQueueCapacity;
  }

  public void setRerankQueueCapacity(int rerankQueueCapacity) {
    this.rerankQueueCapacity = rerankQueueCapacity;
  }
}
