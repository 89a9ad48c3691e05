package dev.codescope.search.context;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Token budget of the downstream consumer, bound from {@code codescope.context.*}. The default
 * assembly budget is the window size minus the tokens reserved for the consumer's own prompt.
 */
@Configuration
@ConfigurationProperties(prefix = "codescope.context")
public class ContextProperties {

  private int windowSize = 32000;
  private int reservedTokens = 2000;

  @PostConstruct
  void validate() {
    if (reservedTokens < 0) {
      throw new IllegalStateException(
          "codescope.context.reserved-tokens must not be negative, got: " + reservedTokens);
    }
    if (windowSize <= reservedTokens) {
      throw new IllegalStateException(
          "codescope.context.window-size ("
              + windowSize
              + ") must exceed reserved-tokens ("
              + reservedTokens
              + ")");
    }
  }

  public int defaultTokenBudget() {
    return windowSize - reservedTokens;
  }

  public int getWindowSize() {
    return windowSize;
  }

  public void setWindowSize(int windowSize) {
    this.windowSize = windowSize;
  }

  public int getReservedTokens() {
    return reservedTokens;
  }

  public void setReservedTokens(int reservedTokens) {
    this.reservedTokens = reservedTokens;
  }
}
