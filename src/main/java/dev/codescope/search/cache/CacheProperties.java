package dev.codescope.search.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the query result cache, bound from {@code codescope.cache.*}.
 *
 * <ul>
 *   <li>{@code ttl} - lifetime of a cached result list; also the sweep period (default 300s)
 *   <li>{@code max-entries} - capacity before the oldest entry is evicted (default 1000)
 *   <li>{@code max-cacheable-results} - result lists longer than this are never cached (default
 *       100)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "codescope.cache")
public class CacheProperties {

  private Duration ttl = Duration.ofSeconds(300);
  private int maxEntries = 1000;
  private int maxCacheableResults = 100;

  @PostConstruct
  void validate() {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalStateException("codescope.cache.ttl must be positive, got: " + ttl);
    }
    if (maxEntries < 1) {
      throw new IllegalStateException(
          "codescope.cache.max-entries must be at least 1, got: " + maxEntries);
    }
    if (maxCacheableResults < 1) {
      throw new IllegalStateException(
          "codescope.cache.max-cacheable-results must be at least 1, got: "
              + maxCacheableResults);
    }
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(int maxEntries) {
    this.maxEntries = maxEntries;
  }

  public int getMaxCacheableResults() {
    return maxCacheableResults;
  }

  public void setMaxCacheableResults(int maxCacheableResults) {
    this.maxCacheableResults = maxCacheableResults;
  }
}
