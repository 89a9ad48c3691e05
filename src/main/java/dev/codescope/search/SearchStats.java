package dev.codescope.search;

import dev.codescope.search.cache.CacheStats;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Pipeline usage counters since start-up or the last {@code clearCaches()}.
 *
 * @param totalQueries searches started
 * @param cacheHits searches answered from the cache
 * @param hybridQueries searches whose dense and keyword results were blended
 * @param rerankedQueries searches whose order came from the reranker
 * @param failedQueries searches that ended with an error
 * @param lastQueryAt start of the most recent search, null if none ran yet
 * @param cache cache statistics
 * @param cacheHitPercentage cache hits as a percentage of total queries
 * @param hybridUsagePercentage hybrid queries as a percentage of total queries
 * @param rerankUsagePercentage reranked queries as a percentage of total queries
 */
public record SearchStats(
    long totalQueries,
    long cacheHits,
    long hybridQueries,
    long rerankedQueries,
    long failedQueries,
    @Nullable Instant lastQueryAt,
    CacheStats cache,
    double cacheHitPercentage,
    double hybridUsagePercentage,
    double rerankUsagePercentage) {

  /** {@code part / total * 100}, rounded to one decimal; 0 when total is 0. */
  static double percentage(long part, long total) {
    return total == 0 ? 0.0 : Math.round(part * 1000.0 / total) / 10.0;
  }
}
