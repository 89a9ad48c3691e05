package dev.codescope.search.optimize;

import dev.codescope.search.ChunkKind;
import dev.codescope.search.SearchQuery;

/**
 * Reshaping options for {@link ContextOptimizer#optimize}.
 *
 * @param preferFunctions boost function chunks
 * @param preferClasses boost class chunks
 * @param maxPerFile per-file cap, must be at least 1
 * @param diversifyLanguages cap each language group to its share of the list
 */
public record OptimizationPreferences(
    boolean preferFunctions, boolean preferClasses, int maxPerFile, boolean diversifyLanguages) {

  public OptimizationPreferences {
    if (maxPerFile < 1) {
      throw new IllegalArgumentException("maxPerFile must be at least 1");
    }
  }

  /**
   * Derives the preferences of a query. A chunk kind filter of {@code function} or {@code class}
   * implies the matching preference; languages are only diversified when no language filter is
   * set.
   *
   * @param query the query
   * @param defaultMaxPerFile per-file cap used when the query does not set one
   */
  public static OptimizationPreferences forQuery(SearchQuery query, int defaultMaxPerFile) {
    return new OptimizationPreferences(
        query.preferFunctions() || query.chunkKind() == ChunkKind.FUNCTION,
        query.preferClasses() || query.chunkKind() == ChunkKind.CLASS,
        query.maxPerFile() != null ? query.maxPerFile() : defaultMaxPerFile,
        query.language() == null);
  }
}
