package dev.codescope.mcp;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.CodeReferenceResponse;
import dev.codescope.search.SearchPipeline;
import dev.codescope.search.SearchQuery;
import dev.codescope.search.SearchStats;
import dev.codescope.search.cache.CacheStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the code-search pipeline as tool methods for coding agents.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_code}, {@code search_code_references}, {@code invalidate_file}, {@code
 * clear_caches}, {@code search_statistics}.
 *
 * @see CodeReferenceFormatter
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_LIMIT = 50;

  private final SearchPipeline searchPipeline;
  private final CodeReferenceFormatter formatter;

  public McpToolService(SearchPipeline searchPipeline, CodeReferenceFormatter formatter) {
    this.searchPipeline = searchPipeline;
    this.formatter = formatter;
  }

  /** Hybrid semantic + keyword code search returning ranked chunks. */
  @Tool(
      name = "search_code",
      description =
          "Search the indexed codebase with a natural-language or identifier query. "
              + "Returns ranked code chunks with file paths, line ranges and scores. "
              + "Supports language, chunk kind and file filters.")
  public String searchCode(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Filter by language, e.g. 'typescript'", required = false)
          @Nullable String language,
      @ToolParam(
              description =
                  "Filter by chunk kind: function, class, method, interface, type, module, ...",
              required = false)
          @Nullable String chunkKind,
      @ToolParam(description = "Restrict to one file path", required = false)
          @Nullable String filePath,
      @ToolParam(description = "Minimum similarity (0.0-1.0, default 0.7)", required = false)
          @Nullable Double threshold,
      @ToolParam(description = "Blend keyword results (default: configured)", required = false)
          @Nullable Boolean hybrid,
      @ToolParam(description = "Rerank the top results (default: configured)", required = false)
          @Nullable Boolean rerank) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchQuery searchQuery =
          SearchQuery.builder(query)
              .limit(clampLimit(limit))
              .language(language)
              .chunkKind(parseChunkKind(chunkKind))
              .filePath(filePath)
              .threshold(threshold != null ? threshold : SearchQuery.DEFAULT_THRESHOLD)
              .hybrid(hybrid)
              .rerank(rerank)
              .build();
      List<Candidate> results = searchPipeline.search(searchQuery);
      if (results.isEmpty()) {
        return buildEmptyResultMessage(searchQuery);
      }
      return formatter.formatCandidates(results);
    } catch (Exception e) {
      log.debug("search_code failed", e);
      return "Error searching code: " + e.getMessage();
    }
  }

  /** Search packed into token-budgeted code references. */
  @Tool(
      name = "search_code_references",
      description =
          "Search the codebase and return merged code references that fit a token budget. "
              + "Nearby chunks of the same file are merged; a summary lists what did not fit.")
  public String searchCodeReferences(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Filter by language, e.g. 'typescript'", required = false)
          @Nullable String language,
      @ToolParam(description = "Filter by chunk kind", required = false) @Nullable String chunkKind,
      @ToolParam(description = "Restrict to one file path", required = false)
          @Nullable String filePath,
      @ToolParam(description = "Token budget (default: configured window)", required = false)
          @Nullable Integer tokenBudget) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchQuery searchQuery =
          SearchQuery.builder(query)
              .limit(clampLimit(limit))
              .language(language)
              .chunkKind(parseChunkKind(chunkKind))
              .filePath(filePath)
              .build();
      CodeReferenceResponse response =
          searchPipeline.searchForCodeReferences(searchQuery, tokenBudget);
      if (response.window().references().isEmpty() && !response.window().truncated()) {
        return buildEmptyResultMessage(searchQuery);
      }
      return formatter.formatReferences(response);
    } catch (Exception e) {
      log.debug("search_code_references failed", e);
      return "Error searching code references: " + e.getMessage();
    }
  }

  /** Drops cached results for a file after it changed. */
  @Tool(
      name = "invalidate_file",
      description = "Drop cached search results that mention a file, e.g. after editing it.")
  public String invalidateFile(
      @ToolParam(description = "Path of the changed file") @Nullable String filePath) {
    try {
      if (filePath == null || filePath.isBlank()) {
        return "Error: File path must not be empty.";
      }
      int removed = searchPipeline.invalidateFile(filePath);
      return "Invalidated %d cached %s for %s."
          .formatted(removed, removed == 1 ? "query" : "queries", filePath.trim());
    } catch (Exception e) {
      return "Error invalidating file: " + e.getMessage();
    }
  }

  @Tool(name = "clear_caches", description = "Clear the search cache and reset search statistics.")
  public String clearCaches() {
    try {
      searchPipeline.clearCaches();
      return "Search cache cleared and statistics reset.";
    } catch (Exception e) {
      return "Error clearing caches: " + e.getMessage();
    }
  }

  @Tool(
      name = "search_statistics",
      description =
          "View search statistics: query counts, cache hit rate and size, "
              + "hybrid and rerank usage.")
  public String searchStatistics() {
    try {
      SearchStats stats = searchPipeline.getStats();
      CacheStats cache = stats.cache();
      return String.format(
          Locale.ROOT,
          """
          Search Statistics:
          - Total queries: %,d (failed: %,d)
          - Cache hits: %,d (%.1f%%)
          - Hybrid fusion: %,d (%.1f%%)
          - Reranked: %,d (%.1f%%)
          - Last query: %s
          Cache:
          - Entries: %d/%d (~%s)
          - Hit rate: %.2f (%d hits, %d misses)
          - TTL: %ds""",
          stats.totalQueries(),
          stats.failedQueries(),
          stats.cacheHits(),
          stats.cacheHitPercentage(),
          stats.hybridQueries(),
          stats.hybridUsagePercentage(),
          stats.rerankedQueries(),
          stats.rerankUsagePercentage(),
          stats.lastQueryAt() != null ? stats.lastQueryAt().toString() : "never",
          cache.size(),
          cache.maxSize(),
          formatBytes(cache.memoryEstimateBytes()),
          cache.hitRate(),
          cache.hitCount(),
          cache.missCount(),
          cache.ttl().toSeconds());
    } catch (Exception e) {
      return "Error retrieving search statistics: " + e.getMessage();
    }
  }

  private static int clampLimit(@Nullable Integer limit) {
    if (limit == null || limit < 1) {
      return SearchQuery.DEFAULT_LIMIT;
    }
    return Math.min(limit, MAX_LIMIT);
  }

  private static @Nullable ChunkKind parseChunkKind(@Nullable String chunkKind) {
    if (chunkKind == null || chunkKind.isBlank()) {
      return null;
    }
    return ChunkKind.fromValue(chunkKind.trim());
  }

  private static String formatBytes(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    double kb = bytes / 1024.0;
    if (kb < 1024) {
      return String.format(Locale.ROOT, "%.1f KB", kb);
    }
    return String.format(Locale.ROOT, "%.1f MB", kb / 1024.0);
  }

  private static String buildEmptyResultMessage(SearchQuery query) {
    List<String> activeFilters = new ArrayList<>();
    if (query.language() != null) {
      activeFilters.add("language='" + query.language() + "'");
    }
    if (query.chunkKind() != null) {
      activeFilters.add("chunkKind='" + query.chunkKind().value() + "'");
    }
    if (query.filePath() != null) {
      activeFilters.add("filePath='" + query.filePath() + "'");
    }
    if (activeFilters.isEmpty()) {
      return "No results found for query: " + query.query();
    }
    return ("No results for query '%s' with filters [%s]. "
            + "Try removing a filter or lowering the threshold.")
        .formatted(query.query(), String.join(", ", activeFilters));
  }
}
