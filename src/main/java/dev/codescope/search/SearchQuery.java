package dev.codescope.search;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Immutable code-search request: query text, optional filters, result limits and per-request
 * toggles.
 *
 * <p>Filter fields narrow the candidate set at the sources:
 *
 * <ul>
 *   <li>{@code language} - exact match on the chunk language tag
 *   <li>{@code chunkKind} - exact match on the chunk kind
 *   <li>{@code filePath} - exact match on the owning file path
 * </ul>
 *
 * <p>Toggles left null fall back to the global configuration ({@code codescope.search.*}).
 *
 * @param query the search text (must not be null or blank)
 * @param language optional language filter
 * @param chunkKind optional chunk kind filter
 * @param filePath optional file path filter
 * @param limit maximum number of results (must be >= 1)
 * @param threshold minimum dense similarity score, in [0.0, 1.0]
 * @param hybrid per-request hybrid fusion toggle (null = configured default)
 * @param rerank per-request reranking toggle (null = configured default)
 * @param rerankTimeout per-request rerank time budget override (null = configured default)
 * @param maxPerFile per-file result cap (null = configured default)
 * @param preferFunctions boost function chunks
 * @param preferClasses boost class chunks
 * @param preferImplementation boost implementation files over documentation files
 */
public record SearchQuery(
    String query,
    @Nullable String language,
    @Nullable ChunkKind chunkKind,
    @Nullable String filePath,
    int limit,
    double threshold,
    @Nullable Boolean hybrid,
    @Nullable Boolean rerank,
    @Nullable Duration rerankTimeout,
    @Nullable Integer maxPerFile,
    boolean preferFunctions,
    boolean preferClasses,
    boolean preferImplementation) {

  /** Default number of results when not specified. */
  public static final int DEFAULT_LIMIT = 10;

  /** Default minimum similarity threshold when not specified. */
  public static final double DEFAULT_THRESHOLD = 0.7;

  /** Compact constructor validating input and normalising blank filters to null. */
  public SearchQuery {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("threshold must be in [0.0, 1.0], got: " + threshold);
    }
    if (maxPerFile != null && maxPerFile < 1) {
      throw new IllegalArgumentException("maxPerFile must be at least 1");
    }
    if (rerankTimeout != null && rerankTimeout.isNegative()) {
      throw new IllegalArgumentException("rerankTimeout must not be negative");
    }
    language = blankToNull(language);
    filePath = blankToNull(filePath);
  }

  /** Convenience constructor with default limit, threshold and toggles. */
  public SearchQuery(String query) {
    this(query, DEFAULT_LIMIT);
  }

  /** Convenience constructor with a limit and otherwise default settings. */
  public SearchQuery(String query, int limit) {
    this(
        query, null, null, null, limit, DEFAULT_THRESHOLD, null, null, null, null, false, false,
        true);
  }

  public static Builder builder(String query) {
    return new Builder(query);
  }

  /** Whether the request is scoped to a single file. */
  public boolean isFileScoped() {
    return filePath != null;
  }

  /** Returns a copy of this query with a different result limit. */
  public SearchQuery withLimit(int newLimit) {
    return new SearchQuery(
        query,
        language,
        chunkKind,
        filePath,
        newLimit,
        threshold,
        hybrid,
        rerank,
        rerankTimeout,
        maxPerFile,
        preferFunctions,
        preferClasses,
        preferImplementation);
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  /** Fluent builder for queries that set more than the text and limit. */
  public static final class Builder {

    private final String query;
    private @Nullable String language;
    private @Nullable ChunkKind chunkKind;
    private @Nullable String filePath;
    private int limit = DEFAULT_LIMIT;
    private double threshold = DEFAULT_THRESHOLD;
    private @Nullable Boolean hybrid;
    private @Nullable Boolean rerank;
    private @Nullable Duration rerankTimeout;
    private @Nullable Integer maxPerFile;
    private boolean preferFunctions;
    private boolean preferClasses;
    private boolean preferImplementation = true;

    private Builder(String query) {
      this.query = query;
    }

    public Builder language(@Nullable String language) {
      this.language = language;
      return this;
    }

    public Builder chunkKind(@Nullable ChunkKind chunkKind) {
      this.chunkKind = chunkKind;
      return this;
    }

    public Builder filePath(@Nullable String filePath) {
      this.filePath = filePath;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder threshold(double threshold) {
      this.threshold = threshold;
      return this;
    }

    public Builder hybrid(@Nullable Boolean hybrid) {
      this.hybrid = hybrid;
      return this;
    }

    public Builder rerank(@Nullable Boolean rerank) {
      this.rerank = rerank;
      return this;
    }

    public Builder rerankTimeout(@Nullable Duration rerankTimeout) {
      this.rerankTimeout = rerankTimeout;
      return this;
    }

    public Builder maxPerFile(@Nullable Integer maxPerFile) {
      this.maxPerFile = maxPerFile;
      return this;
    }

    public Builder preferFunctions(boolean preferFunctions) {
      this.preferFunctions = preferFunctions;
      return this;
    }

    public Builder preferClasses(boolean preferClasses) {
      this.preferClasses = preferClasses;
      return this;
    }

    public Builder preferImplementation(boolean preferImplementation) {
      this.preferImplementation = preferImplementation;
      return this;
    }

    public SearchQuery build() {
      return new SearchQuery(
          query,
          language,
          chunkKind,
          filePath,
          limit,
          threshold,
          hybrid,
          rerank,
          rerankTimeout,
          maxPerFile,
          preferFunctions,
          preferClasses,
          preferImplementation);
    }
  }
}
