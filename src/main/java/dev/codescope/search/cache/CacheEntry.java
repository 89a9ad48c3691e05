package dev.codescope.search.cache;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.SearchQuery;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An immutable cached result list.
 *
 * @param fingerprint the cache key
 * @param queryText the original query text, kept for debugging listings
 * @param results the cached results (unmodifiable)
 * @param createdAt the instant the entry was inserted
 * @param filterTags the filters of the query that produced the results
 */
record CacheEntry(
    String fingerprint,
    String queryText,
    List<Candidate> results,
    Instant createdAt,
    FilterTags filterTags) {

  CacheEntry {
    results = List.copyOf(results);
  }

  /** An entry is expired once its age reaches the TTL. */
  boolean isExpired(Instant now, Duration ttl) {
    return Duration.between(createdAt, now).compareTo(ttl) >= 0;
  }

  boolean referencesFile(String path) {
    return path.equals(filterTags.filePath())
        || results.stream().anyMatch(c -> c.filePath().equals(path));
  }

  boolean referencesLanguage(String language) {
    return language.equals(filterTags.language())
        || results.stream().anyMatch(c -> c.language().equals(language));
  }

  /**
   * Filters of the query that produced a cache entry.
   *
   * @param language the language filter, if any
   * @param chunkKind the chunk kind filter, if any
   * @param filePath the file path filter, if any
   */
  record FilterTags(
      @Nullable String language, @Nullable ChunkKind chunkKind, @Nullable String filePath) {

    static FilterTags of(SearchQuery query) {
      return new FilterTags(query.language(), query.chunkKind(), query.filePath());
    }
  }
}
