package dev.codescope.search.cache;

import dev.codescope.search.ChunkKind;
import org.jspecify.annotations.Nullable;

/**
 * Debug view of a cache entry, without the cached results themselves.
 *
 * @param fingerprint the cache key
 * @param queryText the query text that produced the entry
 * @param resultCount number of cached results
 * @param ageSeconds age of the entry in whole seconds
 * @param language language filter of the originating query
 * @param chunkKind chunk kind filter of the originating query
 * @param filePath file path filter of the originating query
 */
public record CacheEntrySummary(
    String fingerprint,
    String queryText,
    int resultCount,
    long ageSeconds,
    @Nullable String language,
    @Nullable ChunkKind chunkKind,
    @Nullable String filePath) {}
