package dev.codescope.search.cache;

import java.time.Duration;

/**
 * Point-in-time cache statistics.
 *
 * @param size current number of entries
 * @param maxSize configured capacity
 * @param hitCount lookups answered from the cache
 * @param missCount lookups that found nothing or an expired entry
 * @param hitRate hits / (hits + misses), rounded to two decimals; 0 when no lookups happened
 * @param ttl configured entry lifetime
 * @param memoryEstimateBytes rough footprint (entries x assumed per-entry size)
 */
public record CacheStats(
    int size,
    int maxSize,
    long hitCount,
    long missCount,
    double hitRate,
    Duration ttl,
    long memoryEstimateBytes) {}
