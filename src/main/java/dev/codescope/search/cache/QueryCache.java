package dev.codescope.search.cache;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchQuery;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Time- and capacity-bounded cache of search results keyed by {@link QueryFingerprint}.
 *
 * <p>Entries older than the configured TTL are never served. At capacity the entry with the
 * oldest creation time is evicted (insertion order; lookups do not refresh an entry). A
 * background sweep started by {@link #start()} drops expired entries every TTL period on the
 * injected {@link TaskScheduler}.
 *
 * <p>All operations, including the sweep, serialise on the instance monitor.
 */
@Component
public class QueryCache {

  private static final Logger log = LoggerFactory.getLogger(QueryCache.class);

  /** Assumed footprint of one entry, used for the rough memory estimate. */
  static final long ESTIMATED_ENTRY_BYTES = 1024;

  static final int MIN_CACHEABLE_QUERY_LENGTH = 3;

  private final CacheProperties properties;
  private final Clock clock;
  private final TaskScheduler sweepScheduler;
  private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

  private long hitCount;
  private long missCount;
  private @Nullable ScheduledFuture<?> sweep;

  public QueryCache(
      CacheProperties properties,
      Clock clock,
      @Qualifier("cacheSweepScheduler") TaskScheduler sweepScheduler) {
    this.properties = properties;
    this.clock = clock;
    this.sweepScheduler = sweepScheduler;
  }

  /** Schedules the periodic expiry sweep. Calling it twice is a no-op. */
  @PostConstruct
  public synchronized void start() {
    if (sweep != null) {
      return;
    }
    Duration period = properties.getTtl();
    Instant firstRun = sweepScheduler.getClock().instant().plus(period);
    sweep = sweepScheduler.scheduleAtFixedRate(this::evictExpired, firstRun, period);
    log.debug("Query cache sweep scheduled every {}", properties.getTtl());
  }

  /** Cancels the periodic sweep. Entries are kept. */
  @PreDestroy
  public synchronized void stop() {
    if (sweep != null) {
      sweep.cancel(false);
      sweep = null;
      log.debug("Query cache sweep stopped");
    }
  }

  synchronized boolean isSweeping() {
    return sweep != null;
  }

  /**
   * Looks up the cached results of a query.
   *
   * @param query the query
   * @return the cached results, or empty on a miss or an expired entry
   */
  public synchronized Optional<List<Candidate>> get(SearchQuery query) {
    String fingerprint = QueryFingerprint.of(query);
    CacheEntry entry = entries.get(fingerprint);
    if (entry == null) {
      missCount++;
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant(), properties.getTtl())) {
      entries.remove(fingerprint);
      missCount++;
      return Optional.empty();
    }
    hitCount++;
    return Optional.of(entry.results());
  }

  /**
   * Stores the results of a query. Empty lists and lists longer than {@code
   * max-cacheable-results} are ignored.
   */
  public synchronized void put(SearchQuery query, List<Candidate> results) {
    if (results.isEmpty() || results.size() > properties.getMaxCacheableResults()) {
      return;
    }
    String fingerprint = QueryFingerprint.of(query);
    if (!entries.containsKey(fingerprint) && entries.size() >= properties.getMaxEntries()) {
      evictOldest();
    }
    // re-insert so a replaced entry moves to the end of the insertion order
    entries.remove(fingerprint);
    entries.put(
        fingerprint,
        new CacheEntry(
            fingerprint,
            query.query(),
            results,
            clock.instant(),
            CacheEntry.FilterTags.of(query)));
  }

  /**
   * Admission policy applied by the pipeline before {@link #put}: file-scoped queries, empty or
   * oversized result lists and very short query texts are not cached.
   */
  public boolean shouldCache(SearchQuery query, List<Candidate> results) {
    if (query.isFileScoped()) {
      return false;
    }
    if (results.isEmpty() || results.size() > properties.getMaxCacheableResults()) {
      return false;
    }
    return query.query().trim().length() >= MIN_CACHEABLE_QUERY_LENGTH;
  }

  /**
   * Removes entries that contain a result from the given file or were filtered to it.
   *
   * @return the number of removed entries
   */
  public int invalidateByFile(String filePath) {
    int removed = removeIf(entry -> entry.referencesFile(filePath));
    if (removed > 0) {
      log.info("Invalidated {} cached queries for file {}", removed, filePath);
    }
    return removed;
  }

  /**
   * Removes entries filtered to the given language or containing a result in it.
   *
   * @return the number of removed entries
   */
  public int invalidateByLanguage(String language) {
    int removed = removeIf(entry -> entry.referencesLanguage(language));
    if (removed > 0) {
      log.info("Invalidated {} cached queries for language {}", removed, language);
    }
    return removed;
  }

  /** Removes every entry and resets the hit and miss counters. */
  public synchronized void clear() {
    int size = entries.size();
    entries.clear();
    hitCount = 0;
    missCount = 0;
    log.info("Query cache cleared ({} entries)", size);
  }

  /**
   * Removes expired entries.
   *
   * @return the number of removed entries
   */
  public int evictExpired() {
    Instant now = clock.instant();
    Duration ttl = properties.getTtl();
    int removed = removeIf(entry -> entry.isExpired(now, ttl));
    if (removed > 0) {
      log.debug("Query cache sweep removed {} expired entries", removed);
    }
    return removed;
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized CacheStats stats() {
    long lookups = hitCount + missCount;
    double hitRate = lookups == 0 ? 0.0 : Math.round(hitCount * 100.0 / lookups) / 100.0;
    return new CacheStats(
        entries.size(),
        properties.getMaxEntries(),
        hitCount,
        missCount,
        hitRate,
        properties.getTtl(),
        entries.size() * ESTIMATED_ENTRY_BYTES);
  }

  /** Debug listing of the current entries, newest first. */
  public synchronized List<CacheEntrySummary> entries() {
    Instant now = clock.instant();
    List<CacheEntrySummary> summaries = new ArrayList<>(entries.size());
    for (CacheEntry entry : entries.values()) {
      summaries.add(
          new CacheEntrySummary(
              entry.fingerprint(),
              entry.queryText(),
              entry.results().size(),
              Duration.between(entry.createdAt(), now).toSeconds(),
              entry.filterTags().language(),
              entry.filterTags().chunkKind(),
              entry.filterTags().filePath()));
    }
    Collections.reverse(summaries);
    return summaries;
  }

  private synchronized int removeIf(Predicate<CacheEntry> predicate) {
    int removed = 0;
    Iterator<CacheEntry> iterator = entries.values().iterator();
    while (iterator.hasNext()) {
      if (predicate.test(iterator.next())) {
        iterator.remove();
        removed++;
      }
    }
    return removed;
  }

  private void evictOldest() {
    CacheEntry oldest = null;
    for (CacheEntry entry : entries.values()) {
      if (oldest == null || entry.createdAt().isBefore(oldest.createdAt())) {
        oldest = entry;
      }
    }
    if (oldest != null) {
      entries.remove(oldest.fingerprint());
      log.debug("Query cache at capacity, evicted oldest entry {}", oldest.fingerprint());
    }
  }
}
