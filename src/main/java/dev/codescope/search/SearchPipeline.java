package dev.codescope.search;

import dev.codescope.search.cache.QueryCache;
import dev.codescope.search.context.ContextAssembler;
import dev.codescope.search.context.ContextWindow;
import dev.codescope.search.fusion.FusionOutcome;
import dev.codescope.search.fusion.ResultFusionEngine;
import dev.codescope.search.optimize.ContextOptimizer;
import dev.codescope.search.optimize.OptimizationPreferences;
import dev.codescope.search.rerank.RerankOrchestrator;
import dev.codescope.search.rerank.RerankOutcome;
import dev.codescope.search.source.DenseSearchSource;
import dev.codescope.search.source.KeywordSearchSource;
import dev.codescope.search.source.QueryEmbedder;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: cache check, concurrent dense and keyword retrieval, fusion,
 * optimisation, optional reranking, then cache store.
 *
 * <p>Pipeline: look up the query fingerprint in {@link QueryCache} -> embed the query and run the
 * dense search while the keyword search runs alongside on the search executor, each under its
 * own timeout -> {@link ResultFusionEngine} -> {@link ContextOptimizer} -> {@link
 * RerankOrchestrator} under the request deadline -> cap to the query limit -> cache if admitted.
 *
 * <p>Failures of the embedding model or either source abort the request with a {@link
 * SearchException} naming the stage. Reranking failures never do.
 */
@Service
public class SearchPipeline {

  private static final Logger log = LoggerFactory.getLogger(SearchPipeline.class);

  /** Minimum candidate count fetched when assembling code references. */
  static final int REFERENCE_MIN_LIMIT = 20;

  /** Threshold used by {@link #searchInFile}; a single file has few chunks to choose from. */
  static final double FILE_SCOPED_THRESHOLD = 0.6;

  private final QueryCache queryCache;
  private final QueryEmbedder queryEmbedder;
  private final DenseSearchSource denseSearchSource;
  private final Optional<KeywordSearchSource> keywordSearchSource;
  private final ResultFusionEngine fusionEngine;
  private final ContextOptimizer contextOptimizer;
  private final RerankOrchestrator rerankOrchestrator;
  private final ContextAssembler contextAssembler;
  private final SearchProperties searchProperties;
  private final ExecutorService searchExecutor;
  private final Clock clock;

  private final AtomicLong totalQueries = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong hybridQueries = new AtomicLong();
  private final AtomicLong rerankedQueries = new AtomicLong();
  private final AtomicLong failedQueries = new AtomicLong();
  private final AtomicReference<Instant> lastQueryAt = new AtomicReference<>();

  public SearchPipeline(
      QueryCache queryCache,
      QueryEmbedder queryEmbedder,
      DenseSearchSource denseSearchSource,
      Optional<KeywordSearchSource> keywordSearchSource,
      ResultFusionEngine fusionEngine,
      ContextOptimizer contextOptimizer,
      RerankOrchestrator rerankOrchestrator,
      ContextAssembler contextAssembler,
      SearchProperties searchProperties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor,
      Clock clock) {
    this.queryCache = queryCache;
    this.queryEmbedder = queryEmbedder;
    this.denseSearchSource = denseSearchSource;
    this.keywordSearchSource = keywordSearchSource;
    this.fusionEngine = fusionEngine;
    this.contextOptimizer = contextOptimizer;
    this.rerankOrchestrator = rerankOrchestrator;
    this.contextAssembler = contextAssembler;
    this.searchProperties = searchProperties;
    this.searchExecutor = searchExecutor;
    this.clock = clock;
  }

  /**
   * Runs the full pipeline.
   *
   * @param query the search request
   * @return at most {@code query.limit()} candidates, best first
   * @throws SearchException if the embedding model or a source fails or times out
   */
  public List<Candidate> search(SearchQuery query) {
    return execute(query).results();
  }

  /**
   * Runs the pipeline with at least {@value #REFERENCE_MIN_LIMIT} candidates and packs them into a
   * token-budgeted window.
   *
   * @param query the search request
   * @param tokenBudget the window budget, or null for the configured default
   * @return the window plus metadata describing this request
   */
  public CodeReferenceResponse searchForCodeReferences(
      SearchQuery query, @Nullable Integer tokenBudget) {
    if (tokenBudget != null && tokenBudget <= 0) {
      throw new IllegalArgumentException("tokenBudget must be positive, got: " + tokenBudget);
    }
    Instant start = clock.instant();
    SearchQuery widened = query.withLimit(Math.max(query.limit(), REFERENCE_MIN_LIMIT));
    Execution execution = execute(widened);

    ContextWindow window =
        tokenBudget != null
            ? contextAssembler.assemble(execution.results(), tokenBudget)
            : contextAssembler.assemble(execution.results());
    long elapsedMs = Duration.between(start, clock.instant()).toMillis();
    return new CodeReferenceResponse(
        window,
        new SearchMetadata(
            execution.results().size(),
            elapsedMs,
            execution.cacheHit(),
            execution.hybridUsed(),
            execution.reranked()));
  }

  /** Function chunks only. */
  public List<Candidate> searchFunctions(String query, @Nullable String language, int limit) {
    return search(
        SearchQuery.builder(query)
            .chunkKind(ChunkKind.FUNCTION)
            .language(language)
            .limit(limit)
            .build());
  }

  /** Class chunks only. */
  public List<Candidate> searchClasses(String query, @Nullable String language, int limit) {
    return search(
        SearchQuery.builder(query)
            .chunkKind(ChunkKind.CLASS)
            .language(language)
            .limit(limit)
            .build());
  }

  /** Chunks of one file, with a lower similarity threshold. Never cached. */
  public List<Candidate> searchInFile(String query, String filePath, int limit) {
    if (filePath == null || filePath.isBlank()) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    return search(
        SearchQuery.builder(query)
            .filePath(filePath)
            .threshold(FILE_SCOPED_THRESHOLD)
            .limit(limit)
            .build());
  }

  /** Chunks of one language. */
  public List<Candidate> searchByLanguage(String query, String language, int limit) {
    if (language == null || language.isBlank()) {
      throw new IllegalArgumentException("language must not be blank");
    }
    return search(SearchQuery.builder(query).language(language).limit(limit).build());
  }

  /**
   * Drops cached results that mention a file.
   *
   * @return the number of removed cache entries
   */
  public int invalidateFile(String filePath) {
    if (filePath == null || filePath.isBlank()) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    return queryCache.invalidateByFile(filePath.trim());
  }

  /**
   * Drops cached results that mention a language.
   *
   * @return the number of removed cache entries
   */
  public int invalidateLanguage(String language) {
    if (language == null || language.isBlank()) {
      throw new IllegalArgumentException("language must not be blank");
    }
    return queryCache.invalidateByLanguage(language.trim());
  }

  /** Empties the cache and resets every counter. */
  public void clearCaches() {
    queryCache.clear();
    totalQueries.set(0);
    cacheHits.set(0);
    hybridQueries.set(0);
    rerankedQueries.set(0);
    failedQueries.set(0);
    lastQueryAt.set(null);
    log.info("Search caches and statistics cleared");
  }

  public SearchStats getStats() {
    long total = totalQueries.get();
    long hits = cacheHits.get();
    long hybrid = hybridQueries.get();
    long reranked = rerankedQueries.get();
    return new SearchStats(
        total,
        hits,
        hybrid,
        reranked,
        failedQueries.get(),
        lastQueryAt.get(),
        queryCache.stats(),
        SearchStats.percentage(hits, total),
        SearchStats.percentage(hybrid, total),
        SearchStats.percentage(reranked, total));
  }

  private Execution execute(SearchQuery query) {
    totalQueries.incrementAndGet();
    lastQueryAt.set(clock.instant());

    Optional<List<Candidate>> cached = queryCache.get(query);
    if (cached.isPresent()) {
      cacheHits.incrementAndGet();
      List<Candidate> results = cap(cached.get(), query.limit());
      log.debug("Returning {} cached results for '{}'", results.size(), query.query());
      return new Execution(results, true, false, false);
    }

    try {
      return executeUncached(query);
    } catch (RuntimeException e) {
      failedQueries.incrementAndGet();
      log.warn("Search for '{}' failed: {}", query.query(), e.getMessage());
      throw e;
    }
  }

  private Execution executeUncached(SearchQuery query) {
    SearchDeadline deadline = SearchDeadline.start(clock, rerankBudget(query));

    Future<List<Candidate>> dense = submit(() -> denseSearch(query), SearchStage.DENSE_SEARCH);
    Future<List<Candidate>> sparse;
    try {
      sparse = keywordSearch(query);
    } catch (SearchException e) {
      dense.cancel(true);
      throw e;
    }

    List<Candidate> denseResults;
    List<Candidate> sparseResults;
    try {
      denseResults = await(dense, searchProperties.getDenseTimeout(), SearchStage.DENSE_SEARCH);
      sparseResults =
          await(sparse, searchProperties.getKeywordTimeout(), SearchStage.KEYWORD_SEARCH);
    } catch (SearchException e) {
      dense.cancel(true);
      sparse.cancel(true);
      throw e;
    }

    FusionOutcome fusion = fusionEngine.fuse(query, denseResults, sparseResults);
    if (fusion.hybridUsed()) {
      hybridQueries.incrementAndGet();
    }

    List<Candidate> optimized =
        contextOptimizer.optimize(
            fusion.results(),
            OptimizationPreferences.forQuery(query, searchProperties.getMaxPerFile()));

    RerankOutcome rerank = rerankOrchestrator.rerank(query, optimized, deadline);
    if (rerank.reranked()) {
      rerankedQueries.incrementAndGet();
    }

    List<Candidate> results = cap(rerank.results(), query.limit());
    if (queryCache.shouldCache(query, results)) {
      queryCache.put(query, results);
    }

    log.info(
        "Search '{}' returned {} results in {} ms (dense={}, keyword={}, hybrid={}, reranked={})",
        query.query(),
        results.size(),
        deadline.elapsed().toMillis(),
        denseResults.size(),
        sparseResults.size(),
        fusion.hybridUsed(),
        rerank.reranked());
    return new Execution(results, false, fusion.hybridUsed(), rerank.reranked());
  }

  private List<Candidate> denseSearch(SearchQuery query) {
    Embedding embedding;
    try {
      embedding = queryEmbedder.embedQuery(query.query());
    } catch (RuntimeException e) {
      throw new SearchException(SearchStage.EMBEDDING, describe(e), e);
    }
    try {
      return denseSearchSource.search(query, embedding);
    } catch (RuntimeException e) {
      throw new SearchException(SearchStage.DENSE_SEARCH, describe(e), e);
    }
  }

  /** Keyword results are only fetched when a source exists and fusion may use them. */
  private Future<List<Candidate>> keywordSearch(SearchQuery query) {
    boolean hybridEnabled =
        query.hybrid() != null ? query.hybrid() : searchProperties.isHybridEnabled();
    if (keywordSearchSource.isEmpty() || !hybridEnabled) {
      return CompletableFuture.completedFuture(List.of());
    }
    KeywordSearchSource source = keywordSearchSource.get();
    return submit(
        () -> {
          try {
            return source.search(query, query.limit());
          } catch (RuntimeException e) {
            throw new SearchException(SearchStage.KEYWORD_SEARCH, describe(e), e);
          }
        },
        SearchStage.KEYWORD_SEARCH);
  }

  /** Submitted tasks are interrupted when their caller gives up on them. */
  private Future<List<Candidate>> submit(Callable<List<Candidate>> task, SearchStage stage) {
    try {
      return searchExecutor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new SearchException(stage, "search executor rejected the call", e);
    }
  }

  private static List<Candidate> await(
      Future<List<Candidate>> future, Duration timeout, SearchStage stage) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new SearchException(stage, "timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof SearchException searchException) {
        throw searchException;
      }
      throw new SearchException(stage, describe(cause), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new SearchException(stage, "interrupted", e);
    }
  }

  private Duration rerankBudget(SearchQuery query) {
    return query.rerankTimeout() != null
        ? query.rerankTimeout()
        : searchProperties.getRerankTimeout();
  }

  private static List<Candidate> cap(List<Candidate> results, int limit) {
    return results.size() <= limit ? results : List.copyOf(results.subList(0, limit));
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private record Execution(
      List<Candidate> results, boolean cacheHit, boolean hybridUsed, boolean reranked) {}
}
