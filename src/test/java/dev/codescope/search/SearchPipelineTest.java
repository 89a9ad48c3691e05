package dev.codescope.search;

import static dev.codescope.fixture.CandidateBuilder.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.codescope.fixture.MutableClock;
import dev.codescope.search.cache.CacheProperties;
import dev.codescope.search.cache.QueryCache;
import dev.codescope.search.context.ContextAssembler;
import dev.codescope.search.context.ContextProperties;
import dev.codescope.search.fusion.ResultFusionEngine;
import dev.codescope.search.optimize.ContextOptimizer;
import dev.codescope.search.rerank.RerankOrchestrator;
import dev.codescope.search.rerank.RerankResponse;
import dev.codescope.search.rerank.RerankedEntry;
import dev.codescope.search.rerank.Reranker;
import dev.codescope.search.source.DenseSearchSource;
import dev.codescope.search.source.KeywordSearchSource;
import dev.codescope.search.source.QueryEmbedder;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class SearchPipelineTest {

  private static final Embedding EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  @Mock QueryEmbedder queryEmbedder;

  @Mock DenseSearchSource denseSearchSource;

  @Mock KeywordSearchSource keywordSearchSource;

  @Mock Reranker reranker;

  @Mock TaskScheduler sweepScheduler;

  @Captor ArgumentCaptor<SearchQuery> queryCaptor;

  private final ExecutorService executor = Executors.newFixedThreadPool(4);
  private final ExecutorService rerankExecutor = Executors.newFixedThreadPool(2);
  private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
  private SearchProperties properties;
  private QueryCache queryCache;
  private SearchPipeline pipeline;

  @BeforeEach
  void setUp() {
    properties = new SearchProperties();
    queryCache = new QueryCache(new CacheProperties(), clock, sweepScheduler);
    pipeline =
        new SearchPipeline(
            queryCache,
            queryEmbedder,
            denseSearchSource,
            Optional.of(keywordSearchSource),
            new ResultFusionEngine(properties),
            new ContextOptimizer(),
            new RerankOrchestrator(reranker, properties, rerankExecutor),
            new ContextAssembler(new ContextProperties()),
            properties,
            executor,
            clock);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    rerankExecutor.shutdownNow();
  }

  @Test
  void servesRepeatedQueryFromCache() {
    stubDense(
        candidate("a").file("src/auth.ts").score(0.8).build(),
        candidate("b").file("src/user.ts").score(0.7).build());
    stubKeywordEmpty();

    List<Candidate> first = pipeline.search(new SearchQuery("token refresh"));
    List<Candidate> second = pipeline.search(new SearchQuery("token refresh"));

    assertThat(second).isEqualTo(first);
    verify(denseSearchSource, times(1)).search(any(), any());
    SearchStats stats = pipeline.getStats();
    assertThat(stats.totalQueries()).isEqualTo(2);
    assertThat(stats.cacheHits()).isEqualTo(1);
    assertThat(stats.cacheHitPercentage()).isEqualTo(50.0);
    assertThat(stats.lastQueryAt()).isEqualTo(clock.instant());
  }

  @Test
  void blendsKeywordResultsWhenAvailable() {
    stubDense(candidate("a").file("src/auth.ts").score(0.8).build());
    given(keywordSearchSource.search(any(), anyInt()))
        .willReturn(List.of(candidate("k").file("src/token.ts").score(0.9).build()));

    List<Candidate> results = pipeline.search(new SearchQuery("token refresh"));

    assertThat(results).extracting(Candidate::chunkId).containsExactlyInAnyOrder("a", "k");
    assertThat(results).allSatisfy(c -> assertThat(c.hybridScore()).isNotNull());
    assertThat(pipeline.getStats().hybridQueries()).isEqualTo(1);
  }

  @Test
  void runsDenseOnlyWithoutKeywordSource() {
    SearchPipeline denseOnly =
        new SearchPipeline(
            queryCache,
            queryEmbedder,
            denseSearchSource,
            Optional.empty(),
            new ResultFusionEngine(properties),
            new ContextOptimizer(),
            new RerankOrchestrator(reranker, properties, rerankExecutor),
            new ContextAssembler(new ContextProperties()),
            properties,
            executor,
            clock);
    stubDense(
        candidate("a").file("src/auth.ts").score(0.8).build(),
        candidate("b").file("src/user.ts").score(0.7).build());

    List<Candidate> results = denseOnly.search(new SearchQuery("token refresh"));

    assertThat(results).extracting(Candidate::chunkId).containsExactly("a", "b");
    assertThat(results).allSatisfy(c -> assertThat(c.hybridScore()).isNull());
    assertThat(denseOnly.getStats().hybridQueries()).isZero();
  }

  @Test
  void skipsKeywordSourceWhenHybridDisabled() {
    stubDense(candidate("a").build());

    pipeline.search(SearchQuery.builder("token refresh").hybrid(false).build());

    verify(keywordSearchSource, never()).search(any(), anyInt());
    assertThat(pipeline.getStats().hybridQueries()).isZero();
  }

  @Test
  void capsResultsToTheLimit() {
    stubDense(
        candidate("a").file("a.ts").score(0.9).build(),
        candidate("b").file("b.ts").score(0.8).build(),
        candidate("c").file("c.ts").score(0.7).build());
    stubKeywordEmpty();

    assertThat(pipeline.search(new SearchQuery("token refresh", 2))).hasSize(2);
  }

  @Test
  void embeddingFailureNamesTheStage() {
    given(queryEmbedder.embedQuery(anyString())).willThrow(new RuntimeException("model offline"));
    SearchQuery query = SearchQuery.builder("token refresh").hybrid(false).build();

    assertThatThrownBy(() -> pipeline.search(query))
        .isInstanceOf(SearchException.class)
        .hasMessage("Search failed at embedding: model offline")
        .satisfies(
            e -> assertThat(((SearchException) e).getStage()).isEqualTo(SearchStage.EMBEDDING));
    assertThat(pipeline.getStats().failedQueries()).isEqualTo(1);
  }

  @Test
  void keywordFailureNamesTheStage() {
    stubDense(candidate("a").build());
    given(keywordSearchSource.search(any(), anyInt()))
        .willThrow(new IllegalStateException("index closed"));

    assertThatThrownBy(() -> pipeline.search(new SearchQuery("token refresh")))
        .isInstanceOf(SearchException.class)
        .hasMessage("Search failed at keyword_search: index closed");
  }

  @Test
  void slowDenseSourceTimesOut() {
    properties.setDenseTimeout(Duration.ofMillis(100));
    given(queryEmbedder.embedQuery(anyString())).willReturn(EMBEDDING);
    given(denseSearchSource.search(any(), any()))
        .willAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return List.of();
            });
    SearchQuery query = SearchQuery.builder("token refresh").hybrid(false).build();

    assertThatThrownBy(() -> pipeline.search(query))
        .isInstanceOf(SearchException.class)
        .hasMessage("Search failed at dense_search: timed out after 100 ms");
  }

  @Test
  void fileScopedSearchIsNeverCached() {
    stubDense(candidate("a").file("src/auth.ts").build());
    stubKeywordEmpty();

    pipeline.searchInFile("token refresh", "src/auth.ts", 5);
    pipeline.searchInFile("token refresh", "src/auth.ts", 5);

    verify(denseSearchSource, times(2)).search(queryCaptor.capture(), any());
    assertThat(queryCaptor.getValue().threshold()).isEqualTo(0.6);
    assertThat(queryCaptor.getValue().filePath()).isEqualTo("src/auth.ts");
    assertThat(queryCache.size()).isZero();
  }

  @Test
  void searchFunctionsFiltersByKindAndLanguage() {
    stubDense(candidate("a").build());
    stubKeywordEmpty();

    pipeline.searchFunctions("token refresh", "typescript", 5);

    verify(denseSearchSource).search(queryCaptor.capture(), any());
    assertThat(queryCaptor.getValue().chunkKind()).isEqualTo(ChunkKind.FUNCTION);
    assertThat(queryCaptor.getValue().language()).isEqualTo("typescript");
  }

  @Test
  void codeReferencesWidenTheCandidatePool() {
    stubDense(
        candidate("a").file("src/auth.ts").lines(10, 20).content("first").build(),
        candidate("b").file("src/auth.ts").lines(25, 40).content("second").score(0.7).build());
    stubKeywordEmpty();

    CodeReferenceResponse response =
        pipeline.searchForCodeReferences(new SearchQuery("token refresh", 5), 500);

    verify(denseSearchSource).search(queryCaptor.capture(), any());
    assertThat(queryCaptor.getValue().limit()).isEqualTo(20);
    assertThat(response.window().tokenBudget()).isEqualTo(500);
    assertThat(response.window().references()).hasSize(1);
    assertThat(response.metadata().totalResults()).isEqualTo(2);
    assertThat(response.metadata().cacheHit()).isFalse();
  }

  @Test
  void codeReferencesRejectNonPositiveBudgetBeforeSearching() {
    assertThatThrownBy(() -> pipeline.searchForCodeReferences(new SearchQuery("token"), 0))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(denseSearchSource, queryEmbedder);
  }

  @Test
  void rerankedOrderIsApplied() {
    stubDense(
        candidate("a").file("a.ts").score(0.9).build(),
        candidate("b").file("b.ts").score(0.5).build());
    stubKeywordEmpty();
    given(reranker.isEnabled()).willReturn(true);
    given(reranker.rerank(anyString(), anyList(), anyInt()))
        .willReturn(
            new RerankResponse(
                true, List.of(RerankedEntry.of("b", 0.99), RerankedEntry.of("a", 0.1))));

    List<Candidate> results = pipeline.search(new SearchQuery("token refresh"));

    assertThat(results).extracting(Candidate::chunkId).containsExactly("b", "a");
    assertThat(pipeline.getStats().rerankedQueries()).isEqualTo(1);
  }

  @Test
  void abandonedRerankCallsDoNotStarveLaterSearches() {
    ExecutorService fetchPool = Executors.newFixedThreadPool(2);
    ExecutorService singleRerankThread = Executors.newFixedThreadPool(1);
    try {
      properties.setDenseTimeout(Duration.ofMillis(500));
      properties.setRerankTimeout(Duration.ofMillis(100));
      SearchPipeline constrained =
          new SearchPipeline(
              queryCache,
              queryEmbedder,
              denseSearchSource,
              Optional.of(keywordSearchSource),
              new ResultFusionEngine(properties),
              new ContextOptimizer(),
              new RerankOrchestrator(reranker, properties, singleRerankThread),
              new ContextAssembler(new ContextProperties()),
              properties,
              fetchPool,
              clock);
      stubDense(
          candidate("a").file("a.ts").score(0.9).build(),
          candidate("b").file("b.ts").score(0.5).build());
      given(reranker.isEnabled()).willReturn(true);
      given(reranker.rerank(anyString(), anyList(), anyInt()))
          .willAnswer(
              invocation -> {
                Thread.sleep(5_000);
                throw new IllegalStateException("reranker crashed");
              });

      for (String text : List.of("token refresh", "session expiry", "password reset")) {
        List<Candidate> results =
            constrained.search(SearchQuery.builder(text).hybrid(false).build());

        assertThat(results).extracting(Candidate::chunkId).containsExactly("a", "b");
      }
      SearchStats stats = constrained.getStats();
      assertThat(stats.failedQueries()).isZero();
      assertThat(stats.rerankedQueries()).isZero();
    } finally {
      fetchPool.shutdownNow();
      singleRerankThread.shutdownNow();
    }
  }

  @Test
  void invalidateFileDropsCachedResults() {
    stubDense(candidate("a").file("src/auth.ts").build());
    stubKeywordEmpty();
    pipeline.search(new SearchQuery("token refresh"));

    assertThat(pipeline.invalidateFile(" src/auth.ts ")).isEqualTo(1);
    assertThat(pipeline.invalidateFile("src/other.ts")).isZero();
  }

  @Test
  void blankInvalidationTargetsAreRejected() {
    assertThatThrownBy(() -> pipeline.invalidateFile(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pipeline.invalidateLanguage(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void clearCachesResetsStatistics() {
    stubDense(candidate("a").build());
    stubKeywordEmpty();
    pipeline.search(new SearchQuery("token refresh"));

    pipeline.clearCaches();

    SearchStats stats = pipeline.getStats();
    assertThat(stats.totalQueries()).isZero();
    assertThat(stats.lastQueryAt()).isNull();
    assertThat(stats.cache().size()).isZero();
  }

  private void stubDense(Candidate... candidates) {
    given(queryEmbedder.embedQuery(anyString())).willReturn(EMBEDDING);
    given(denseSearchSource.search(any(), any())).willReturn(List.of(candidates));
  }

  private void stubKeywordEmpty() {
    given(keywordSearchSource.search(any(), anyInt())).willReturn(List.of());
  }
}
