package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchDeadline;
import dev.codescope.search.SearchProperties;
import dev.codescope.search.SearchQuery;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Sends the top of a ranking to the {@link Reranker} under the request deadline and splices the
 * returned order back onto the full list.
 *
 * <p>Reranking is best-effort: every skip, error, empty answer or timeout leaves the input order
 * untouched and reports {@code reranked=false}. Nothing is thrown to the caller.
 *
 * <p>The reranker call runs on the dedicated rerank executor, never on the pool serving the
 * source fetches. When the deadline passes the task is cancelled with an interrupt; the caller
 * never waits longer than {@link SearchDeadline#remaining()}. A saturated executor rejects the
 * call and the request is served without reranking.
 */
@Component
public class RerankOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RerankOrchestrator.class);

  static final int MIN_CANDIDATES = 2;

  private final Reranker reranker;
  private final SearchProperties searchProperties;
  private final ExecutorService rerankExecutor;

  public RerankOrchestrator(
      Reranker reranker,
      SearchProperties searchProperties,
      @Qualifier("rerankExecutor") ExecutorService rerankExecutor) {
    this.reranker = reranker;
    this.searchProperties = searchProperties;
    this.rerankExecutor = rerankExecutor;
  }

  /**
   * Reranks the candidates if the query, the configuration and the remaining budget allow it.
   *
   * @param query the query being served
   * @param candidates the current ranking
   * @param deadline the request deadline
   * @return the new ordering, or the input ordering with {@code reranked=false}
   */
  public RerankOutcome rerank(
      SearchQuery query, List<Candidate> candidates, SearchDeadline deadline) {
    boolean requested =
        query.rerank() != null ? query.rerank() : searchProperties.isRerankEnabled();
    if (!requested) {
      return RerankOutcome.unchanged(candidates);
    }
    if (!reranker.isEnabled()) {
      log.debug("Reranking requested but the reranker is disabled");
      return RerankOutcome.unchanged(candidates);
    }
    if (candidates.size() < MIN_CANDIDATES) {
      return RerankOutcome.unchanged(candidates);
    }
    if (deadline.isExpired()) {
      log.warn(
          "Skipping rerank: request budget of {} ms already spent", deadline.budget().toMillis());
      return RerankOutcome.unchanged(candidates);
    }

    int shortlistSize = searchProperties.getRerankCandidates();
    List<Candidate> ranked = candidates.stream().sorted(Candidate.RANKING).toList();
    List<Candidate> shortlist = ranked.subList(0, Math.min(shortlistSize, ranked.size()));
    int maxResults = Math.min(query.limit(), shortlistSize);

    RerankResponse response = callReranker(query.query(), shortlist, maxResults, deadline);
    if (response == null) {
      return RerankOutcome.unchanged(candidates);
    }
    if (!response.reranked() || response.entries().isEmpty()) {
      log.warn("Reranker returned no ordering, keeping prior order");
      return RerankOutcome.unchanged(candidates);
    }

    List<Candidate> spliced = splice(ranked, response.entries());
    log.debug(
        "Reranked {} candidates in {} ms", shortlist.size(), deadline.elapsed().toMillis());
    return new RerankOutcome(spliced, true);
  }

  private @Nullable RerankResponse callReranker(
      String queryText, List<Candidate> shortlist, int maxResults, SearchDeadline deadline) {
    Future<RerankResponse> future;
    try {
      future = rerankExecutor.submit(() -> reranker.rerank(queryText, shortlist, maxResults));
    } catch (RejectedExecutionException e) {
      log.warn("Rerank executor saturated, keeping prior order");
      return null;
    }
    long timeoutMs = Math.max(1, deadline.remaining().toMillis());
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Rerank timed out after {} ms, keeping prior order", timeoutMs);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("Rerank failed, keeping prior order: {}", cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("Rerank interrupted, keeping prior order");
    }
    return null;
  }

  /**
   * Returned entries first (local candidates matched by chunk id, unknown ids rebuilt from the
   * payload), then shortlist members the reranker left out in their prior order, then the
   * candidates beyond the shortlist.
   */
  static List<Candidate> splice(List<Candidate> ranked, List<RerankedEntry> entries) {
    Map<String, Candidate> byId = new LinkedHashMap<>();
    for (Candidate candidate : ranked) {
      byId.putIfAbsent(candidate.chunkId(), candidate);
    }

    List<Candidate> result = new ArrayList<>(ranked.size());
    Set<String> placed = new HashSet<>();
    for (RerankedEntry entry : entries) {
      if (!placed.add(entry.chunkId())) {
        continue;
      }
      Candidate local = byId.get(entry.chunkId());
      if (local != null) {
        result.add(local.withRerankScore(entry.rerankScore()));
      } else {
        log.debug("Reranker returned unknown chunk {}, rebuilding from payload", entry.chunkId());
        result.add(entry.toCandidate());
      }
    }
    // ranked is shortlist followed by the tail, so one pass keeps both orders
    for (Candidate candidate : ranked) {
      if (placed.add(candidate.chunkId())) {
        result.add(candidate);
      }
    }
    return result;
  }
}
