package dev.codescope.search.optimize;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reshapes a fused ranking before reranking: chunk-kind preference boosts, language
 * diversification and a per-file cap. Always finishes with a sort by {@link Candidate#RANKING}.
 */
@Component
public class ContextOptimizer {

  private static final Logger log = LoggerFactory.getLogger(ContextOptimizer.class);

  /** Additive bump applied for {@code preferFunctions} / {@code preferClasses}. */
  static final double PREFERENCE_DELTA = 0.1;

  static final int MIN_PER_LANGUAGE = 2;

  public List<Candidate> optimize(List<Candidate> candidates, OptimizationPreferences preferences) {
    List<Candidate> optimized = candidates;
    if (preferences.preferFunctions()) {
      optimized = boostByChunkKind(optimized, ChunkKind.FUNCTION, PREFERENCE_DELTA);
    }
    if (preferences.preferClasses()) {
      optimized = boostByChunkKind(optimized, ChunkKind.CLASS, PREFERENCE_DELTA);
    }
    if (preferences.diversifyLanguages()) {
      optimized = diversifyByLanguage(optimized);
    }
    optimized = limitPerFile(optimized, preferences.maxPerFile());

    List<Candidate> sorted = optimized.stream().sorted(Candidate.RANKING).toList();
    if (sorted.size() != candidates.size()) {
      log.debug("Optimizer kept {} of {} candidates", sorted.size(), candidates.size());
    }
    return sorted;
  }

  /** Adds {@code delta} to every candidate of the given kind, clamped to 1.0. */
  public static List<Candidate> boostByChunkKind(
      List<Candidate> candidates, ChunkKind kind, double delta) {
    return candidates.stream()
        .map(c -> c.chunkKind() == kind ? c.withScore(Math.min(1.0, c.score() + delta)) : c)
        .toList();
  }

  /**
   * Caps each language group to {@code max(2, total / distinctLanguages)} candidates. Groups are
   * re-concatenated in first-seen order, each keeping its original internal order.
   */
  public static List<Candidate> diversifyByLanguage(List<Candidate> candidates) {
    if (candidates.isEmpty()) {
      return candidates;
    }
    Map<String, List<Candidate>> groups = groupBy(candidates, Candidate::language);
    int maxPerLanguage = Math.max(MIN_PER_LANGUAGE, candidates.size() / groups.size());
    return concatHeads(groups, maxPerLanguage);
  }

  /**
   * Keeps the first {@code maxPerFile} candidates of each file in their existing order. Files are
   * re-concatenated in first-seen order.
   */
  public static List<Candidate> limitPerFile(List<Candidate> candidates, int maxPerFile) {
    return concatHeads(groupBy(candidates, Candidate::filePath), maxPerFile);
  }

  private static Map<String, List<Candidate>> groupBy(
      List<Candidate> candidates, Function<Candidate, String> key) {
    Map<String, List<Candidate>> groups = new LinkedHashMap<>();
    for (Candidate candidate : candidates) {
      groups.computeIfAbsent(key.apply(candidate), k -> new ArrayList<>()).add(candidate);
    }
    return groups;
  }

  private static List<Candidate> concatHeads(Map<String, List<Candidate>> groups, int limit) {
    List<Candidate> result = new ArrayList<>();
    for (List<Candidate> group : groups.values()) {
      result.addAll(group.subList(0, Math.min(limit, group.size())));
    }
    return result;
  }
}
