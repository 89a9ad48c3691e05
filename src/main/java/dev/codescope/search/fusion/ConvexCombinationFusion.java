package dev.codescope.search.fusion;

import dev.codescope.search.Candidate;
import dev.codescope.search.HybridScore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility blending dense and sparse candidate lists with a convex combination.
 *
 * <p>Source scores are used as delivered (both sources report on a 0.0-1.0 scale), combined by
 * chunk id: {@code combined = alpha * dense + (1 - alpha) * sparse}. A candidate returned by only
 * one source gets 0.0 for the other.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class ConvexCombinationFusion {

  private ConvexCombinationFusion() {}

  /**
   * Fuses dense and sparse results.
   *
   * <p>Candidates present in both lists keep the dense copy (its metadata wins). The sparse
   * component of a dense-only candidate is recorded as {@code null} in its {@link HybridScore}.
   *
   * @param denseResults candidates from the dense (embedding) source
   * @param sparseResults candidates from the keyword source
   * @param alpha weight for dense scores (0.0 = keyword only, 1.0 = dense only)
   * @return fused candidates sorted by {@link Candidate#RANKING}
   */
  public static List<Candidate> fuse(
      List<Candidate> denseResults, List<Candidate> sparseResults, double alpha) {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalArgumentException("alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (denseResults.isEmpty() && sparseResults.isEmpty()) {
      return List.of();
    }

    // Keyed by chunk id; insertion order keeps the merge deterministic
    Map<String, FusedEntry> fusedMap = new LinkedHashMap<>();

    for (Candidate dense : denseResults) {
      fusedMap.putIfAbsent(dense.chunkId(), new FusedEntry(dense, dense.score(), null));
    }

    for (Candidate sparse : sparseResults) {
      FusedEntry existing = fusedMap.get(sparse.chunkId());
      if (existing == null) {
        fusedMap.put(sparse.chunkId(), new FusedEntry(sparse, 0.0, sparse.score()));
      } else if (existing.sparseScore == null) {
        fusedMap.put(
            sparse.chunkId(),
            new FusedEntry(existing.base, existing.denseScore, sparse.score()));
      }
    }

    return fusedMap.values().stream()
        .map(entry -> entry.toCandidate(alpha))
        .sorted(Candidate.RANKING)
        .toList();
  }

  /** Internal holder for a candidate during combination. */
  private record FusedEntry(Candidate base, double denseScore, @Nullable Double sparseScore) {

    Candidate toCandidate(double alpha) {
      double sparse = sparseScore != null ? sparseScore : 0.0;
      double combined = alpha * denseScore + (1.0 - alpha) * sparse;
      return base.withHybridScore(new HybridScore(denseScore, sparseScore, combined));
    }
  }
}
