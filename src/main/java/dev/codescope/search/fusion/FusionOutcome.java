package dev.codescope.search.fusion;

import dev.codescope.search.Candidate;
import java.util.List;

/**
 * Result of the fusion stage.
 *
 * @param results boosted candidates in final ranking order
 * @param hybridUsed whether dense and keyword scores were actually blended
 * @param alpha the dense weight used (1.0 when no blending happened)
 */
public record FusionOutcome(List<Candidate> results, boolean hybridUsed, double alpha) {

  public FusionOutcome {
    results = List.copyOf(results);
  }
}
