package dev.codescope.search.fusion;

import dev.codescope.search.Candidate;
import dev.codescope.search.SearchProperties;
import dev.codescope.search.SearchQuery;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges the dense and keyword candidate lists of one query into a single ranked list.
 *
 * <ol>
 *   <li>Hybrid disabled or no keyword results: the dense list passes through (the keyword list
 *       only when the dense list is empty)
 *   <li>Otherwise {@link ConvexCombinationFusion} blends both lists with the configured alpha
 *   <li>Implementation boost, unless the query opts out ({@link ScoreBoosts#implementationBoost})
 *   <li>Metadata boost ({@link ScoreBoosts#metadataBoost})
 *   <li>Final sort by {@link Candidate#RANKING}
 * </ol>
 */
@Component
public class ResultFusionEngine {

  private static final Logger log = LoggerFactory.getLogger(ResultFusionEngine.class);

  private final SearchProperties searchProperties;

  public ResultFusionEngine(SearchProperties searchProperties) {
    this.searchProperties = searchProperties;
  }

  public FusionOutcome fuse(
      SearchQuery query, List<Candidate> denseResults, List<Candidate> sparseResults) {
    boolean hybridEnabled =
        query.hybrid() != null ? query.hybrid() : searchProperties.isHybridEnabled();

    List<Candidate> merged;
    boolean hybridUsed;
    double alpha;
    if (!hybridEnabled || sparseResults.isEmpty()) {
      merged = denseResults.isEmpty() ? sparseResults : denseResults;
      hybridUsed = false;
      alpha = 1.0;
    } else {
      alpha = alphaFor(query);
      merged = ConvexCombinationFusion.fuse(denseResults, sparseResults, alpha);
      hybridUsed = true;
      log.debug(
          "Fused {} dense + {} keyword results into {} with alpha={}",
          denseResults.size(),
          sparseResults.size(),
          merged.size(),
          alpha);
    }

    Stream<Candidate> boosted = merged.stream();
    if (query.preferImplementation()) {
      boosted = boosted.map(ScoreBoosts::implementationBoost);
    }
    List<Candidate> ranked =
        boosted.map(ScoreBoosts::metadataBoost).sorted(Candidate.RANKING).toList();
    return new FusionOutcome(ranked, hybridUsed, alpha);
  }

  /** The configured alpha, shifted by the query's phrasing when adaptive alpha is enabled. */
  double alphaFor(SearchQuery query) {
    double alpha = searchProperties.getAlpha();
    if (!searchProperties.isAdaptiveAlpha()) {
      return alpha;
    }
    double adjusted = QueryIntent.adjust(alpha, query.query());
    if (adjusted != alpha) {
      log.debug("Adaptive alpha {} -> {} for query '{}'", alpha, adjusted, query.query());
    }
    return adjusted;
  }
}
