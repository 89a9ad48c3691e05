package dev.codescope.search.optimize;

import static dev.codescope.fixture.CandidateBuilder.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.SearchQuery;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextOptimizerTest {

  private final ContextOptimizer optimizer = new ContextOptimizer();

  @Test
  void limitPerFileKeepsTopChunksOfEachFile() {
    List<Candidate> candidates =
        List.of(
            candidate("a1").file("a.ts").score(0.9).build(),
            candidate("a2").file("a.ts").score(0.8).build(),
            candidate("b1").file("b.ts").score(0.7).build(),
            candidate("a3").file("a.ts").score(0.6).build());

    List<Candidate> limited = ContextOptimizer.limitPerFile(candidates, 2);

    assertThat(limited).extracting(Candidate::chunkId).containsExactly("a1", "a2", "b1");
  }

  @Test
  void diversifyCapsDominantLanguage() {
    List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      candidates.add(candidate("ts" + i).file("f" + i + ".ts").score(0.9 - i * 0.01).build());
    }
    candidates.add(candidate("py0").file("a.py").language("python").score(0.5).build());
    candidates.add(candidate("go0").file("a.go").language("go").score(0.4).build());

    List<Candidate> diversified = ContextOptimizer.diversifyByLanguage(candidates);

    // 10 candidates over 3 languages: at most 3 per language
    assertThat(diversified)
        .extracting(Candidate::chunkId)
        .containsExactly("ts0", "ts1", "ts2", "py0", "go0");
  }

  @Test
  void diversifyKeepsAtLeastTwoPerLanguage() {
    List<Candidate> candidates =
        List.of(
            candidate("ts0").file("a.ts").build(),
            candidate("ts1").file("b.ts").build(),
            candidate("py0").file("a.py").language("python").build(),
            candidate("go0").file("a.go").language("go").build());

    assertThat(ContextOptimizer.diversifyByLanguage(candidates)).hasSize(4);
  }

  @Test
  void boostByChunkKindClampsAtOne() {
    List<Candidate> boosted =
        ContextOptimizer.boostByChunkKind(
            List.of(
                candidate("f").kind(ChunkKind.FUNCTION).score(0.95).build(),
                candidate("c").kind(ChunkKind.CLASS).score(0.5).build()),
            ChunkKind.FUNCTION,
            0.1);

    assertThat(boosted.get(0).score()).isEqualTo(1.0);
    assertThat(boosted.get(1).score()).isEqualTo(0.5);
  }

  @Test
  void preferClassesReordersResults() {
    List<Candidate> candidates =
        List.of(
            candidate("fn").file("a.ts").kind(ChunkKind.FUNCTION).score(0.75).build(),
            candidate("cls").file("b.ts").kind(ChunkKind.CLASS).score(0.7).build());

    List<Candidate> optimized =
        optimizer.optimize(candidates, new OptimizationPreferences(false, true, 3, false));

    assertThat(optimized).extracting(Candidate::chunkId).containsExactly("cls", "fn");
    assertThat(optimized.get(0).score()).isCloseTo(0.8, within(1e-9));
  }

  @Test
  void optimizeAlwaysReturnsRankingOrder() {
    List<Candidate> candidates =
        List.of(
            candidate("low").file("a.ts").score(0.2).build(),
            candidate("high").file("b.ts").score(0.9).build());

    List<Candidate> optimized =
        optimizer.optimize(candidates, new OptimizationPreferences(false, false, 3, true));

    assertThat(optimized).isSortedAccordingTo(Candidate.RANKING);
  }

  @Test
  void preferencesFollowQueryFilters() {
    SearchQuery functions =
        SearchQuery.builder("q").chunkKind(ChunkKind.FUNCTION).language("go").build();
    SearchQuery classes = SearchQuery.builder("q").chunkKind(ChunkKind.CLASS).maxPerFile(1).build();

    OptimizationPreferences forFunctions = OptimizationPreferences.forQuery(functions, 3);
    OptimizationPreferences forClasses = OptimizationPreferences.forQuery(classes, 3);

    assertThat(forFunctions.preferFunctions()).isTrue();
    assertThat(forFunctions.diversifyLanguages()).isFalse();
    assertThat(forFunctions.maxPerFile()).isEqualTo(3);
    assertThat(forClasses.preferClasses()).isTrue();
    assertThat(forClasses.diversifyLanguages()).isTrue();
    assertThat(forClasses.maxPerFile()).isEqualTo(1);
  }

  @Test
  void maxPerFileBelowOneIsRejected() {
    assertThatThrownBy(() -> new OptimizationPreferences(false, false, 0, false))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
