package dev.codescope.search.fusion;

import static dev.codescope.fixture.CandidateBuilder.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.codescope.search.Candidate;
import dev.codescope.search.HybridScore;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConvexCombinationFusionTest {

  private static final List<Candidate> DENSE =
      List.of(
          candidate("d1").file("a.ts").content("dense copy").score(0.9).build(),
          candidate("both").file("b.ts").content("dense copy").score(0.6).build());

  private static final List<Candidate> SPARSE =
      List.of(
          candidate("both").file("b.ts").content("sparse copy").score(0.8).build(),
          candidate("s1").file("c.ts").score(0.7).build());

  @Test
  void combinesScoresByChunkId() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 0.5);

    assertThat(fused).hasSize(3);
    Candidate both = byId(fused, "both");
    assertThat(both.score()).isCloseTo(0.7, within(1e-9));
    assertThat(both.hybridScore()).isEqualTo(new HybridScore(0.6, 0.8, both.score()));
  }

  @Test
  void denseCopyWinsForSharedChunks() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 0.5);

    assertThat(byId(fused, "both").content()).isEqualTo("dense copy");
  }

  @Test
  void missingSideCountsAsZero() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 0.7);

    Candidate denseOnly = byId(fused, "d1");
    assertThat(denseOnly.score()).isCloseTo(0.63, within(1e-9));
    assertThat(denseOnly.hybridScore().sparse()).isNull();

    Candidate sparseOnly = byId(fused, "s1");
    assertThat(sparseOnly.score()).isCloseTo(0.21, within(1e-9));
    assertThat(sparseOnly.hybridScore().dense()).isZero();
  }

  @Test
  void alphaOneKeepsDenseOrder() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 1.0);

    assertThat(fused).extracting(Candidate::chunkId).startsWith("d1", "both");
  }

  @Test
  void alphaZeroKeepsSparseOrder() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 0.0);

    assertThat(fused).extracting(Candidate::chunkId).startsWith("both", "s1");
  }

  @Test
  void resultIsSortedByRanking() {
    List<Candidate> fused = ConvexCombinationFusion.fuse(DENSE, SPARSE, 0.3);

    assertThat(fused).isSortedAccordingTo(Candidate.RANKING);
  }

  @Test
  void emptyInputsGiveEmptyResult() {
    assertThat(ConvexCombinationFusion.fuse(List.of(), List.of(), 0.5)).isEmpty();
  }

  @Test
  void alphaOutsideUnitIntervalThrows() {
    assertThatThrownBy(() -> ConvexCombinationFusion.fuse(DENSE, SPARSE, 1.1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("alpha");
  }

  private static Candidate byId(List<Candidate> candidates, String chunkId) {
    return candidates.stream().filter(c -> c.chunkId().equals(chunkId)).findFirst().orElseThrow();
  }
}
