package dev.codescope.search.fusion;

import static dev.codescope.fixture.CandidateBuilder.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.ChunkMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ScoreBoostsTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "README.md",
        "docs/guide.ts",
        "notes.txt",
        "CHANGELOG",
        "api/index.rst",
        "manual.adoc",
        "Documentation\\setup.js",
        "LICENSE"
      })
  void recognisesDocumentationFiles(String path) {
    assertThat(ScoreBoosts.isDocumentationFile(path)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"src/foo.ts", "lib/markdown.py", "src/md/parser.go", "Makefile"})
  void codeFilesAreNotDocumentation(String path) {
    assertThat(ScoreBoosts.isDocumentationFile(path)).isFalse();
  }

  @Test
  void implementationFunctionOutranksDocumentationSection() {
    Candidate code =
        candidate("code").file("src/foo.ts").kind(ChunkKind.FUNCTION).score(0.6).build();
    Candidate docs =
        candidate("docs").file("README.md").kind(ChunkKind.SECTION).score(0.6).build();

    Candidate boostedCode = ScoreBoosts.implementationBoost(code);
    Candidate boostedDocs = ScoreBoosts.implementationBoost(docs);

    assertThat(boostedCode.score()).isCloseTo(0.6 * 1.30 * 1.15, within(1e-9));
    assertThat(boostedDocs.score()).isCloseTo(0.6 * 0.85, within(1e-9));
    assertThat(boostedCode.score()).isGreaterThan(boostedDocs.score());
  }

  @Test
  void implementationBoostIsNotClamped() {
    Candidate code = candidate("code").file("src/foo.ts").kind(ChunkKind.CLASS).score(0.9).build();

    assertThat(ScoreBoosts.implementationBoost(code).score()).isGreaterThan(1.0);
  }

  @Test
  void metadataBoostAddsBonusesAndClamps() {
    Candidate open =
        candidate("a").score(0.5).metadata(new ChunkMetadata(false, true, true)).build();
    Candidate high =
        candidate("b").score(0.95).metadata(new ChunkMetadata(false, true, true)).build();
    Candidate test =
        candidate("c").score(0.5).metadata(new ChunkMetadata(true, false, false)).build();

    assertThat(ScoreBoosts.metadataBoost(open).score()).isCloseTo(0.8, within(1e-9));
    assertThat(ScoreBoosts.metadataBoost(high).score()).isEqualTo(1.0);
    assertThat(ScoreBoosts.metadataBoost(test).score()).isEqualTo(0.5);
  }

  @Test
  void nonTestFileGetsSmallBonus() {
    Candidate candidate = candidate("a").score(0.5).metadata(ChunkMetadata.NONE).build();

    assertThat(ScoreBoosts.metadataBoost(candidate).score()).isCloseTo(0.55, within(1e-9));
  }
}
