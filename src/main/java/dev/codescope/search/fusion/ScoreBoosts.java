package dev.codescope.search.fusion;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkMetadata;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic score adjustments applied after fusion.
 *
 * <p>The implementation boost is multiplicative and unclamped; the metadata boost is additive and
 * clamped to 1.0. The two passes are independent and their asymmetry is intentional.
 */
public final class ScoreBoosts {

  static final double IMPLEMENTATION_FACTOR = 1.30;
  static final double DOCUMENTATION_FACTOR = 0.85;
  static final double ENTITY_FACTOR = 1.15;

  static final double RECENTLY_MODIFIED_BONUS = 0.10;
  static final double CURRENTLY_OPEN_BONUS = 0.15;
  static final double NON_TEST_BONUS = 0.05;

  private static final Set<String> DOC_EXTENSIONS = Set.of("md", "txt", "rst", "adoc", "asciidoc");

  private static final List<String> DOC_PATH_MARKERS =
      List.of("readme", "changelog", "license", "contributing", "docs/", "documentation/");

  private ScoreBoosts() {}

  /**
   * Whether a path names a documentation file: a documentation extension, or a path containing
   * one of the usual documentation markers. Case-insensitive; backslashes count as separators.
   */
  public static boolean isDocumentationFile(String filePath) {
    String path = filePath.replace('\\', '/').toLowerCase(Locale.ROOT);
    int lastSlash = path.lastIndexOf('/');
    int lastDot = path.lastIndexOf('.');
    if (lastDot > lastSlash && DOC_EXTENSIONS.contains(path.substring(lastDot + 1))) {
      return true;
    }
    return DOC_PATH_MARKERS.stream().anyMatch(path::contains);
  }

  /** Multiplies by 1.30 (code) or 0.85 (documentation), then by 1.15 for entity chunks. */
  public static Candidate implementationBoost(Candidate candidate) {
    double factor =
        isDocumentationFile(candidate.filePath()) ? DOCUMENTATION_FACTOR : IMPLEMENTATION_FACTOR;
    if (candidate.chunkKind().isEntity()) {
      factor *= ENTITY_FACTOR;
    }
    return candidate.withScore(candidate.score() * factor);
  }

  /** Adds the file-metadata bonuses and clamps the result to 1.0. */
  public static Candidate metadataBoost(Candidate candidate) {
    ChunkMetadata metadata = candidate.metadata();
    double bonus = 0.0;
    if (metadata.recentlyModified()) {
      bonus += RECENTLY_MODIFIED_BONUS;
    }
    if (metadata.currentlyOpen()) {
      bonus += CURRENTLY_OPEN_BONUS;
    }
    if (!metadata.test()) {
      bonus += NON_TEST_BONUS;
    }
    return candidate.withScore(Math.min(1.0, candidate.score() + bonus));
  }
}
