package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.ChunkMetadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One entry of a reranker answer. Only {@code chunkId} and {@code rerankScore} are guaranteed;
 * the remaining fields are whatever the reranker echoed back and are used only when the chunk id
 * does not match a local candidate.
 *
 * @param chunkId id of the ranked chunk
 * @param rerankScore relevance score assigned by the reranker
 * @param filePath echoed file path, if any
 * @param startLine echoed start line, if any
 * @param endLine echoed end line, if any
 * @param language echoed language tag, if any
 * @param chunkKind echoed chunk kind value, if any
 * @param content echoed chunk text, if any
 * @param score echoed source score, if any
 */
public record RerankedEntry(
    String chunkId,
    double rerankScore,
    @Nullable String filePath,
    @Nullable Integer startLine,
    @Nullable Integer endLine,
    @Nullable String language,
    @Nullable String chunkKind,
    @Nullable String content,
    @Nullable Double score) {

  public RerankedEntry {
    Objects.requireNonNull(chunkId, "chunkId");
  }

  /** Entry that refers to a local candidate by id only. */
  public static RerankedEntry of(String chunkId, double rerankScore) {
    return new RerankedEntry(chunkId, rerankScore, null, null, null, null, null, null, null);
  }

  /** Entry echoing the full payload of a candidate. */
  public static RerankedEntry of(Candidate candidate, double rerankScore) {
    return new RerankedEntry(
        candidate.chunkId(),
        rerankScore,
        candidate.filePath(),
        candidate.startLine(),
        candidate.endLine(),
        candidate.language(),
        candidate.chunkKind().value(),
        candidate.content(),
        candidate.score());
  }

  /**
   * Rebuilds a candidate from this payload alone. Missing text fields default to the empty
   * string, lines to 0, the score to 0.0, the kind to {@link ChunkKind#GENERIC} and every
   * metadata flag to false.
   */
  public Candidate toCandidate() {
    return new Candidate(
            chunkId,
            Objects.requireNonNullElse(filePath, ""),
            Objects.requireNonNullElse(startLine, 0),
            Objects.requireNonNullElse(endLine, 0),
            Objects.requireNonNullElse(language, ""),
            ChunkKind.fromPayload(chunkKind),
            Objects.requireNonNullElse(content, ""),
            Objects.requireNonNullElse(score, 0.0),
            ChunkMetadata.NONE)
        .withRerankScore(rerankScore);
  }
}
