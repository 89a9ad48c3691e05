package dev.codescope.search;

import java.util.Comparator;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One retrieved chunk flowing through the pipeline. Immutable: every score adjustment returns a
 * copy.
 *
 * <p>The core fields are always present. {@code hybridScore}, {@code rerankScore}, {@code
 * functionName} and {@code className} are extension fields that stay null until a stage (or the
 * store payload) supplies them.
 *
 * @param chunkId stable chunk identifier from the index
 * @param filePath path of the owning file, relative to the workspace root
 * @param startLine first line of the chunk (1-based)
 * @param endLine last line of the chunk (inclusive)
 * @param language language tag of the owning file (e.g. "typescript")
 * @param chunkKind syntactic kind of the chunk
 * @param content raw chunk text
 * @param score current ordering score (source score before fusion, adjusted afterwards)
 * @param metadata file-level flags
 * @param hybridScore fusion breakdown, null before fusion or on dense-only passes
 * @param rerankScore relevance score assigned by the reranker, null if not reranked
 * @param functionName enclosing function name, if the parser recorded one
 * @param className enclosing class name, if the parser recorded one
 */
public record Candidate(
    String chunkId,
    String filePath,
    int startLine,
    int endLine,
    String language,
    ChunkKind chunkKind,
    String content,
    double score,
    ChunkMetadata metadata,
    @Nullable HybridScore hybridScore,
    @Nullable Double rerankScore,
    @Nullable String functionName,
    @Nullable String className) {

  /**
   * Ranking order used everywhere in the pipeline: score descending, then file path, then start
   * line, so equal scores still produce a deterministic order.
   */
  public static final Comparator<Candidate> RANKING =
      Comparator.comparingDouble(Candidate::score)
          .reversed()
          .thenComparing(Candidate::filePath)
          .thenComparingInt(Candidate::startLine);

  public Candidate {
    Objects.requireNonNull(chunkId, "chunkId");
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(chunkKind, "chunkKind");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(metadata, "metadata");
  }

  /** Core-fields constructor; extension fields start out null. */
  public Candidate(
      String chunkId,
      String filePath,
      int startLine,
      int endLine,
      String language,
      ChunkKind chunkKind,
      String content,
      double score,
      ChunkMetadata metadata) {
    this(
        chunkId,
        filePath,
        startLine,
        endLine,
        language,
        chunkKind,
        content,
        score,
        metadata,
        null,
        null,
        null,
        null);
  }

  public Candidate withScore(double newScore) {
    return new Candidate(
        chunkId,
        filePath,
        startLine,
        endLine,
        language,
        chunkKind,
        content,
        newScore,
        metadata,
        hybridScore,
        rerankScore,
        functionName,
        className);
  }

  /** Attaches a fusion breakdown and adopts its combined value as the ordering score. */
  public Candidate withHybridScore(HybridScore hybrid) {
    return new Candidate(
        chunkId,
        filePath,
        startLine,
        endLine,
        language,
        chunkKind,
        content,
        hybrid.combined(),
        metadata,
        hybrid,
        rerankScore,
        functionName,
        className);
  }

  public Candidate withRerankScore(double newRerankScore) {
    return new Candidate(
        chunkId,
        filePath,
        startLine,
        endLine,
        language,
        chunkKind,
        content,
        score,
        metadata,
        hybridScore,
        newRerankScore,
        functionName,
        className);
  }

  /** Number of lines the chunk spans. */
  public int lineCount() {
    return Math.max(0, endLine - startLine + 1);
  }
}
