package dev.codescope.search.source;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import dev.codescope.search.ChunkMetadata;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import java.util.Objects;

/**
 * Mapping between indexed {@link TextSegment}s and {@link Candidate}s. The metadata keys below are
 * the contract with the indexer that fills the store.
 */
public final class ChunkSegments {

  public static final String CHUNK_ID = "chunk_id";
  public static final String FILE_PATH = "file_path";
  public static final String START_LINE = "start_line";
  public static final String END_LINE = "end_line";
  public static final String LANGUAGE = "language";
  public static final String CHUNK_KIND = "chunk_kind";
  public static final String IS_TEST = "is_test";
  public static final String RECENTLY_MODIFIED = "recently_modified";
  public static final String CURRENTLY_OPEN = "currently_open";
  public static final String FUNCTION_NAME = "function_name";
  public static final String CLASS_NAME = "class_name";

  private ChunkSegments() {}

  /**
   * Builds a candidate from a store match. The match score becomes the source score; a missing
   * chunk id falls back to the store's embedding id.
   */
  public static Candidate toCandidate(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();
    return new Candidate(
        Objects.requireNonNullElse(metadata.getString(CHUNK_ID), match.embeddingId()),
        Objects.requireNonNullElse(metadata.getString(FILE_PATH), ""),
        Objects.requireNonNullElse(metadata.getInteger(START_LINE), 0),
        Objects.requireNonNullElse(metadata.getInteger(END_LINE), 0),
        Objects.requireNonNullElse(metadata.getString(LANGUAGE), ""),
        ChunkKind.fromPayload(metadata.getString(CHUNK_KIND)),
        segment.text(),
        match.score(),
        new ChunkMetadata(
            flag(metadata, IS_TEST),
            flag(metadata, RECENTLY_MODIFIED),
            flag(metadata, CURRENTLY_OPEN)),
        null,
        null,
        metadata.getString(FUNCTION_NAME),
        metadata.getString(CLASS_NAME));
  }

  /** Builds the segment an indexer stores for a chunk. */
  public static TextSegment toSegment(Candidate candidate) {
    Metadata metadata =
        new Metadata()
            .put(CHUNK_ID, candidate.chunkId())
            .put(FILE_PATH, candidate.filePath())
            .put(START_LINE, candidate.startLine())
            .put(END_LINE, candidate.endLine())
            .put(LANGUAGE, candidate.language())
            .put(CHUNK_KIND, candidate.chunkKind().value())
            .put(IS_TEST, String.valueOf(candidate.metadata().test()))
            .put(RECENTLY_MODIFIED, String.valueOf(candidate.metadata().recentlyModified()))
            .put(CURRENTLY_OPEN, String.valueOf(candidate.metadata().currentlyOpen()));
    if (candidate.functionName() != null) {
      metadata.put(FUNCTION_NAME, candidate.functionName());
    }
    if (candidate.className() != null) {
      metadata.put(CLASS_NAME, candidate.className());
    }
    return TextSegment.from(candidate.content(), metadata);
  }

  // flags are stored as strings: the store metadata has no boolean type
  private static boolean flag(Metadata metadata, String key) {
    return Boolean.parseBoolean(metadata.getString(key));
  }
}
