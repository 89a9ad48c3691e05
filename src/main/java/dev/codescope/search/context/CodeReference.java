package dev.codescope.search.context;

import dev.codescope.search.ChunkKind;
import dev.codescope.search.ChunkMetadata;
import org.jspecify.annotations.Nullable;

/**
 * One or more line-adjacent chunks of a file merged into a single citation.
 *
 * @param filePath path of the file
 * @param startLine first line of the first member
 * @param endLine last line of the last member
 * @param mergedText member texts in line order, gap markers between distant members
 * @param averageScore mean score of the members
 * @param dominantChunkKind chunk kind of the highest-scoring member
 * @param language language of the highest-scoring member
 * @param metadata metadata of the highest-scoring member
 * @param functionName enclosing function of the highest-scoring member, if known
 * @param className enclosing class of the highest-scoring member, if known
 * @param memberCount number of merged chunks
 */
public record CodeReference(
    String filePath,
    int startLine,
    int endLine,
    String mergedText,
    double averageScore,
    ChunkKind dominantChunkKind,
    String language,
    ChunkMetadata metadata,
    @Nullable String functionName,
    @Nullable String className,
    int memberCount) {}
