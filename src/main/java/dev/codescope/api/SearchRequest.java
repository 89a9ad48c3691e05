package dev.codescope.api;

import dev.codescope.search.ChunkKind;
import dev.codescope.search.SearchQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of the search endpoints. Absent fields fall back to the query defaults or the
 * configured toggles.
 *
 * @param query search text
 * @param limit maximum number of results
 * @param language language filter
 * @param chunkKind chunk kind filter, e.g. "function"
 * @param filePath file path filter
 * @param threshold minimum dense similarity
 * @param hybrid hybrid fusion toggle
 * @param rerank reranking toggle
 * @param rerankTimeoutMs rerank budget override in milliseconds
 * @param maxPerFile per-file cap override
 * @param preferFunctions boost function chunks
 * @param preferClasses boost class chunks
 * @param preferImplementation boost code over documentation (default true)
 * @param tokenBudget window budget for the references endpoint
 */
public record SearchRequest(
    @NotBlank String query,
    @Nullable @Min(1) @Max(50) Integer limit,
    @Nullable String language,
    @Nullable String chunkKind,
    @Nullable String filePath,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double threshold,
    @Nullable Boolean hybrid,
    @Nullable Boolean rerank,
    @Nullable @PositiveOrZero Long rerankTimeoutMs,
    @Nullable @Min(1) Integer maxPerFile,
    @Nullable Boolean preferFunctions,
    @Nullable Boolean preferClasses,
    @Nullable Boolean preferImplementation,
    @Nullable @Positive Integer tokenBudget) {

  SearchQuery toQuery() {
    return SearchQuery.builder(query)
        .limit(limit != null ? limit : SearchQuery.DEFAULT_LIMIT)
        .language(language)
        .chunkKind(parseChunkKind(chunkKind))
        .filePath(filePath)
        .threshold(threshold != null ? threshold : SearchQuery.DEFAULT_THRESHOLD)
        .hybrid(hybrid)
        .rerank(rerank)
        .rerankTimeout(rerankTimeoutMs != null ? Duration.ofMillis(rerankTimeoutMs) : null)
        .maxPerFile(maxPerFile)
        .preferFunctions(Boolean.TRUE.equals(preferFunctions))
        .preferClasses(Boolean.TRUE.equals(preferClasses))
        .preferImplementation(!Boolean.FALSE.equals(preferImplementation))
        .build();
  }

  private static @Nullable ChunkKind parseChunkKind(@Nullable String value) {
    return value == null || value.isBlank() ? null : ChunkKind.fromValue(value.trim());
  }
}
