package dev.codescope.search;

/**
 * What happened while serving one code-reference request.
 *
 * @param totalResults candidates produced by the pipeline before assembly
 * @param elapsedMs wall-clock time of the request
 * @param cacheHit whether the candidates came from the cache
 * @param hybridUsed whether dense and keyword results were blended
 * @param reranked whether the reranker's order was applied
 */
public record SearchMetadata(
    int totalResults, long elapsedMs, boolean cacheHit, boolean hybridUsed, boolean reranked) {}
