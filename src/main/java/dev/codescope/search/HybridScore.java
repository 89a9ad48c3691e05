package dev.codescope.search;

import org.jspecify.annotations.Nullable;

/**
 * Score breakdown attached to a candidate once hybrid fusion has run.
 *
 * @param dense the dense (embedding similarity) score, 0.0 if the dense source missed it
 * @param sparse the sparse (keyword) score, null when no sparse list took part
 * @param combined the fused score used for all later ordering
 */
public record HybridScore(double dense, @Nullable Double sparse, double combined) {}
