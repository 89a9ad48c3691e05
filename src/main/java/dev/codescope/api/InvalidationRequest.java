package dev.codescope.api;

import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/cache/invalidate}. At least one field must be set.
 *
 * @param filePath drop entries mentioning this file
 * @param language drop entries mentioning this language
 */
public record InvalidationRequest(@Nullable String filePath, @Nullable String language) {}
