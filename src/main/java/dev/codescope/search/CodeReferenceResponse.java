package dev.codescope.search;

import dev.codescope.search.context.ContextWindow;

/**
 * Result of {@link SearchPipeline#searchForCodeReferences}.
 *
 * @param window the assembled references
 * @param metadata request metadata
 */
public record CodeReferenceResponse(ContextWindow window, SearchMetadata metadata) {}
