package dev.codescope.api;

/** @param removed number of cache entries dropped */
public record InvalidationResponse(int removed) {}
