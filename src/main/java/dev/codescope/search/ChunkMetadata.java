package dev.codescope.search;

/**
 * File-level flags attached to a chunk by the indexer and the editor integration.
 *
 * @param test whether the owning file is a test file
 * @param recentlyModified whether the owning file changed recently
 * @param currentlyOpen whether the owning file is open in the caller's editor
 */
public record ChunkMetadata(boolean test, boolean recentlyModified, boolean currentlyOpen) {

  /** All flags false. Used when a payload carries no metadata. */
  public static final ChunkMetadata NONE = new ChunkMetadata(false, false, false);
}
