package dev.codescope.search.cache;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Published by the file-watch collaborator when a workspace file is added, changed or removed.
 *
 * @param filePath path of the file, relative to the workspace root
 * @param language language tag of the file, if known
 * @param change what happened to the file
 */
public record SourceFileChangedEvent(
    String filePath, @Nullable String language, ChangeType change) {

  public SourceFileChangedEvent {
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(change, "change");
  }

  /** Kind of file-system change. */
  public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
  }
}
