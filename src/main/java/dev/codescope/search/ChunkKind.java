package dev.codescope.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Syntactic kind of an indexed chunk, as assigned by the parser that cut the source file. */
public enum ChunkKind {
  FUNCTION("function"),
  CLASS("class"),
  METHOD("method"),
  MODULE("module"),
  INTERFACE("interface"),
  TYPE("type"),
  VARIABLE("variable"),
  IMPORT("import"),
  COMMENT("comment"),
  SECTION("section"),
  GENERIC("generic");

  private static final Set<ChunkKind> ENTITY_KINDS = EnumSet.of(FUNCTION, CLASS, METHOD);

  private final String value;

  ChunkKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Whether this kind names a code entity (function, class or method). */
  public boolean isEntity() {
    return ENTITY_KINDS.contains(this);
  }

  @JsonCreator
  public static ChunkKind fromValue(String value) {
    for (ChunkKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Invalid chunk kind: " + value);
  }

  /**
   * Lenient parse used when reading store payloads: null, blank or unknown values map to {@link
   * #GENERIC} instead of failing.
   *
   * @param value the raw payload value
   * @return the matching kind, or GENERIC
   */
  public static ChunkKind fromPayload(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return GENERIC;
    }
    for (ChunkKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value.trim())) {
        return kind;
      }
    }
    return GENERIC;
  }
}
