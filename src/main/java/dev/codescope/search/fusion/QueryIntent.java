package dev.codescope.search.fusion;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Classifies query text to shift the dense/keyword weight. */
final class QueryIntent {

  static final double SEMANTIC_SHIFT = 0.1;
  static final double IDENTIFIER_SHIFT = -0.2;

  private static final List<String> SEMANTIC_PHRASES =
      List.of(
          "how to",
          "what is",
          "explain",
          "implement",
          "create",
          "build",
          "algorithm",
          "pattern",
          "similar to",
          "like",
          "example");

  private static final List<Pattern> IDENTIFIER_PATTERNS =
      List.of(
          Pattern.compile("[a-z][A-Z]"), // camelCase
          Pattern.compile("_[a-z]"), // snake_case
          Pattern.compile("^[A-Z][a-z]+$"), // PascalCase word
          Pattern.compile("^\\w+\\(\\)$"), // call
          Pattern.compile("^[\\w.]+$")); // single token or dotted path

  private QueryIntent() {}

  static boolean isSemantic(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    return SEMANTIC_PHRASES.stream().anyMatch(lower::contains);
  }

  static boolean isIdentifier(String query) {
    String trimmed = query.trim();
    return IDENTIFIER_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).find());
  }

  /** Adjusts a base alpha for the query; the identifier rule wins over the semantic one. */
  static double adjust(double alpha, String query) {
    if (isIdentifier(query)) {
      return Math.max(0.0, alpha + IDENTIFIER_SHIFT);
    }
    if (isSemantic(query)) {
      return Math.min(1.0, alpha + SEMANTIC_SHIFT);
    }
    return alpha;
  }
}
