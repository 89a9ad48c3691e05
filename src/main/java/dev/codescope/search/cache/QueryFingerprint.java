package dev.codescope.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codescope.search.SearchQuery;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Static utility computing the cache key of a query: a SHA-256 hash over a canonical JSON
 * document of the normalised query text, the three filters, the limit and the threshold.
 *
 * <p>Toggles (hybrid, rerank, preferences) are not part of the key.
 */
public final class QueryFingerprint {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private QueryFingerprint() {
    // utility class
  }

  /**
   * Computes the fingerprint of a query.
   *
   * @param query the query to fingerprint
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String of(SearchQuery query) {
    Key key =
        new Key(
            query.query().trim().toLowerCase(Locale.ROOT),
            query.language() != null ? query.language() : "",
            query.chunkKind() != null ? query.chunkKind().value() : "",
            query.filePath() != null ? query.filePath() : "",
            query.limit(),
            query.threshold());
    try {
      return sha256(MAPPER.writeValueAsString(key));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise query fingerprint", e);
    }
  }

  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** Canonical key document; field order is fixed by the record declaration. */
  private record Key(
      String query,
      String language,
      String chunkKind,
      String filePath,
      int limit,
      double threshold) {}
}
