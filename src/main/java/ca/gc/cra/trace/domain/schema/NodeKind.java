package ca.gc.cra.trace.domain.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of graph node; each kind carries exactly one payload type.
 *
 * @since 0.1.0
 */
public enum NodeKind {
  REQUIREMENT,
  ASSERTION,
  CODE,
  TEST,
  TEST_RESULT,
  JOURNEY;

  /**
   * Resolves a kind from configuration text such as {@code test_result} or {@code test-result}.
   *
   * @param raw kind name; may be {@code null}
   * @return matching kind or empty
   */
  public static Optional<NodeKind> fromName(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (NodeKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
