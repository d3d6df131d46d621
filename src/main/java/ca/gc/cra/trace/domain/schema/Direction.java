package ca.gc.cra.trace.domain.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Which end of a relationship is the parent.
 *
 * @since 0.1.0
 */
public enum Direction {
  /** The declaring node is the child; its targets are parents (e.g. a requirement implementing another). */
  UP,
  /** The declaring node is the parent; its targets are children (e.g. a test yielding results). */
  DOWN;

  public static Optional<Direction> fromName(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "up" -> Optional.of(UP);
      case "down" -> Optional.of(DOWN);
      default -> Optional.empty();
    };
  }
}
