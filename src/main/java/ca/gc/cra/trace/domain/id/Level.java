package ca.gc.cra.trace.domain.id;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Hierarchy levels a requirement can belong to.
 * <p><strong>Why:</strong> Level codes are embedded in identifiers and drive the level constraint check.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  /** Product requirements ({@code p}, PRD). */
  PRODUCT("p", "PRD", "Product"),
  /** Operational requirements ({@code o}, OPS). */
  OPERATIONAL("o", "OPS", "Operational"),
  /** Development requirements ({@code d}, DEV). */
  DEVELOPMENT("d", "DEV", "Development");

  private final String code;
  private final String shortName;
  private final String displayName;

  Level(String code, String shortName, String displayName) {
    this.code = code;
    this.shortName = shortName;
    this.displayName = displayName;
  }

  /** Single lower-case letter used inside identifiers. */
  public String code() {
    return code;
  }

  /** Three-letter name used in the {@code **Level**} metadata field. */
  public String shortName() {
    return shortName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Resolves a level from its identifier code, case-sensitive.
   *
   * @param code candidate code such as {@code "p"}
   * @return matching level or empty
   */
  public static Optional<Level> fromCode(String code) {
    for (Level level : values()) {
      if (level.code.equals(code)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a level from any accepted spelling (code, short name, display name), ignoring case.
   *
   * @param raw metadata value; may be {@code null}
   * @return matching level or empty
   */
  public static Optional<Level> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    for (Level level : values()) {
      if (level.code.equals(value)
          || level.shortName.toLowerCase(Locale.ROOT).equals(value)
          || level.displayName.toLowerCase(Locale.ROOT).equals(value)
          || level.name().toLowerCase(Locale.ROOT).equals(value)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }

  /** Spellings accepted by {@link #parse(String)}, used for correction hints. */
  public static List<String> keywords() {
    List<String> keywords = new ArrayList<>();
    for (Level level : values()) {
      keywords.add(level.shortName);
      keywords.add(level.displayName);
    }
    return List.copyOf(keywords);
  }
}
