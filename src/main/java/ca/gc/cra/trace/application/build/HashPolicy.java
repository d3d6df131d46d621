package ca.gc.cra.trace.application.build;

import java.util.Locale;

/**
 * How strictly stored content hashes are enforced.
 *
 * @since 0.1.0
 */
public enum HashPolicy {
  /** Mismatch is informational; a missing hash is ignored. */
  LENIENT,
  /** Mismatch is an error; a missing hash is a warning. */
  STRICT;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static HashPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return LENIENT;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("hashPolicy must be lenient or strict (was '" + raw + "')", ex);
    }
  }
}
