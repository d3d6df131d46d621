package ca.gc.cra.trace.domain.diagnostic;

import java.util.Locale;

/**
 * Closed set of checks that can emit diagnostics.
 *
 * @since 0.1.0
 */
public enum CheckName {
  /** Requirement header or block that could not be parsed. */
  MALFORMED_BLOCK,
  /** Reference keyword or target identifier that could not be parsed. */
  MALFORMED_REFERENCE,
  /** Assertion list problems such as duplicate labels or non-lettered styles. */
  MALFORMED_ASSERTION,
  /** Metadata field problems such as an unknown status or a level disagreeing with the identifier. */
  METADATA,
  DUPLICATE_ID,
  CYCLE,
  ORPHAN,
  BROKEN_LINK,
  /** Unresolved target the author acknowledged in advance. */
  EXPECTED_BROKEN_LINK,
  /** Target resolved to a node kind the relationship does not permit. */
  KIND_MISMATCH,
  LEVEL_CONSTRAINT,
  COVERAGE_GAP,
  HASH_MISMATCH;

  /** Lower-case form used in metric names, e.g. {@code broken_link}. */
  public String metricSuffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
