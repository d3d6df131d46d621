package ca.gc.cra.trace.domain.requirement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status declared in a requirement's {@code **Status**} field.
 *
 * @since 0.1.0
 */
public enum RequirementStatus {
  ACTIVE("Active"),
  DRAFT("Draft"),
  DEPRECATED("Deprecated"),
  SUPERSEDED("Superseded"),
  PROPOSED("Proposed"),
  /** Status missing or not recognised. */
  UNKNOWN("Unknown");

  private final String displayName;

  RequirementStatus(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Resolves a status from its display name, ignoring case.
   *
   * @param raw metadata value; may be {@code null}
   * @return matching status, never {@link #UNKNOWN}
   */
  public static Optional<RequirementStatus> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    for (RequirementStatus status : values()) {
      if (status != UNKNOWN && status.displayName.toLowerCase(Locale.ROOT).equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }

  /** Display names of the declarable statuses. */
  public static List<String> keywords() {
    List<String> keywords = new ArrayList<>();
    for (RequirementStatus status : values()) {
      if (status != UNKNOWN) {
        keywords.add(status.displayName);
      }
    }
    return List.copyOf(keywords);
  }
}
