package ca.gc.cra.trace.domain.schema;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Payload fields a relationship can read its target identifiers from, with the node kinds whose payload supplies
 * each field.
 *
 * @since 0.1.0
 */
public enum ContentField {
  /** Requirement {@code Implements} references. */
  IMPLEMENTS(EnumSet.of(NodeKind.REQUIREMENT)),
  /** Requirement {@code Refines} references. */
  REFINES(EnumSet.of(NodeKind.REQUIREMENT)),
  /** Journeys addressed by a requirement, or requirements scoped by a journey. */
  ADDRESSES(EnumSet.of(NodeKind.REQUIREMENT, NodeKind.JOURNEY)),
  /** Targets declared by tests and code references. */
  VALIDATES(EnumSet.of(NodeKind.TEST, NodeKind.CODE)),
  /** Assertion ids owned by a requirement. */
  ASSERTIONS(EnumSet.of(NodeKind.REQUIREMENT)),
  /** Result node ids produced by a test. */
  RESULTS(EnumSet.of(NodeKind.TEST));

  private final Set<NodeKind> suppliedBy;

  ContentField(Set<NodeKind> suppliedBy) {
    this.suppliedBy = suppliedBy;
  }

  public boolean isSuppliedBy(NodeKind kind) {
    return suppliedBy.contains(kind);
  }

  public Set<NodeKind> suppliedBy() {
    return EnumSet.copyOf(suppliedBy);
  }

  public static Optional<ContentField> fromName(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (ContentField field : values()) {
      if (field.name().equals(normalized)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}
