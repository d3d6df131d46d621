package ca.gc.cra.trace.domain.requirement;

import java.util.Objects;

/**
 * Outbound reference declared by a requirement.
 *
 * @param kind relationship keyword the reference was declared under
 * @param target canonical target identifier text (journey id for {@link ReferenceKind#ADDRESSES})
 * @param line 1-based line of the declaring metadata line
 * @since 0.1.0
 */
public record Reference(ReferenceKind kind, String target, int line) {

  public Reference {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
  }
}
