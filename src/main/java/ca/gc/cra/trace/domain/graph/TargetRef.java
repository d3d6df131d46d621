package ca.gc.cra.trace.domain.graph;

import java.util.Objects;

/**
 * Target identifier read from a payload field, with where it was declared.
 *
 * @param id target identifier as declared
 * @param line 1-based declaring line; {@code 0} when unknown
 * @param expectedBroken whether the declarer acknowledged the target as unresolvable
 * @since 0.1.0
 */
public record TargetRef(String id, int line, boolean expectedBroken) {

  public TargetRef {
    Objects.requireNonNull(id, "id");
  }

  public static TargetRef of(String id, int line) {
    return new TargetRef(id, line, false);
  }
}
