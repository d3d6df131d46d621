package ca.gc.cra.trace.domain.schema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the relationship table.
 *
 * @param name unique relationship name, e.g. {@code implements}
 * @param fromKinds kinds of the declaring node
 * @param toKinds kinds a target may resolve to
 * @param direction whether targets become parents ({@link Direction#UP}) or children ({@link Direction#DOWN})
 * @param sourceField payload field supplying target identifiers
 * @param rollup whether edges count toward coverage and pass-rate rollup
 * @param requiredForNonRoot whether an incoming edge of this relationship keeps its child from being an orphan
 * @param levelChecked whether requirement-to-requirement edges are subject to the level rules
 * @since 0.1.0
 */
public record RelationshipSchema(
    String name,
    Set<NodeKind> fromKinds,
    Set<NodeKind> toKinds,
    Direction direction,
    ContentField sourceField,
    boolean rollup,
    boolean requiredForNonRoot,
    boolean levelChecked) {

  public RelationshipSchema {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(sourceField, "sourceField");
    fromKinds = copyOf(fromKinds);
    toKinds = copyOf(toKinds);
  }

  private static Set<NodeKind> copyOf(Set<NodeKind> kinds) {
    if (kinds == null || kinds.isEmpty()) {
      return Collections.unmodifiableSet(EnumSet.noneOf(NodeKind.class));
    }
    return Collections.unmodifiableSet(EnumSet.copyOf(kinds));
  }

  /** Kinds that end up as the child of edges of this relationship. */
  public Set<NodeKind> childKinds() {
    return direction == Direction.UP ? fromKinds : toKinds;
  }

  /** Kinds that end up as the parent of edges of this relationship. */
  public Set<NodeKind> parentKinds() {
    return direction == Direction.UP ? toKinds : fromKinds;
  }
}
