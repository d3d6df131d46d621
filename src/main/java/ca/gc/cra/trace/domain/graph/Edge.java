package ca.gc.cra.trace.domain.graph;

import java.util.Objects;

/**
 * Directed parent-to-child edge; two edges are the same when all components are equal.
 *
 * @param parentId parent node id
 * @param childId child node id
 * @param relationship schema relationship name
 * @param rollup whether the relationship counts toward metrics rollup
 * @since 0.1.0
 */
public record Edge(String parentId, String childId, String relationship, boolean rollup) {

  public Edge {
    Objects.requireNonNull(parentId, "parentId");
    Objects.requireNonNull(childId, "childId");
    Objects.requireNonNull(relationship, "relationship");
  }

  @Override
  public String toString() {
    return parentId + " -" + relationship + "-> " + childId;
  }
}
