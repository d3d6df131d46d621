package ca.gc.cra.trace.domain.graph;

/**
 * Traversal orders offered by {@link GraphNode#walk(TraversalOrder)} and {@link TraceGraph#walk(TraversalOrder)}.
 *
 * @since 0.1.0
 */
public enum TraversalOrder {
  /** Node before its children, depth first. */
  PRE,
  /** Children before the node, depth first; leaves come first. */
  POST,
  /** Breadth first, one depth level at a time. */
  LEVEL
}
