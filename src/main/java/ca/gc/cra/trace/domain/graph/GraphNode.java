package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Node of a {@link TraceGraph}: id, kind, label, source location, one typed payload, parent
 * and child links, and metrics once rollup has run.
 * <p><strong>Why:</strong> The hierarchy is a DAG, so a node keeps a list of parents rather than a single owner.</p>
 * <p><strong>Role:</strong> Created and linked only through {@link TraceGraph}; read-only after the graph is
 * frozen.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe while building; safe for concurrent reads once the owning
 * graph is frozen.</p>
 *
 * @since 0.1.0
 */
public final class GraphNode {
  private final TraceGraph owner;
  private final int index;
  private final String id;
  private final String label;
  private final SourceLocation location;
  private final NodePayload payload;
  private final List<GraphNode> parents = new ArrayList<>();
  private final List<GraphNode> children = new ArrayList<>();
  private final List<Edge> inEdges = new ArrayList<>();
  private final List<Edge> outEdges = new ArrayList<>();
  private NodeMetrics metrics;

  GraphNode(TraceGraph owner, int index, String id, String label, SourceLocation location, NodePayload payload) {
    this.owner = owner;
    this.index = index;
    this.id = Objects.requireNonNull(id, "id");
    this.label = label == null ? "" : label;
    this.location = location;
    this.payload = Objects.requireNonNull(payload, "payload");
  }

  /** Position in the owning graph's arena, stable for the graph's lifetime. */
  public int index() {
    return index;
  }

  public String id() {
    return id;
  }

  public NodeKind kind() {
    return payload.kind();
  }

  public String label() {
    return label;
  }

  public Optional<SourceLocation> location() {
    return Optional.ofNullable(location);
  }

  public NodePayload payload() {
    return payload;
  }

  /** Distinct parents in link order. */
  public List<GraphNode> parents() {
    return Collections.unmodifiableList(parents);
  }

  /** Distinct children in link order. */
  public List<GraphNode> children() {
    return Collections.unmodifiableList(children);
  }

  public List<Edge> inEdges() {
    return Collections.unmodifiableList(inEdges);
  }

  public List<Edge> outEdges() {
    return Collections.unmodifiableList(outEdges);
  }

  /** Distinct children reached through at least one out-edge matching {@code filter}. */
  public List<GraphNode> children(Predicate<Edge> filter) {
    Set<GraphNode> matched = new LinkedHashSet<>();
    for (Edge edge : outEdges) {
      if (filter.test(edge)) {
        owner.findById(edge.childId()).ifPresent(matched::add);
      }
    }
    return new ArrayList<>(matched);
  }

  /** Distinct parents reached through at least one in-edge matching {@code filter}. */
  public List<GraphNode> parents(Predicate<Edge> filter) {
    Set<GraphNode> matched = new LinkedHashSet<>();
    for (Edge edge : inEdges) {
      if (filter.test(edge)) {
        owner.findById(edge.parentId()).ifPresent(matched::add);
      }
    }
    return new ArrayList<>(matched);
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public Optional<NodeMetrics> metrics() {
    return Optional.ofNullable(metrics);
  }

  /**
   * Attaches computed metrics.
   *
   * @throws IllegalStateException when the owning graph is frozen
   */
  public void setMetrics(NodeMetrics metrics) {
    owner.checkMutable();
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Lazy walk of this node and its descendants, each visited once.
   *
   * @param order traversal order
   * @return restartable sequence; every {@code iterator()} call starts a fresh walk
   */
  public Iterable<GraphNode> walk(TraversalOrder order) {
    return NodeWalker.walk(List.of(this), order);
  }

  /** Distinct ancestors, nearest first. */
  public List<GraphNode> ancestors() {
    Set<GraphNode> seen = new LinkedHashSet<>();
    Deque<GraphNode> queue = new ArrayDeque<>(parents);
    while (!queue.isEmpty()) {
      GraphNode next = queue.poll();
      if (next != this && seen.add(next)) {
        queue.addAll(next.parents);
      }
    }
    return new ArrayList<>(seen);
  }

  public boolean hasAncestor(GraphNode candidate) {
    return ancestors().contains(candidate);
  }

  /** Descendants (this node included) matching {@code predicate}, in pre-order. */
  public List<GraphNode> find(Predicate<GraphNode> predicate) {
    List<GraphNode> found = new ArrayList<>();
    for (GraphNode node : walk(TraversalOrder.PRE)) {
      if (predicate.test(node)) {
        found.add(node);
      }
    }
    return found;
  }

  boolean attach(Edge edge, GraphNode child) {
    if (outEdges.contains(edge)) {
      return false;
    }
    outEdges.add(edge);
    child.inEdges.add(edge);
    if (!children.contains(child)) {
      children.add(child);
    }
    if (!child.parents.contains(this)) {
      child.parents.add(this);
    }
    return true;
  }

  @Override
  public String toString() {
    return kind() + "[" + id + "]";
  }
}
