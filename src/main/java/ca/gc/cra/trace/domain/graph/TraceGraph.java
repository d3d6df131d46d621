package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.domain.schema.NodeKind;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Owning container of one build's nodes and edges.
 * <p><strong>Why:</strong> Nodes live in an index-addressable arena with an id index for constant-time lookup, so
 * shared descendants and multi-parent links need no ownership tricks.</p>
 * <p><strong>Role:</strong> Populated by the graph builder, annotated by the metrics rollup, then frozen and handed
 * to readers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Insert nodes by kind and link them idempotently.</li>
 *   <li>Keep conflicting requirements out of the index while retaining them for diagnostics.</li>
 *   <li>Offer lookups and lazy, restartable walks in pre, post and level order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single writer while building. After {@link #freeze()} every mutator throws
 * {@link IllegalStateException} and concurrent reads need no locking.</p>
 *
 * @since 0.1.0
 */
public final class TraceGraph {
  private final GraphSchema schema;
  private final List<GraphNode> arena = new ArrayList<>();
  private final Map<String, GraphNode> index = new HashMap<>();
  private final Set<Edge> edges = new LinkedHashSet<>();
  private final List<Requirement> conflicts = new ArrayList<>();
  private List<GraphNode> roots = List.of();
  private ValidationResult validation = ValidationResult.empty();
  private volatile boolean frozen;

  public TraceGraph(GraphSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public GraphSchema schema() {
    return schema;
  }

  /**
   * Adds and indexes a node.
   *
   * @throws IllegalStateException when the id is already indexed or the graph is frozen
   */
  public GraphNode addNode(String id, String label, SourceLocation location, NodePayload payload) {
    checkMutable();
    Objects.requireNonNull(id, "id");
    if (index.containsKey(id)) {
      throw new IllegalStateException("node already indexed: " + id);
    }
    GraphNode node = new GraphNode(this, arena.size(), id, label, location, payload);
    arena.add(node);
    index.put(id, node);
    return node;
  }

  /**
   * Links {@code parent} to {@code child} under a relationship. Linking the same pair under the same relationship
   * again is a no-op.
   *
   * @return {@code true} when a new edge was created
   */
  public boolean link(GraphNode parent, GraphNode child, RelationshipSchema relationship) {
    checkMutable();
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(child, "child");
    Objects.requireNonNull(relationship, "relationship");
    if (parent.index() >= arena.size() || arena.get(parent.index()) != parent
        || child.index() >= arena.size() || arena.get(child.index()) != child) {
      throw new IllegalArgumentException("nodes belong to another graph");
    }
    Edge edge = new Edge(parent.id(), child.id(), relationship.name(), relationship.rollup());
    if (!parent.attach(edge, child)) {
      return false;
    }
    edges.add(edge);
    return true;
  }

  /** Retains a conflicting requirement outside the index. */
  public void addConflict(Requirement requirement) {
    checkMutable();
    conflicts.add(Objects.requireNonNull(requirement, "requirement"));
  }

  /**
   * Recomputes the root set: nodes with no incoming edge of a relationship that is required for non-root nodes,
   * sorted by id.
   */
  public void computeRoots() {
    checkMutable();
    List<GraphNode> found = new ArrayList<>();
    for (GraphNode node : arena) {
      if (!hasRequiredParent(node)) {
        found.add(node);
      }
    }
    found.sort(Comparator.comparing(GraphNode::id));
    roots = List.copyOf(found);
  }

  /** Whether {@code node} has a parent through a relationship marked required for non-root nodes. */
  public boolean hasRequiredParent(GraphNode node) {
    for (Edge edge : node.inEdges()) {
      Optional<RelationshipSchema> relationship = schema.relationship(edge.relationship());
      if (relationship.isPresent() && relationship.get().requiredForNonRoot()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the schema declares {@code node} a root, by kind or, for requirements, by level. Declared roots are
   * never orphans.
   */
  public boolean isDeclaredRoot(GraphNode node) {
    if (schema.rootKinds().contains(node.kind())) {
      return true;
    }
    return node.payload() instanceof RequirementPayload requirement
        && schema.rootLevels().contains(requirement.requirement().level());
  }

  public void setValidation(ValidationResult validation) {
    checkMutable();
    this.validation = Objects.requireNonNull(validation, "validation");
  }

  /** Marks the graph read-only. Idempotent. */
  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  void checkMutable() {
    if (frozen) {
      throw new IllegalStateException("graph is frozen");
    }
  }

  public Optional<GraphNode> findById(String id) {
    return Optional.ofNullable(index.get(id));
  }

  /** Node at an arena position. */
  public GraphNode node(int position) {
    return arena.get(position);
  }

  /** All indexed nodes in insertion order. */
  public List<GraphNode> nodes() {
    return Collections.unmodifiableList(arena);
  }

  public int size() {
    return arena.size();
  }

  public List<GraphNode> nodesByKind(NodeKind kind) {
    List<GraphNode> out = new ArrayList<>();
    for (GraphNode node : arena) {
      if (node.kind() == kind) {
        out.add(node);
      }
    }
    return out;
  }

  /** Nodes matching {@code predicate}, in insertion order. */
  public List<GraphNode> find(Predicate<GraphNode> predicate) {
    List<GraphNode> out = new ArrayList<>();
    for (GraphNode node : arena) {
      if (predicate.test(node)) {
        out.add(node);
      }
    }
    return out;
  }

  /** Edges in creation order. */
  public Set<Edge> edges() {
    return Collections.unmodifiableSet(edges);
  }

  public List<GraphNode> roots() {
    return roots;
  }

  /** Requirements that lost an identifier to an earlier claimant, in parse order. */
  public List<Requirement> conflicts() {
    return Collections.unmodifiableList(conflicts);
  }

  public ValidationResult validation() {
    return validation;
  }

  /**
   * Lazy walk from every root; nodes reachable from several roots are produced once.
   *
   * @param order traversal order
   * @return restartable sequence; every {@code iterator()} call starts a fresh walk
   */
  public Iterable<GraphNode> walk(TraversalOrder order) {
    return NodeWalker.walk(roots, order);
  }

  @Override
  public String toString() {
    return "TraceGraph{nodes=" + arena.size() + ", edges=" + edges.size() + ", roots=" + roots.size()
        + ", conflicts=" + conflicts.size() + "}";
  }
}
