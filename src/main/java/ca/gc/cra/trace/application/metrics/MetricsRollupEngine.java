package ca.gc.cra.trace.application.metrics;

import ca.gc.cra.trace.domain.graph.AssertionPayload;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.NodeMetrics;
import ca.gc.cra.trace.domain.graph.RequirementPayload;
import ca.gc.cra.trace.domain.graph.TestResultPayload;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.record.TestStatus;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes {@link NodeMetrics} for every node of a built graph, then freezes the graph.
 * <p><strong>Why:</strong> A descendant reachable through several paths must be counted once. Each node's metrics
 * derive from the set of its distinct rollup descendants rather than from sums carried up every path.</p>
 * <p><strong>Role:</strong> Final stage of a build, after validation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Memoize descendant sets in one post-order pass, each set being the union of the children and their sets.</li>
 *   <li>Skip requirements whose status is excluded from rollup when unioning into ancestors.</li>
 *   <li>Derive assertion coverage, test status totals and percentages from the deduplicated set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share. The graph passed in must not be used concurrently
 * until this call returns.</p>
 * <p><strong>Performance:</strong> Descendant sets are {@link BitSet}s indexed by arena position, so a union is a
 * word-wise OR. Memory is quadratic in the node count in the worst case.</p>
 * <p><strong>Observability:</strong> Logs node count and elapsed time at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class MetricsRollupEngine {
  private static final Logger log = LoggerFactory.getLogger(MetricsRollupEngine.class);

  private static final byte WHITE = 0;
  private static final byte GRAY = 1;
  private static final byte BLACK = 2;

  /**
   * Annotates every node with its rolled-up metrics and freezes the graph.
   *
   * @param graph built graph, not yet frozen
   * @throws IllegalStateException when the graph is already frozen
   */
  public void compute(TraceGraph graph) {
    Objects.requireNonNull(graph, "graph");
    if (graph.isFrozen()) {
      throw new IllegalStateException("metrics already computed for this graph");
    }
    long started = System.nanoTime();
    int size = graph.size();
    Set<RequirementStatus> excluded = graph.schema().rollupExcludedStatuses();

    boolean[] skipped = new boolean[size];
    for (GraphNode node : graph.nodes()) {
      skipped[node.index()] = node.payload() instanceof RequirementPayload requirement
          && excluded.contains(requirement.requirement().status());
    }

    BitSet[] descendants = descendantSets(graph, skipped);
    NodeFacts facts = NodeFacts.of(graph, skipped);
    for (GraphNode node : graph.nodes()) {
      BitSet scope = (BitSet) descendants[node.index()].clone();
      scope.set(node.index());
      node.setMetrics(facts.summarize(scope, node.index()));
    }
    graph.freeze();
    log.debug("Rolled up metrics for {} nodes in {} ms", size, (System.nanoTime() - started) / 1_000_000L);
  }

  /**
   * Post-order over rollup edges from every node. A child still on the stack closes a cycle and is left out of
   * the current node's set; the cycle itself is reported by validation.
   */
  private static BitSet[] descendantSets(TraceGraph graph, boolean[] skipped) {
    int size = graph.size();
    BitSet[] sets = new BitSet[size];
    byte[] color = new byte[size];
    List<GraphNode> stack = new ArrayList<>();
    List<Iterator<GraphNode>> pending = new ArrayList<>();
    for (GraphNode start : graph.nodes()) {
      if (color[start.index()] != WHITE) {
        continue;
      }
      color[start.index()] = GRAY;
      stack.add(start);
      pending.add(start.children(Edge::rollup).iterator());
      while (!stack.isEmpty()) {
        int top = stack.size() - 1;
        GraphNode node = stack.get(top);
        Iterator<GraphNode> children = pending.get(top);
        if (children.hasNext()) {
          GraphNode child = children.next();
          if (color[child.index()] == WHITE) {
            color[child.index()] = GRAY;
            stack.add(child);
            pending.add(child.children(Edge::rollup).iterator());
          }
          continue;
        }
        BitSet set = new BitSet(size);
        for (GraphNode child : node.children(Edge::rollup)) {
          int c = child.index();
          if (color[c] != BLACK || skipped[c]) {
            continue;
          }
          set.set(c);
          set.or(sets[c]);
        }
        sets[node.index()] = set;
        color[node.index()] = BLACK;
        stack.remove(top);
        pending.remove(top);
      }
    }
    return sets;
  }

  /** Per-node attributes precomputed once so each summary is a scan over set bits. */
  private static final class NodeFacts {
    private final NodeKind[] kinds;
    private final boolean[] covered;
    private final boolean[] directCovered;
    private final boolean[] inferredCovered;
    private final TestStatus[] testStatus;
    private final boolean[] excluded;

    private NodeFacts(int size, boolean[] excluded) {
      this.excluded = excluded;
      kinds = new NodeKind[size];
      covered = new boolean[size];
      directCovered = new boolean[size];
      inferredCovered = new boolean[size];
      testStatus = new TestStatus[size];
    }

    static NodeFacts of(TraceGraph graph, boolean[] excluded) {
      NodeFacts facts = new NodeFacts(graph.size(), excluded);
      for (GraphNode node : graph.nodes()) {
        int i = node.index();
        facts.kinds[i] = node.kind();
        switch (node.kind()) {
          case ASSERTION -> facts.assertion(graph, node);
          case TEST -> facts.testStatus[i] = aggregate(node);
          default -> {
            // no per-node facts
          }
        }
      }
      return facts;
    }

    private void assertion(TraceGraph graph, GraphNode node) {
      int i = node.index();
      for (GraphNode coverer : node.children(Edge::rollup)) {
        if (excluded[coverer.index()]) {
          continue;
        }
        covered[i] = true;
        if (coverer.kind() == NodeKind.TEST || coverer.kind() == NodeKind.CODE) {
          directCovered[i] = true;
        }
      }
      if (!covered[i]) {
        String owner = ((AssertionPayload) node.payload()).assertion().requirementId();
        inferredCovered[i] = graph.findById(owner)
            .map(this::validatedWhole)
            .orElse(false);
      }
    }

    private boolean validatedWhole(GraphNode requirement) {
      for (GraphNode child : requirement.children(Edge::rollup)) {
        if (child.kind() != NodeKind.ASSERTION && !excluded[child.index()]) {
          return true;
        }
      }
      return false;
    }

    /** Failed beats passed beats skipped; a test without results is unknown. */
    private static TestStatus aggregate(GraphNode test) {
      boolean passed = false;
      boolean skipped = false;
      for (GraphNode child : test.children(Edge::rollup)) {
        if (!(child.payload() instanceof TestResultPayload result)) {
          continue;
        }
        switch (result.result().status()) {
          case FAILED -> {
            return TestStatus.FAILED;
          }
          case PASSED -> passed = true;
          case SKIPPED -> skipped = true;
          default -> {
            // unknown results do not change the aggregate
          }
        }
      }
      if (passed) {
        return TestStatus.PASSED;
      }
      return skipped ? TestStatus.SKIPPED : TestStatus.UNKNOWN;
    }

    NodeMetrics summarize(BitSet scope, int self) {
      int assertions = 0;
      int coveredCount = 0;
      int direct = 0;
      int explicit = 0;
      int inferred = 0;
      int requirements = 0;
      int tests = 0;
      int passed = 0;
      int failed = 0;
      int skipped = 0;
      int unknown = 0;
      int results = 0;
      int code = 0;
      for (int i = scope.nextSetBit(0); i >= 0; i = scope.nextSetBit(i + 1)) {
        switch (kinds[i]) {
          case ASSERTION -> {
            assertions++;
            if (covered[i]) {
              coveredCount++;
              if (directCovered[i]) {
                direct++;
              } else {
                explicit++;
              }
            } else if (inferredCovered[i]) {
              inferred++;
            }
          }
          case REQUIREMENT -> {
            if (i != self) {
              requirements++;
            }
          }
          case TEST -> {
            tests++;
            switch (testStatus[i]) {
              case PASSED -> passed++;
              case FAILED -> failed++;
              case SKIPPED -> skipped++;
              default -> unknown++;
            }
          }
          case TEST_RESULT -> results++;
          case CODE -> code++;
          default -> {
            // journeys carry no counts
          }
        }
      }
      return new NodeMetrics(assertions, coveredCount, direct, explicit, inferred, requirements, tests, passed,
          failed, skipped, unknown, results, code, NodeMetrics.percent(coveredCount, assertions),
          NodeMetrics.percent(passed, tests));
    }
  }
}
