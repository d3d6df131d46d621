package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.AssertionPayload;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.RequirementPayload;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reports assertions that nothing validates or implements. Assertions marked {@code [expected-broken]} and
 * assertions of requirements whose status is excluded from rollup are skipped.
 *
 * @since 0.1.0
 */
final class AssertionCoverageCheck implements ValidationCheck {

  @Override
  public boolean enabled(CheckToggles toggles) {
    return toggles.assertionCoverage();
  }

  @Override
  public void run(TraceGraph graph, Consumer<Diagnostic> sink) {
    for (GraphNode node : graph.nodesByKind(NodeKind.ASSERTION)) {
      Assertion assertion = ((AssertionPayload) node.payload()).assertion();
      if (assertion.expectedBroken() || excluded(graph, assertion.requirementId()) || isCovered(graph, node)) {
        continue;
      }
      sink.accept(Diagnostic.info(CheckName.COVERAGE_GAP, node.id(),
          "assertion " + node.id() + " is not validated or implemented by anything", node.location().orElse(null)));
    }
  }

  /**
   * An assertion is covered when it has at least one child through a rollup edge, not counting requirements whose
   * status is excluded from rollup.
   */
  static boolean isCovered(TraceGraph graph, GraphNode assertion) {
    for (GraphNode child : assertion.children(Edge::rollup)) {
      if (!excluded(graph, child.id())) {
        return true;
      }
    }
    return false;
  }

  private static boolean excluded(TraceGraph graph, String nodeId) {
    Optional<GraphNode> owner = graph.findById(nodeId);
    return owner.isPresent()
        && owner.get().payload() instanceof RequirementPayload requirement
        && graph.schema().rollupExcludedStatuses().contains(requirement.requirement().status());
  }
}
