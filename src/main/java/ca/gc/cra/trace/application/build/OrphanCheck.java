package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.NodeKind;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reports nodes of an orphan-checked kind that have no parent through a required relationship and are not declared
 * roots.
 *
 * @since 0.1.0
 */
final class OrphanCheck implements ValidationCheck {

  @Override
  public boolean enabled(CheckToggles toggles) {
    return toggles.orphan();
  }

  @Override
  public void run(TraceGraph graph, Consumer<Diagnostic> sink) {
    Set<NodeKind> checked = graph.schema().orphanCheckedKinds();
    for (GraphNode node : graph.nodes()) {
      if (!checked.contains(node.kind()) || graph.hasRequiredParent(node) || graph.isDeclaredRoot(node)) {
        continue;
      }
      sink.accept(Diagnostic.warning(CheckName.ORPHAN, node.id(),
          node.id() + " has no " + String.join("/", satisfying(graph, node.kind()))
              + " parent and is not a declared root",
          node.location().orElse(null)));
    }
  }

  private static List<String> satisfying(TraceGraph graph, NodeKind kind) {
    List<String> names = new ArrayList<>();
    for (RelationshipSchema relationship : graph.schema().relationships()) {
      if (relationship.requiredForNonRoot() && relationship.childKinds().contains(kind)) {
        names.add(relationship.name());
      }
    }
    return names;
  }
}
