package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.AssertionPayload;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.RequirementPayload;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.LevelRules;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Evaluates the schema's level rules on every edge of a level-checked relationship. An assertion end takes the level
 * of its owning requirement.
 *
 * @since 0.1.0
 */
final class LevelConstraintCheck implements ValidationCheck {

  @Override
  public boolean enabled(CheckToggles toggles) {
    return toggles.levelConstraint();
  }

  @Override
  public void run(TraceGraph graph, Consumer<Diagnostic> sink) {
    LevelRules rules = graph.schema().levelRules();
    for (Edge edge : graph.edges()) {
      Optional<RelationshipSchema> relationship = graph.schema().relationship(edge.relationship());
      if (relationship.isEmpty() || !relationship.get().levelChecked()) {
        continue;
      }
      GraphNode parent = graph.findById(edge.parentId()).orElseThrow();
      GraphNode child = graph.findById(edge.childId()).orElseThrow();
      Optional<Level> parentLevel = level(graph, parent);
      Optional<Level> childLevel = level(graph, child);
      if (parentLevel.isEmpty() || childLevel.isEmpty()) {
        continue;
      }
      if (!rules.allows(childLevel.get(), parentLevel.get())) {
        List<String> allowed = new ArrayList<>();
        for (Level level : rules.allowedParents(childLevel.get())) {
          allowed.add(level.shortName());
        }
        sink.accept(Diagnostic.warning(CheckName.LEVEL_CONSTRAINT, child.id(),
            child.id() + " (" + childLevel.get().shortName() + ") " + edge.relationship() + " " + parent.id()
                + " (" + parentLevel.get().shortName() + "); " + childLevel.get().shortName() + " may only "
                + edge.relationship() + " " + String.join(", ", allowed),
            child.location().orElse(null)));
      }
    }
  }

  private static Optional<Level> level(TraceGraph graph, GraphNode node) {
    if (node.payload() instanceof RequirementPayload requirement) {
      return Optional.of(requirement.requirement().level());
    }
    if (node.payload() instanceof AssertionPayload assertion) {
      return graph.findById(assertion.assertion().requirementId()).flatMap(owner -> level(graph, owner));
    }
    return Optional.empty();
  }
}
