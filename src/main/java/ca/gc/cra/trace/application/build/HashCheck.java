package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.RequirementPayload;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Compares each requirement's stored hash with the hash recomputed from its current content, with severity set by
 * the {@link HashPolicy}.
 *
 * @since 0.1.0
 */
final class HashCheck implements ValidationCheck {
  private final HashPolicy policy;

  HashCheck(HashPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  public boolean enabled(CheckToggles toggles) {
    return toggles.hash();
  }

  @Override
  public void run(TraceGraph graph, Consumer<Diagnostic> sink) {
    for (GraphNode node : graph.nodesByKind(NodeKind.REQUIREMENT)) {
      Requirement requirement = ((RequirementPayload) node.payload()).requirement();
      String stored = requirement.storedHash();
      if (stored == null) {
        if (policy == HashPolicy.STRICT) {
          sink.accept(Diagnostic.warning(CheckName.HASH_MISMATCH, node.id(),
              node.id() + " has no stored hash; expected " + requirement.computedHash(), requirement.location()));
        }
        continue;
      }
      if (stored.equalsIgnoreCase(requirement.computedHash())) {
        continue;
      }
      String message = node.id() + " stored hash " + stored + " differs from computed " + requirement.computedHash()
          + "; content changed without regenerating the hash";
      sink.accept(policy == HashPolicy.STRICT
          ? Diagnostic.error(CheckName.HASH_MISMATCH, node.id(), message, requirement.location())
          : Diagnostic.info(CheckName.HASH_MISMATCH, node.id(), message, requirement.location()));
    }
  }
}
