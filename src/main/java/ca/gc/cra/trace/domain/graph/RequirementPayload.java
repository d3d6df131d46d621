package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.Reference;
import ca.gc.cra.trace.domain.requirement.ReferenceKind;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Payload of a requirement node. */
public record RequirementPayload(Requirement requirement) implements NodePayload {

  public RequirementPayload {
    Objects.requireNonNull(requirement, "requirement");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.REQUIREMENT;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    return switch (field) {
      case IMPLEMENTS -> references(ReferenceKind.IMPLEMENTS);
      case REFINES -> references(ReferenceKind.REFINES);
      case ADDRESSES -> references(ReferenceKind.ADDRESSES);
      case ASSERTIONS -> {
        List<TargetRef> ids = new ArrayList<>();
        for (Assertion assertion : requirement.assertions()) {
          ids.add(TargetRef.of(assertion.id(), assertion.line()));
        }
        yield ids;
      }
      case VALIDATES, RESULTS -> List.of();
    };
  }

  private List<TargetRef> references(ReferenceKind kind) {
    List<TargetRef> refs = new ArrayList<>();
    for (Reference reference : requirement.references(kind)) {
      refs.add(TargetRef.of(reference.target(), reference.line()));
    }
    return refs;
  }
}
