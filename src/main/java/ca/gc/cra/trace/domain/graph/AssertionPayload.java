package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.List;
import java.util.Objects;

/** Payload of an assertion node; declares no targets of its own. */
public record AssertionPayload(Assertion assertion) implements NodePayload {

  public AssertionPayload {
    Objects.requireNonNull(assertion, "assertion");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ASSERTION;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    return List.of();
  }
}
