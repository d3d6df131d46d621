package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.record.CodeReference;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Payload of a code reference node. */
public record CodePayload(CodeReference code) implements NodePayload {

  public CodePayload {
    Objects.requireNonNull(code, "code");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CODE;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    if (field != ContentField.VALIDATES) {
      return List.of();
    }
    List<TargetRef> refs = new ArrayList<>();
    for (String target : code.targets()) {
      refs.add(new TargetRef(target, code.line(), code.expectedBrokenTargets().contains(target)));
    }
    return refs;
  }
}
