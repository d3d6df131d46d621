package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Payload of a journey node. */
public record JourneyPayload(Journey journey) implements NodePayload {

  public JourneyPayload {
    Objects.requireNonNull(journey, "journey");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.JOURNEY;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    if (field != ContentField.ADDRESSES) {
      return List.of();
    }
    int line = journey.location() == null ? 0 : journey.location().line();
    List<TargetRef> refs = new ArrayList<>();
    for (String target : journey.addresses()) {
      refs.add(TargetRef.of(target, line));
    }
    return refs;
  }
}
