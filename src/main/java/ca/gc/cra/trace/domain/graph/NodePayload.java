package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.List;

/**
 * Kind-specific content of a graph node. Exactly one variant exists per {@link NodeKind}; consumers switch over the
 * permitted subtypes.
 *
 * @since 0.1.0
 */
public sealed interface NodePayload
    permits RequirementPayload, AssertionPayload, CodePayload, TestPayload, TestResultPayload, JourneyPayload {

  NodeKind kind();

  /**
   * Target identifiers this payload supplies for a schema content field.
   *
   * @param field field named by a relationship
   * @return declared targets in declaration order; empty when this payload does not supply the field
   */
  List<TargetRef> targets(ContentField field);
}
