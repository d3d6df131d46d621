package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.record.TestResult;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.List;
import java.util.Objects;

/** Payload of a test result node; linked from its test rather than declaring targets. */
public record TestResultPayload(TestResult result) implements NodePayload {

  public TestResultPayload {
    Objects.requireNonNull(result, "result");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TEST_RESULT;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    return List.of();
  }
}
