package ca.gc.cra.trace.domain.graph;

import ca.gc.cra.trace.domain.record.TestReference;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a test node.
 *
 * @param test test definition
 * @param resultIds node ids of the results produced by this test, assigned by the builder
 */
public record TestPayload(TestReference test, List<String> resultIds) implements NodePayload {

  public TestPayload {
    Objects.requireNonNull(test, "test");
    resultIds = List.copyOf(Objects.requireNonNull(resultIds, "resultIds"));
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TEST;
  }

  @Override
  public List<TargetRef> targets(ContentField field) {
    List<TargetRef> refs = new ArrayList<>();
    if (field == ContentField.VALIDATES) {
      for (String target : test.targets()) {
        refs.add(new TargetRef(target, test.line(), test.expectedBrokenTargets().contains(target)));
      }
    } else if (field == ContentField.RESULTS) {
      for (String resultId : resultIds) {
        refs.add(TargetRef.of(resultId, test.line()));
      }
    }
    return refs;
  }
}
