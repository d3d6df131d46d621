package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import java.util.Objects;

/**
 * Graph and diagnostics of one build; the graph is returned even when diagnostics report errors.
 *
 * @since 0.1.0
 */
public record BuildResult(TraceGraph graph, ValidationResult validation) {

  public BuildResult {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(validation, "validation");
  }
}
