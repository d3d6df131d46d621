package ca.gc.cra.trace.application.pipeline;

import ca.gc.cra.trace.application.parse.ParsedDocument;
import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one pipeline run.
 *
 * @param graph frozen graph with metrics attached
 * @param validation parse diagnostics followed by build diagnostics
 * @param documents per-document parse results in corpus order
 * @since 0.1.0
 */
public record TraceBuild(TraceGraph graph, ValidationResult validation, List<ParsedDocument> documents) {

  public TraceBuild {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(validation, "validation");
    documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
  }
}
