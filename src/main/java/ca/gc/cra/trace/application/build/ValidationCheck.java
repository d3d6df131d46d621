package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import java.util.function.Consumer;

/**
 * Independent structural check run by {@link GraphBuilder} after all edges are resolved. Checks only read the graph
 * and never abort a build; every finding is a {@link Diagnostic}.
 *
 * @since 0.1.0
 */
public interface ValidationCheck {

  /** Whether the schema's switches enable this check. */
  boolean enabled(CheckToggles toggles);

  /**
   * Inspects the graph.
   *
   * @param graph fully linked graph with roots computed
   * @param sink receives findings in report order
   */
  void run(TraceGraph graph, Consumer<Diagnostic> sink);
}
