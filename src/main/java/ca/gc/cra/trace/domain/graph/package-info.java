/**
 * Arena-backed traceability graph.
 * <p><strong>Role:</strong> Nodes live in one list owned by {@code TraceGraph} and refer to each other by index, so
 * a node shared by several parents is stored once and edges never own their endpoints.</p>
 * <p><strong>Lifecycle:</strong> Built by {@code GraphBuilder}, annotated by {@code MetricsRollupEngine}, then frozen;
 * mutators throw after {@code freeze()}.</p>
 * <p><strong>Traversal:</strong> Walks are iterative and visit each node once, so cycles terminate.</p>
 */
package ca.gc.cra.trace.domain.graph;
