/**
 * Domain model of a traceability corpus: identifiers, parsed requirements, external records, the schema and the
 * graph built from them.
 * <p><strong>Role:</strong> Pure types with no I/O; application services populate and query them.</p>
 * <p><strong>Concurrency:</strong> Value types are immutable. {@code TraceGraph} is single-writer until frozen.</p>
 */
package ca.gc.cra.trace.domain;
