/**
 * Graph construction and validation.
 * <p><strong>Role:</strong> {@code GraphBuilder} interprets the schema to create nodes and edges, then runs each
 * {@code ValidationCheck} in turn. Checks only read the graph and append diagnostics; none of them throws for bad
 * input.</p>
 * <p><strong>Determinism:</strong> Nodes, edges and diagnostics come out in input order, so building the same input
 * twice yields the same result.</p>
 */
package ca.gc.cra.trace.application.build;
