/**
 * Adapters behind the application ports: metrics export, wall clock, worker pools and JSON output.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe unless their class documentation says otherwise.</p>
 */
package ca.gc.cra.trace.infrastructure;
