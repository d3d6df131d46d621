/**
 * Executor factories for build worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the document parse pool.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return executors owned by the caller.</p>
 */
package ca.gc.cra.trace.infrastructure.exec;
