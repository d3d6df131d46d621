/**
 * Ports through which the build pipeline reaches metrics and time.
 * <p><strong>Role:</strong> Boundary between application services and infrastructure adapters.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.trace.application.port;
