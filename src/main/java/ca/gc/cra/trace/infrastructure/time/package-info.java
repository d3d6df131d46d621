/**
 * Time sources implementing {@link ca.gc.cra.trace.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.trace.infrastructure.time;
