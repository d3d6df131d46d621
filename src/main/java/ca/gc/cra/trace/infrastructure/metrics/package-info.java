/**
 * Metrics adapters that bridge {@link ca.gc.cra.trace.application.port.MetricsPort} to OpenTelemetry or no-op
 * implementations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per metric name.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code trace.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported; requirement text never leaves the
 * process.</p>
 */
package ca.gc.cra.trace.infrastructure.metrics;
