package ca.gc.cra.trace.application.port;

/**
 * <strong>What:</strong> Port abstracting build metrics emission.
 * <p><strong>Why:</strong> Lets the build pipeline record counters and observations without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for parsed documents, requirements and diagnostics.</li>
 *   <li>Record numeric observations such as build latency and graph size.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from parse workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code trace.build.latencyMs}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code trace.diagnostics.orphan}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value; unit defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
