/**
 * Application services that turn a document corpus and external records into a validated, measured graph.
 * <p><strong>Pipeline role:</strong> parse, merge, build, validate, roll up.</p>
 * <p><strong>Concurrency:</strong> Only parsing fans out; every later stage runs on the calling thread.</p>
 * <p><strong>Observability:</strong> Services log through SLF4J and report counters through {@code MetricsPort}.</p>
 */
package ca.gc.cra.trace.application;
