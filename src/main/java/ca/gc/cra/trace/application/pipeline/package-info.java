/**
 * Build pipeline use case tying parsing, graph construction, validation and metrics rollup together.
 * <p><strong>Concurrency:</strong> Only document parsing runs on worker threads; everything after the merge is
 * single-writer.</p>
 * <p><strong>Metrics:</strong> Emits the {@code trace.*} counters and observations.</p>
 */
package ca.gc.cra.trace.application.pipeline;
