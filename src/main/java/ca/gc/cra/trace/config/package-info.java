/**
 * Configuration records, loaders and composition root wiring for trace builds.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values are checked with the {@code ca.gc.cra.trace.validation} helpers before use.</p>
 */
package ca.gc.cra.trace.config;
