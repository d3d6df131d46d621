/**
 * Per-node coverage and test rollup over distinct descendants.
 */
package ca.gc.cra.trace.application.metrics;
