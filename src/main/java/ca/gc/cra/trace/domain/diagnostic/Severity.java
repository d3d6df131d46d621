package ca.gc.cra.trace.domain.diagnostic;

/**
 * Diagnostic severity, most severe first.
 *
 * @since 0.1.0
 */
public enum Severity {
  ERROR,
  WARNING,
  INFO
}
