package ca.gc.cra.trace.domain.schema;

/**
 * Raised when a graph schema is internally inconsistent; the only failure that aborts a build.
 *
 * @since 0.1.0
 */
public class SchemaViolationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public SchemaViolationException(String message) {
    super(message);
  }
}
