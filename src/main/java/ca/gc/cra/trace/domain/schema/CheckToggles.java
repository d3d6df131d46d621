package ca.gc.cra.trace.domain.schema;

/**
 * Switches for the independent validation checks.
 *
 * @since 0.1.0
 */
public record CheckToggles(
    boolean duplicate,
    boolean cycle,
    boolean orphan,
    boolean brokenLink,
    boolean levelConstraint,
    boolean assertionCoverage,
    boolean hash) {

  public static CheckToggles allEnabled() {
    return new CheckToggles(true, true, true, true, true, true, true);
  }
}
