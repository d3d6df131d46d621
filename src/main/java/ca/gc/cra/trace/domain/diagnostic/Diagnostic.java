package ca.gc.cra.trace.domain.diagnostic;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.Objects;
import java.util.Optional;

/**
 * One problem found while parsing or validating.
 *
 * @param severity how serious the problem is
 * @param check check that produced it
 * @param nodeId affected node identifier; {@code null} when none applies
 * @param message human-readable explanation, including a correction hint when one is known
 * @param location source position; {@code null} when none applies
 * @since 0.1.0
 */
public record Diagnostic(
    Severity severity, CheckName check, String nodeId, String message, SourceLocation location) {

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(check, "check");
    Objects.requireNonNull(message, "message");
  }

  public static Diagnostic error(CheckName check, String nodeId, String message, SourceLocation location) {
    return new Diagnostic(Severity.ERROR, check, nodeId, message, location);
  }

  public static Diagnostic warning(CheckName check, String nodeId, String message, SourceLocation location) {
    return new Diagnostic(Severity.WARNING, check, nodeId, message, location);
  }

  public static Diagnostic info(CheckName check, String nodeId, String message, SourceLocation location) {
    return new Diagnostic(Severity.INFO, check, nodeId, message, location);
  }

  public Optional<String> nodeIdOptional() {
    return Optional.ofNullable(nodeId);
  }

  public Optional<SourceLocation> locationOptional() {
    return Optional.ofNullable(location);
  }

  @Override
  public String toString() {
    return severity + " " + check + (location == null ? "" : " " + location)
        + (nodeId == null ? "" : " [" + nodeId + "]") + ": " + message;
  }
}
