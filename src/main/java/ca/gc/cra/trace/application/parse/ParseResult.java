package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.requirement.Requirement;
import java.util.List;
import java.util.Objects;

/**
 * Requirements and diagnostics produced from one document.
 *
 * @param requirements requirements in document order
 * @param diagnostics parse diagnostics in line order
 * @since 0.1.0
 */
public record ParseResult(List<Requirement> requirements, List<Diagnostic> diagnostics) {

  public ParseResult {
    requirements = List.copyOf(Objects.requireNonNull(requirements, "requirements"));
    diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
  }
}
