package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.requirement.Requirement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything read from one document.
 *
 * @param path document path
 * @param requirements requirements in document order
 * @param journeys journeys in document order
 * @param diagnostics requirement diagnostics followed by journey diagnostics
 * @since 0.1.0
 */
public record ParsedDocument(
    String path, List<Requirement> requirements, List<Journey> journeys, List<Diagnostic> diagnostics) {

  public ParsedDocument {
    Objects.requireNonNull(path, "path");
    requirements = List.copyOf(Objects.requireNonNull(requirements, "requirements"));
    journeys = List.copyOf(Objects.requireNonNull(journeys, "journeys"));
    diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
  }

  static ParsedDocument of(String path, ParseResult requirements, JourneyParseResult journeys) {
    List<Diagnostic> diagnostics = new ArrayList<>(requirements.diagnostics());
    diagnostics.addAll(journeys.diagnostics());
    return new ParsedDocument(path, requirements.requirements(), journeys.journeys(), diagnostics);
  }
}
