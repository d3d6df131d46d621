package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.record.Journey;
import java.util.List;
import java.util.Objects;

/**
 * Journeys and diagnostics produced from one document.
 *
 * @param journeys journeys in document order
 * @param diagnostics parse diagnostics in line order
 * @since 0.1.0
 */
public record JourneyParseResult(List<Journey> journeys, List<Diagnostic> diagnostics) {

  public JourneyParseResult {
    journeys = List.copyOf(Objects.requireNonNull(journeys, "journeys"));
    diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
  }
}
