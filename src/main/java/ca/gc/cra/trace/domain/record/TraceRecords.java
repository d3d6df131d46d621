package ca.gc.cra.trace.domain.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * External records supplied by adapters alongside the document corpus.
 *
 * @param codeReferences code locations implementing requirements
 * @param testReferences test definitions validating requirements
 * @param testResults execution outcomes keyed to test references
 * @param journeys user journeys
 * @since 0.1.0
 */
public record TraceRecords(
    List<CodeReference> codeReferences,
    List<TestReference> testReferences,
    List<TestResult> testResults,
    List<Journey> journeys) {

  public TraceRecords {
    codeReferences = List.copyOf(Objects.requireNonNull(codeReferences, "codeReferences"));
    testReferences = List.copyOf(Objects.requireNonNull(testReferences, "testReferences"));
    testResults = List.copyOf(Objects.requireNonNull(testResults, "testResults"));
    journeys = List.copyOf(Objects.requireNonNull(journeys, "journeys"));
  }

  public static TraceRecords empty() {
    return new TraceRecords(List.of(), List.of(), List.of(), List.of());
  }

  /** Copy with additional journeys appended, used to merge journeys parsed from documents. */
  public TraceRecords withJourneys(List<Journey> more) {
    if (more.isEmpty()) {
      return this;
    }
    List<Journey> merged = new ArrayList<>(journeys);
    merged.addAll(more);
    return new TraceRecords(codeReferences, testReferences, testResults, merged);
  }

  public int size() {
    return codeReferences.size() + testReferences.size() + testResults.size() + journeys.size();
  }
}
