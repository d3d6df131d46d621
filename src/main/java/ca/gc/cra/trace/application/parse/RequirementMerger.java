package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.requirement.Requirement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Sequential merge of per-document parse results into one requirement set.
 *
 * <p>Runs on a single thread after all documents are parsed. The first requirement to claim an identifier, in
 * corpus order, wins; later claimants are kept but flagged with {@link Requirement#conflict()} so the builder can
 * report them and keep them out of the index.</p>
 *
 * @since 0.1.0
 */
public final class RequirementMerger {

  /**
   * Merged corpus.
   *
   * @param requirements every requirement in corpus order, later duplicates flagged as conflicting
   * @param journeys every journey in corpus order
   * @param diagnostics parse diagnostics in corpus order
   */
  public record Merged(List<Requirement> requirements, List<Journey> journeys, List<Diagnostic> diagnostics) {

    public Merged {
      requirements = List.copyOf(requirements);
      journeys = List.copyOf(journeys);
      diagnostics = List.copyOf(diagnostics);
    }

    public int conflictCount() {
      int count = 0;
      for (Requirement requirement : requirements) {
        if (requirement.conflict()) {
          count++;
        }
      }
      return count;
    }
  }

  public Merged merge(List<ParsedDocument> documents) {
    Objects.requireNonNull(documents, "documents");
    Set<String> claimed = new HashSet<>();
    List<Requirement> requirements = new ArrayList<>();
    List<Journey> journeys = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (ParsedDocument document : documents) {
      for (Requirement requirement : document.requirements()) {
        if (claimed.add(requirement.idText())) {
          requirements.add(requirement);
        } else {
          requirements.add(requirement.withConflict());
        }
      }
      journeys.addAll(document.journeys());
      diagnostics.addAll(document.diagnostics());
    }
    return new Merged(requirements, journeys, diagnostics);
  }
}
