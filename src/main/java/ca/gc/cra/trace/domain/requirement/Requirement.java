package ca.gc.cra.trace.domain.requirement;

import ca.gc.cra.trace.domain.id.Identifier;
import ca.gc.cra.trace.domain.id.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Parsed requirement block.
 * <p><strong>Why:</strong> Single immutable unit exchanged between the document parser, the merger and the graph
 * builder.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; lists are copied on construction.</p>
 *
 * @param id whole-requirement identifier
 * @param title header title
 * @param level hierarchy level, taken from the identifier's level code
 * @param status declared lifecycle status
 * @param body normative free text without metadata, rationale or assertions
 * @param rationale non-normative rationale; empty when absent
 * @param assertions assertions in document order
 * @param references outbound references in document order
 * @param storedHash hash written in the end marker; {@code null} when absent
 * @param computedHash hash recomputed from the current title, body and assertions
 * @param location header line through end marker
 * @param tags declared tags
 * @param subdirectory directory classification derived from the document path; empty for top-level documents
 * @param conflict {@code true} when an earlier requirement already claimed the same identifier
 * @since 0.1.0
 */
public record Requirement(
    Identifier id,
    String title,
    Level level,
    RequirementStatus status,
    String body,
    String rationale,
    List<Assertion> assertions,
    List<Reference> references,
    String storedHash,
    String computedHash,
    SourceLocation location,
    List<String> tags,
    String subdirectory,
    boolean conflict) {

  public Requirement {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(computedHash, "computedHash");
    Objects.requireNonNull(location, "location");
    if (id.isAssertionScoped()) {
      throw new IllegalArgumentException("requirement id must not be assertion-scoped: " + id);
    }
    body = body == null ? "" : body;
    rationale = rationale == null ? "" : rationale;
    subdirectory = subdirectory == null ? "" : subdirectory;
    assertions = List.copyOf(Objects.requireNonNull(assertions, "assertions"));
    references = List.copyOf(Objects.requireNonNull(references, "references"));
    tags = List.copyOf(Objects.requireNonNull(tags, "tags"));
  }

  /** Canonical identifier text, the graph index key. */
  public String idText() {
    return id.toString();
  }

  public Optional<String> storedHashOptional() {
    return Optional.ofNullable(storedHash);
  }

  /** References of one kind, in declaration order. */
  public List<Reference> references(ReferenceKind kind) {
    List<Reference> matching = new ArrayList<>();
    for (Reference reference : references) {
      if (reference.kind() == kind) {
        matching.add(reference);
      }
    }
    return matching;
  }

  public Optional<Assertion> assertion(String label) {
    for (Assertion assertion : assertions) {
      if (assertion.label().equals(label)) {
        return Optional.of(assertion);
      }
    }
    return Optional.empty();
  }

  /** Copy with the conflict flag set. */
  public Requirement withConflict() {
    if (conflict) {
      return this;
    }
    return new Requirement(id, title, level, status, body, rationale, assertions, references, storedHash,
        computedHash, location, tags, subdirectory, true);
  }
}
