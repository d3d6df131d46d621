package ca.gc.cra.trace;

import ca.gc.cra.trace.domain.id.Identifier;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.record.CodeReference;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.record.TestReference;
import ca.gc.cra.trace.domain.record.TestResult;
import ca.gc.cra.trace.domain.record.TestStatus;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.ContentHasher;
import ca.gc.cra.trace.domain.requirement.Reference;
import ca.gc.cra.trace.domain.requirement.ReferenceKind;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for requirements and external records used across test packages.
 */
public final class TraceFixtures {
  private static final IdentifierGrammar GRAMMAR = new IdentifierGrammar();
  private static final ContentHasher HASHER = new ContentHasher();

  private TraceFixtures() {}

  public static RequirementBuilder requirement(String id) {
    return new RequirementBuilder(GRAMMAR.tryParse(id).orElseThrow(
        () -> new IllegalArgumentException("bad fixture id " + id)));
  }

  public static TestReference test(String name, String... targets) {
    return new TestReference("tests/test_trace.py", 10, name, null, List.of(targets));
  }

  public static TestResult result(TestReference test, TestStatus status) {
    return new TestResult(test.key(), status);
  }

  public static CodeReference code(String file, int line, String... targets) {
    return new CodeReference(file, line, null, List.of(targets));
  }

  public static Journey journey(String id, String... addresses) {
    return new Journey(id, "Journey " + id, "Taxpayer", "Finish the task", List.of(), List.of(addresses),
        SourceLocation.of("spec/journeys.md", 1));
  }

  /** Fluent requirement builder; the computed hash always matches the content. */
  public static final class RequirementBuilder {
    private final Identifier id;
    private final List<Assertion> assertions = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private String title;
    private RequirementStatus status = RequirementStatus.ACTIVE;
    private String storedHash;
    private String path = "spec/requirements.md";
    private int line = 1;

    private RequirementBuilder(Identifier id) {
      this.id = id;
      this.title = "Requirement " + id;
    }

    public RequirementBuilder title(String value) {
      this.title = value;
      return this;
    }

    public RequirementBuilder status(RequirementStatus value) {
      this.status = value;
      return this;
    }

    public RequirementBuilder at(String documentPath, int startLine) {
      this.path = documentPath;
      this.line = startLine;
      return this;
    }

    public RequirementBuilder assertion(String label, String text) {
      assertions.add(new Assertion(label, text, id.toString(), line + 4 + assertions.size(), false));
      return this;
    }

    public RequirementBuilder expectedBrokenAssertion(String label, String text) {
      assertions.add(new Assertion(label, text, id.toString(), line + 4 + assertions.size(), true));
      return this;
    }

    public RequirementBuilder implementing(String target) {
      references.add(new Reference(ReferenceKind.IMPLEMENTS, target, line + 2));
      return this;
    }

    public RequirementBuilder refining(String target) {
      references.add(new Reference(ReferenceKind.REFINES, target, line + 2));
      return this;
    }

    public RequirementBuilder addressing(String journeyId) {
      references.add(new Reference(ReferenceKind.ADDRESSES, journeyId, line + 2));
      return this;
    }

    public RequirementBuilder storedHash(String value) {
      this.storedHash = value;
      return this;
    }

    /** Stores the hash computed from the current content. */
    public RequirementBuilder hashed() {
      this.storedHash = HASHER.hash(title, "", assertions);
      return this;
    }

    public Requirement build() {
      return new Requirement(id, title, id.level(), status, "", "", assertions, references, storedHash,
          HASHER.hash(title, "", assertions), new SourceLocation(path, line, line + 10), List.of(), "", false);
    }
  }
}
