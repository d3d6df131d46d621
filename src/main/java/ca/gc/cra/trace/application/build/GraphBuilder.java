package ca.gc.cra.trace.application.build;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.AssertionPayload;
import ca.gc.cra.trace.domain.graph.CodePayload;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.JourneyPayload;
import ca.gc.cra.trace.domain.graph.RequirementPayload;
import ca.gc.cra.trace.domain.graph.TargetRef;
import ca.gc.cra.trace.domain.graph.TestPayload;
import ca.gc.cra.trace.domain.graph.TestResultPayload;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.id.Identifier;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.id.IdentifierParse;
import ca.gc.cra.trace.domain.id.ParseFailure;
import ca.gc.cra.trace.domain.id.ParsedIdentifier;
import ca.gc.cra.trace.domain.record.CodeReference;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.record.TestReference;
import ca.gc.cra.trace.domain.record.TestResult;
import ca.gc.cra.trace.domain.record.TraceRecords;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import ca.gc.cra.trace.domain.schema.Direction;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assembles requirements and external records into a {@link TraceGraph} and validates it.
 * <p><strong>Why:</strong> The builder is a generic interpreter over {@link GraphSchema}: every edge comes from a
 * schema row, so new relationship kinds need no new code.</p>
 * <p><strong>Role:</strong> Application service between the parse stage and the metrics rollup.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one node per requirement, assertion and external record; keep duplicate claimants out of the
 *   index.</li>
 *   <li>Resolve every schema relationship into edges, reporting unresolved and wrongly-typed targets.</li>
 *   <li>Run the independent {@link ValidationCheck}s and attach the collected diagnostics to the graph.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between builds; each build writes only its own fresh graph.</p>
 * <p><strong>Performance:</strong> Linear in nodes plus declared targets; lookups go through the id index.</p>
 * <p><strong>Observability:</strong> Logs node and edge counts at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class GraphBuilder {
  private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

  private final IdentifierGrammar grammar;
  private final List<ValidationCheck> checks;

  /** Builder with the default grammar and lenient hash policy. */
  public GraphBuilder() {
    this(new IdentifierGrammar(), HashPolicy.LENIENT);
  }

  public GraphBuilder(IdentifierGrammar grammar, HashPolicy hashPolicy) {
    this(grammar, defaultChecks(hashPolicy));
  }

  /**
   * Creates a builder with an explicit check list.
   *
   * @param grammar grammar used to canonicalize declared targets
   * @param checks checks run in order after linking
   */
  public GraphBuilder(IdentifierGrammar grammar, List<ValidationCheck> checks) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
  }

  /** Cycle, orphan, level constraint, assertion coverage and hash checks, in that order. */
  public static List<ValidationCheck> defaultChecks(HashPolicy hashPolicy) {
    return List.of(
        new CycleCheck(),
        new OrphanCheck(),
        new LevelConstraintCheck(),
        new AssertionCoverageCheck(),
        new HashCheck(hashPolicy));
  }

  /** Builds from requirements and a bundle of external records. */
  public BuildResult build(List<Requirement> requirements, TraceRecords records, GraphSchema schema) {
    Objects.requireNonNull(records, "records");
    return build(requirements, records.codeReferences(), records.testReferences(), records.testResults(),
        records.journeys(), schema);
  }

  /**
   * Builds and validates a graph.
   *
   * @param requirements parsed requirements in corpus order; later claimants of an id become conflicts
   * @param codeReferences code references validating requirements
   * @param testReferences test definitions validating requirements
   * @param testResults results keyed by {@link TestReference#key()}
   * @param journeys user journeys
   * @param schema relationship table
   * @return graph paired with every diagnostic found; never throws for data problems
   * @throws ca.gc.cra.trace.domain.schema.SchemaViolationException when {@code schema} is inconsistent
   */
  public BuildResult build(
      List<Requirement> requirements,
      List<CodeReference> codeReferences,
      List<TestReference> testReferences,
      List<TestResult> testResults,
      List<Journey> journeys,
      GraphSchema schema) {
    Objects.requireNonNull(requirements, "requirements");
    Objects.requireNonNull(codeReferences, "codeReferences");
    Objects.requireNonNull(testReferences, "testReferences");
    Objects.requireNonNull(testResults, "testResults");
    Objects.requireNonNull(journeys, "journeys");
    Objects.requireNonNull(schema, "schema");

    TraceGraph graph = new TraceGraph(schema);
    ValidationResult.Builder diagnostics = ValidationResult.builder();
    boolean reportDuplicates = schema.checks().duplicate();

    addRequirements(graph, requirements, reportDuplicates, diagnostics);
    addJourneys(graph, journeys, reportDuplicates, diagnostics);
    addTests(graph, testReferences, testResults, reportDuplicates, diagnostics);
    addCode(graph, codeReferences, reportDuplicates, diagnostics);

    boolean reportBroken = schema.checks().brokenLink();
    for (RelationshipSchema relationship : schema.relationships()) {
      resolve(graph, relationship, reportBroken, diagnostics);
    }
    graph.computeRoots();

    for (ValidationCheck check : checks) {
      if (check.enabled(schema.checks())) {
        check.run(graph, diagnostics::add);
      }
    }
    ValidationResult validation = diagnostics.build();
    graph.setValidation(validation);
    log.debug("Built graph with {} nodes, {} edges, {} roots, {} conflicts, {} diagnostics",
        graph.size(), graph.edges().size(), graph.roots().size(), graph.conflicts().size(), validation.size());
    return new BuildResult(graph, validation);
  }

  private void addRequirements(TraceGraph graph, List<Requirement> requirements, boolean report,
      ValidationResult.Builder diagnostics) {
    for (Requirement requirement : requirements) {
      String id = requirement.idText();
      Optional<GraphNode> existing = graph.findById(id);
      if (existing.isPresent() || requirement.conflict()) {
        graph.addConflict(requirement.withConflict());
        if (report) {
          String first = existing.flatMap(GraphNode::location)
              .map(SourceLocation::toString)
              .orElse("an earlier document");
          diagnostics.add(Diagnostic.error(CheckName.DUPLICATE_ID, id,
              "duplicate identifier " + id + "; first defined at " + first + ", this definition is excluded",
              requirement.location()));
        }
        continue;
      }
      graph.addNode(id, requirement.title(), requirement.location(), new RequirementPayload(requirement));
      for (Assertion assertion : requirement.assertions()) {
        graph.addNode(assertion.id(), assertion.text(),
            SourceLocation.of(requirement.location().path(), assertion.line()), new AssertionPayload(assertion));
      }
    }
  }

  private void addJourneys(TraceGraph graph, List<Journey> journeys, boolean report,
      ValidationResult.Builder diagnostics) {
    for (Journey journey : journeys) {
      if (graph.findById(journey.id()).isPresent()) {
        duplicateRecord(journey.id(), journey.location(), report, diagnostics);
        continue;
      }
      graph.addNode(journey.id(), journey.title(), journey.location(), new JourneyPayload(journey));
    }
  }

  private void addTests(TraceGraph graph, List<TestReference> tests, List<TestResult> results, boolean report,
      ValidationResult.Builder diagnostics) {
    Map<String, List<TestResult>> resultsByKey = new LinkedHashMap<>();
    for (TestResult result : results) {
      resultsByKey.computeIfAbsent(result.testKey(), k -> new ArrayList<>()).add(result);
    }
    for (TestReference test : tests) {
      if (graph.findById(test.id()).isPresent()) {
        duplicateRecord(test.id(), test.location(), report, diagnostics);
        continue;
      }
      List<String> resultIds = new ArrayList<>();
      int count = resultsByKey.getOrDefault(test.key(), List.of()).size();
      for (int i = 1; i <= count; i++) {
        resultIds.add(resultId(test.key(), i));
      }
      graph.addNode(test.id(), test.name(), test.location(), new TestPayload(test, resultIds));
    }
    for (Map.Entry<String, List<TestResult>> entry : resultsByKey.entrySet()) {
      String key = entry.getKey();
      boolean known = graph.findById("test:" + key).isPresent();
      int n = 0;
      for (TestResult result : entry.getValue()) {
        String id = resultId(key, ++n);
        graph.addNode(id, result.status().name(), result.location(), new TestResultPayload(result));
        if (!known && n == 1 && graph.schema().checks().brokenLink()) {
          diagnostics.add(Diagnostic.warning(CheckName.BROKEN_LINK, id,
              "test result refers to unknown test '" + key + "'", result.location()));
        }
      }
    }
  }

  private void addCode(TraceGraph graph, List<CodeReference> codeReferences, boolean report,
      ValidationResult.Builder diagnostics) {
    for (CodeReference code : codeReferences) {
      if (graph.findById(code.id()).isPresent()) {
        duplicateRecord(code.id(), code.location(), report, diagnostics);
        continue;
      }
      String label = code.symbol() == null ? code.file() + ":" + code.line() : code.symbol();
      graph.addNode(code.id(), label, code.location(), new CodePayload(code));
    }
  }

  private static void duplicateRecord(String id, SourceLocation location, boolean report,
      ValidationResult.Builder diagnostics) {
    if (report) {
      diagnostics.add(Diagnostic.warning(CheckName.DUPLICATE_ID, id,
          "duplicate record " + id + "; later record skipped", location));
    }
  }

  private static String resultId(String testKey, int ordinal) {
    return "result:" + testKey + "#" + ordinal;
  }

  private void resolve(TraceGraph graph, RelationshipSchema relationship, boolean reportBroken,
      ValidationResult.Builder diagnostics) {
    List<GraphNode> sources = new ArrayList<>();
    for (GraphNode node : graph.nodes()) {
      if (relationship.fromKinds().contains(node.kind())) {
        sources.add(node);
      }
    }
    for (GraphNode source : sources) {
      Map<String, MissingOwner> missingOwners = new LinkedHashMap<>();
      for (TargetRef target : source.payload().targets(relationship.sourceField())) {
        IdentifierParse parsed = grammar.parse(target.id());
        List<String> candidates = new ArrayList<>();
        if (parsed instanceof ParsedIdentifier ok) {
          for (Identifier expanded : ok.identifier().expand()) {
            candidates.add(expanded.toString());
          }
        } else {
          candidates.add(target.id().trim());
        }
        for (String candidate : candidates) {
          Optional<GraphNode> resolved = graph.findById(candidate);
          SourceLocation at = at(source, target);
          if (resolved.isEmpty()) {
            if (!reportBroken) {
              continue;
            }
            Optional<String> owner = missingOwner(graph, target, parsed);
            if (owner.isPresent()) {
              MissingOwner missing = missingOwners.computeIfAbsent(owner.get() + "@" + target.line(),
                  k -> new MissingOwner(owner.get(), target, at));
              missing.labels.add(candidate.substring(owner.get().length() + 1));
            } else {
              diagnostics.add(unresolved(graph, source, relationship, target, candidate, parsed, at));
            }
            continue;
          }
          GraphNode node = resolved.get();
          if (!relationship.toKinds().contains(node.kind())) {
            diagnostics.add(Diagnostic.warning(CheckName.KIND_MISMATCH, source.id(),
                source.id() + " " + relationship.name() + " " + candidate + " which is a " + node.kind()
                    + "; expected " + relationship.toKinds(), at));
            continue;
          }
          if (relationship.direction() == Direction.UP) {
            graph.link(node, source, relationship);
          } else {
            graph.link(source, node, relationship);
          }
        }
      }
      for (MissingOwner missing : missingOwners.values()) {
        String written = missing.requirementId + "-" + String.join("-", missing.labels);
        diagnostics.add(Diagnostic.warning(CheckName.BROKEN_LINK, source.id(),
            source.id() + " " + relationship.name() + " unknown " + written + " at line " + missing.target.line()
                + "; " + missing.requirementId + " does not exist", missing.at));
      }
    }
  }

  /** Owning requirement of an assertion-scoped target when that requirement is itself absent. */
  private static Optional<String> missingOwner(TraceGraph graph, TargetRef target, IdentifierParse parsed) {
    if (target.expectedBroken() || !(parsed instanceof ParsedIdentifier ok) || !ok.identifier().isAssertionScoped()) {
      return Optional.empty();
    }
    String requirementId = ok.identifier().requirementId().toString();
    return graph.findById(requirementId).isPresent() ? Optional.empty() : Optional.of(requirementId);
  }

  private static Diagnostic unresolved(TraceGraph graph, GraphNode source, RelationshipSchema relationship,
      TargetRef target, String candidate, IdentifierParse parsed, SourceLocation at) {
    if (target.expectedBroken()) {
      return Diagnostic.info(CheckName.EXPECTED_BROKEN_LINK, source.id(),
          source.id() + " " + relationship.name() + " " + candidate + " which does not exist (expected)", at);
    }
    String detail = "";
    if (parsed instanceof ParsedIdentifier ok && ok.identifier().isAssertionScoped()) {
      String requirementId = ok.identifier().requirementId().toString();
      if (graph.findById(requirementId).isPresent()) {
        detail = "; " + requirementId + " has no assertion " + candidate.substring(requirementId.length() + 1);
      }
    } else if (parsed instanceof ParseFailure failure && failure.suggestion() != null) {
      detail = "; " + failure.describe();
    }
    return Diagnostic.warning(CheckName.BROKEN_LINK, source.id(),
        source.id() + " " + relationship.name() + " unknown " + candidate + " at line " + target.line() + detail, at);
  }

  private static final class MissingOwner {
    final String requirementId;
    final TargetRef target;
    final SourceLocation at;
    final List<String> labels = new ArrayList<>();

    MissingOwner(String requirementId, TargetRef target, SourceLocation at) {
      this.requirementId = requirementId;
      this.target = target;
      this.at = at;
    }
  }

  private static SourceLocation at(GraphNode source, TargetRef target) {
    return source.location()
        .map(l -> target.line() > 0 ? SourceLocation.of(l.path(), target.line()) : l)
        .orElse(null);
  }
}
