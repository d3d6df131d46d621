package ca.gc.cra.trace.application.build;

import static ca.gc.cra.trace.TraceFixtures.code;
import static ca.gc.cra.trace.TraceFixtures.journey;
import static ca.gc.cra.trace.TraceFixtures.requirement;
import static ca.gc.cra.trace.TraceFixtures.result;
import static ca.gc.cra.trace.TraceFixtures.test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.diagnostic.Severity;
import ca.gc.cra.trace.domain.diagnostic.ValidationResult;
import ca.gc.cra.trace.domain.graph.Edge;
import ca.gc.cra.trace.domain.graph.GraphNode;
import ca.gc.cra.trace.domain.graph.TraceGraph;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.record.CodeReference;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.record.TestReference;
import ca.gc.cra.trace.domain.record.TestResult;
import ca.gc.cra.trace.domain.record.TestStatus;
import ca.gc.cra.trace.domain.record.TraceRecords;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.domain.schema.NodeKind;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GraphBuilderTest {
  private final GraphBuilder builder = new GraphBuilder();
  private final GraphSchema schema = GraphSchema.defaults();

  @Test
  void buildsRequirementAssertionImplementationAndTest() {
    Requirement product = requirement("REQ-p00001").assertion("A", "The system SHALL require a password.").build();
    Requirement dev = requirement("REQ-d00001").implementing("REQ-p00001-A").build();
    TestReference test = test("test_password_required", "REQ-d00001");

    BuildResult result = build(List.of(product, dev), List.of(test), List.of(), List.of());

    TraceGraph graph = result.graph();
    assertTrue(result.validation().isEmpty(), () -> result.validation().toString());
    assertEquals(4, graph.size());
    assertEquals(3, graph.edges().size());
    GraphNode assertion = graph.findById("REQ-p00001-A").orElseThrow();
    GraphNode implementation = graph.findById("REQ-d00001").orElseThrow();
    assertEquals(NodeKind.ASSERTION, assertion.kind());
    assertEquals(List.of(implementation), assertion.children());
    assertEquals(List.of(graph.findById("REQ-p00001").orElseThrow()), graph.roots());
    assertEquals(implementation, graph.findById(test.id()).orElseThrow().parents().get(0));
    assertEquals(result.validation(), graph.validation());
  }

  @Test
  void duplicateIdentifierKeepsFirstAndReportsOneError() {
    Requirement first = requirement("REQ-p00001").title("First").build();
    Requirement second = requirement("REQ-p00001").title("Second").at("spec/other.md", 7).build();

    BuildResult result = build(List.of(first, second), List.of(), List.of(), List.of());

    assertEquals(1, result.graph().size());
    assertEquals("First", result.graph().findById("REQ-p00001").orElseThrow().label());
    assertEquals(1, result.graph().conflicts().size());
    assertTrue(result.graph().conflicts().get(0).conflict());
    List<Diagnostic> duplicates = result.validation().byCheck(CheckName.DUPLICATE_ID);
    assertEquals(1, duplicates.size());
    assertEquals(Severity.ERROR, duplicates.get(0).severity());
    assertEquals(7, duplicates.get(0).location().line());
    assertTrue(duplicates.get(0).message().contains("spec/requirements.md:1"), duplicates.get(0).message());
    assertFalse(result.validation().isValid());
  }

  @Test
  void requirementWithoutParentIsReportedOnce() {
    BuildResult result = build(List.of(requirement("REQ-d00001").build()), List.of(), List.of(), List.of());

    assertEquals(1, result.validation().size());
    Diagnostic orphan = result.validation().diagnostics().get(0);
    assertEquals(CheckName.ORPHAN, orphan.check());
    assertEquals(Severity.WARNING, orphan.severity());
    assertEquals("REQ-d00001", orphan.nodeId());
  }

  @Test
  void unresolvedTargetIsReportedOnceWithIdAndLine() {
    Requirement dev = requirement("REQ-d00001").at("spec/dev.md", 10).implementing("REQ-p00099").build();

    BuildResult result = build(List.of(dev), List.of(), List.of(), List.of());

    List<Diagnostic> broken = result.validation().byCheck(CheckName.BROKEN_LINK);
    assertEquals(1, broken.size());
    assertEquals("REQ-d00001", broken.get(0).nodeId());
    assertTrue(broken.get(0).message().contains("REQ-p00099"), broken.get(0).message());
    assertEquals("spec/dev.md", broken.get(0).location().path());
    assertEquals(12, broken.get(0).location().line());
    assertEquals(1, result.validation().count(CheckName.ORPHAN));
  }

  @Test
  void missingAssertionOfExistingRequirementIsExplained() {
    Requirement product = requirement("REQ-p00001").assertion("A", "Only assertion.").build();
    Requirement dev = requirement("REQ-d00001").implementing("REQ-p00001-Z").build();

    BuildResult result = build(List.of(product, dev), List.of(), List.of(), List.of());

    Diagnostic broken = result.validation().byCheck(CheckName.BROKEN_LINK).get(0);
    assertTrue(broken.message().contains("REQ-p00001 has no assertion Z"), broken.message());
  }

  @Test
  void missingRequirementWithSeveralLabelsIsOneBrokenLink() {
    Requirement written = requirement("REQ-d00001").implementing("REQ-p09999-A-B").build();
    Requirement expanded = requirement("REQ-d00002")
        .implementing("REQ-p09999-A")
        .implementing("REQ-p09999-B")
        .build();

    BuildResult result = build(List.of(written, expanded), List.of(), List.of(), List.of());

    List<Diagnostic> broken = result.validation().byCheck(CheckName.BROKEN_LINK);
    assertEquals(2, broken.size());
    assertEquals("REQ-d00001", broken.get(0).nodeId());
    assertTrue(broken.get(0).message().contains("unknown REQ-p09999-A-B"), broken.get(0).message());
    assertTrue(broken.get(0).message().contains("REQ-p09999 does not exist"), broken.get(0).message());
    assertEquals("REQ-d00002", broken.get(1).nodeId());
    assertTrue(broken.get(1).message().contains("unknown REQ-p09999-A-B"), broken.get(1).message());
  }

  @Test
  void expectedBrokenTargetIsInformational() {
    TestReference pending = new TestReference("tests/test_trace.py", 4, "test_future", null,
        List.of("REQ-p00042"), Set.of("REQ-p00042"));

    BuildResult result = build(List.of(), List.of(pending), List.of(), List.of());

    assertEquals(0, result.validation().count(CheckName.BROKEN_LINK));
    Diagnostic expected = result.validation().byCheck(CheckName.EXPECTED_BROKEN_LINK).get(0);
    assertEquals(Severity.INFO, expected.severity());
  }

  @Test
  void uncoveredAssertionsAreCoverageGaps() {
    Requirement product = requirement("REQ-p00001")
        .assertion("A", "Covered.")
        .assertion("B", "Not covered.")
        .expectedBrokenAssertion("C", "Known gap.")
        .build();
    TestReference test = test("test_a", "REQ-p00001-A");

    BuildResult result = build(List.of(product), List.of(test), List.of(), List.of());

    List<Diagnostic> gaps = result.validation().byCheck(CheckName.COVERAGE_GAP);
    assertEquals(1, gaps.size());
    assertEquals("REQ-p00001-B", gaps.get(0).nodeId());
    assertEquals(Severity.INFO, gaps.get(0).severity());
  }

  @Test
  void excludedStatusSuppressesCoverageGaps() {
    Requirement deprecated = requirement("REQ-p00001").status(RequirementStatus.DEPRECATED)
        .assertion("A", "Old behaviour.").build();

    BuildResult result = build(List.of(deprecated), List.of(), List.of(), List.of());

    assertEquals(0, result.validation().count(CheckName.COVERAGE_GAP));
  }

  @Test
  void deprecatedImplementationDoesNotCover() {
    Requirement product = requirement("REQ-p00001").assertion("A", "Require a password.").build();
    Requirement retired = requirement("REQ-d00001").status(RequirementStatus.DEPRECATED)
        .implementing("REQ-p00001-A").build();

    BuildResult result = build(List.of(product, retired), List.of(), List.of(), List.of());

    List<Diagnostic> gaps = result.validation().byCheck(CheckName.COVERAGE_GAP);
    assertEquals(1, gaps.size());
    assertEquals("REQ-p00001-A", gaps.get(0).nodeId());
  }

  @Test
  void sharedTargetsProduceOneEdgePerPair() {
    Requirement product = requirement("REQ-p00001").assertion("A", "One.").assertion("B", "Two.").build();
    TestReference both = test("test_both", "REQ-p00001-A-B", "REQ-p00001-A");
    TestReference other = test("test_other", "REQ-p00001-A");

    BuildResult result = build(List.of(product), List.of(both, other), List.of(), List.of());

    GraphNode a = result.graph().findById("REQ-p00001-A").orElseThrow();
    GraphNode b = result.graph().findById("REQ-p00001-B").orElseThrow();
    assertEquals(2, a.children().size());
    assertEquals(1, b.children().size());
    assertEquals(2, result.graph().findById(both.id()).orElseThrow().parents().size());
    assertEquals(5, result.graph().edges().size());
  }

  @Test
  void buildingTwiceGivesSameGraphAndDiagnostics() {
    Requirement product = requirement("REQ-p00001").assertion("A", "One.").build();
    Requirement dev = requirement("REQ-d00001").implementing("REQ-p00001-A").implementing("REQ-p00077").build();
    List<TestReference> tests = List.of(test("test_one", "REQ-d00001"));

    BuildResult first = build(List.of(product, dev), tests, List.of(), List.of());
    BuildResult second = build(List.of(product, dev), tests, List.of(), List.of());

    assertEquals(first.validation(), second.validation());
    assertEquals(List.copyOf(first.graph().edges()), List.copyOf(second.graph().edges()));
    assertEquals(ids(first.graph()), ids(second.graph()));
  }

  @Test
  void rollupCycleIsAnErrorWithPath() {
    Requirement first = requirement("REQ-p00001").implementing("REQ-p00002").build();
    Requirement second = requirement("REQ-p00002").implementing("REQ-p00001").build();

    BuildResult result = build(List.of(first, second), List.of(), List.of(), List.of());

    List<Diagnostic> cycles = result.validation().byCheck(CheckName.CYCLE);
    assertEquals(1, cycles.size());
    assertEquals(Severity.ERROR, cycles.get(0).severity());
    assertEquals("cycle: REQ-p00001 -> REQ-p00002 -> REQ-p00001", cycles.get(0).message());
  }

  @Test
  void productMayNotImplementDevelopment() {
    Requirement product = requirement("REQ-p00001").implementing("REQ-d00001").build();
    Requirement dev = requirement("REQ-d00001").build();

    BuildResult result = build(List.of(product, dev), List.of(), List.of(), List.of());

    List<Diagnostic> level = result.validation().byCheck(CheckName.LEVEL_CONSTRAINT);
    assertEquals(1, level.size());
    assertEquals("REQ-p00001", level.get(0).nodeId());
    assertTrue(level.get(0).message().contains("PRD may only implements PRD"), level.get(0).message());
  }

  @Test
  void developmentMayImplementOperationalAssertion() {
    Requirement ops = requirement("REQ-o00001").implementing("REQ-p00001").assertion("A", "Ops rule.").build();
    Requirement product = requirement("REQ-p00001").build();
    Requirement dev = requirement("REQ-d00001").implementing("REQ-o00001-A").build();

    BuildResult result = build(List.of(product, ops, dev), List.of(), List.of(), List.of());

    assertEquals(0, result.validation().count(CheckName.LEVEL_CONSTRAINT));
  }

  @Test
  void lenientHashMismatchIsInfoAndMissingHashIgnored() {
    Requirement changed = requirement("REQ-p00001").storedHash("deadbeef").build();
    Requirement unhashed = requirement("REQ-p00002").build();
    Requirement current = requirement("REQ-p00003").hashed().build();

    BuildResult result = build(List.of(changed, unhashed, current), List.of(), List.of(), List.of());

    List<Diagnostic> hash = result.validation().byCheck(CheckName.HASH_MISMATCH);
    assertEquals(1, hash.size());
    assertEquals(Severity.INFO, hash.get(0).severity());
    assertEquals("REQ-p00001", hash.get(0).nodeId());
  }

  @Test
  void strictHashPolicyEscalates() {
    GraphBuilder strict = new GraphBuilder(new IdentifierGrammar(), HashPolicy.STRICT);
    Requirement changed = requirement("REQ-p00001").storedHash("deadbeef").build();
    Requirement unhashed = requirement("REQ-p00002").build();
    Requirement current = requirement("REQ-p00003").hashed().build();
    Requirement upper = requirement("REQ-p00004").build();
    Requirement upperHashed = requirement("REQ-p00004").storedHash(upper.computedHash().toUpperCase()).build();

    BuildResult result = strict.build(List.of(changed, unhashed, current, upperHashed), List.of(), List.of(),
        List.of(), List.of(), schema);

    List<Diagnostic> hash = result.validation().byCheck(CheckName.HASH_MISMATCH);
    assertEquals(2, hash.size());
    assertEquals(Severity.ERROR, hash.get(0).severity());
    assertEquals("REQ-p00001", hash.get(0).nodeId());
    assertEquals(Severity.WARNING, hash.get(1).severity());
    assertEquals("REQ-p00002", hash.get(1).nodeId());
  }

  @Test
  void targetOfWrongKindIsKindMismatch() {
    TestReference test = test("test_journey", "JNY-Login-01");

    BuildResult result = build(List.of(), List.of(test), List.of(), List.of(journey("JNY-Login-01")));

    List<Diagnostic> mismatch = result.validation().byCheck(CheckName.KIND_MISMATCH);
    assertEquals(1, mismatch.size());
    assertEquals(test.id(), mismatch.get(0).nodeId());
    assertTrue(result.graph().findById("JNY-Login-01").orElseThrow().children().isEmpty());
  }

  @Test
  void resultsAttachToTheirTest() {
    TestReference test = test("test_lockout", "REQ-p00001");
    List<TestResult> results = List.of(result(test, TestStatus.FAILED), result(test, TestStatus.PASSED));

    BuildResult result = builder.build(List.of(requirement("REQ-p00001").build()),
        new TraceRecords(List.of(), List.of(test), results, List.of()), schema);

    GraphNode testNode = result.graph().findById(test.id()).orElseThrow();
    assertEquals(List.of("result:" + test.key() + "#1", "result:" + test.key() + "#2"),
        testNode.children().stream().map(GraphNode::id).toList());
    assertTrue(result.validation().isEmpty(), () -> result.validation().toString());
  }

  @Test
  void resultForUnknownTestIsOneBrokenLink() {
    TestResult ghost = new TestResult("tests/test_gone.py::test_ghost", TestStatus.FAILED);

    BuildResult result = builder.build(List.of(),
        new TraceRecords(List.of(), List.of(), List.of(ghost, ghost), List.of()), schema);

    assertEquals(2, result.graph().nodesByKind(NodeKind.TEST_RESULT).size());
    List<Diagnostic> broken = result.validation().byCheck(CheckName.BROKEN_LINK);
    assertEquals(1, broken.size());
    assertEquals("result:tests/test_gone.py::test_ghost#1", broken.get(0).nodeId());
  }

  @Test
  void codeReferencesValidateAssertions() {
    Requirement product = requirement("REQ-p00001").assertion("A", "Hash passwords.").build();
    CodeReference hasher = code("src/auth/hash.py", 42, "REQ-p00001-A");

    BuildResult result = build(List.of(product), List.of(), List.of(hasher), List.of());

    GraphNode node = result.graph().findById("code:src/auth/hash.py:42").orElseThrow();
    assertEquals(NodeKind.CODE, node.kind());
    assertEquals("REQ-p00001-A", node.parents().get(0).id());
    assertTrue(result.validation().isEmpty(), () -> result.validation().toString());
  }

  @Test
  void journeysAreRootsLinkedToAddressingRequirements() {
    Requirement dev = requirement("REQ-d00001").addressing("JNY-Login-01").build();
    Journey login = journey("JNY-Login-01", "REQ-d00001");

    BuildResult result = build(List.of(dev), List.of(), List.of(), List.of(login));

    GraphNode journeyNode = result.graph().findById("JNY-Login-01").orElseThrow();
    assertEquals(List.of(journeyNode), result.graph().roots());
    assertEquals(List.of("addresses", "scopes"),
        journeyNode.outEdges().stream().map(Edge::relationship).toList());
    assertEquals(0, result.validation().count(CheckName.ORPHAN));
  }

  @Test
  void disabledChecksReportNothing() {
    GraphSchema quiet = schema.withChecks(new CheckToggles(false, false, false, false, false, false, false));
    Requirement first = requirement("REQ-d00001").implementing("REQ-p00099").build();
    Requirement again = requirement("REQ-d00001").build();

    BuildResult result = builder.build(List.of(first, again), TraceRecords.empty(), quiet);

    assertTrue(result.validation().isEmpty(), () -> result.validation().toString());
    assertEquals(1, result.graph().conflicts().size());
  }

  @Test
  void nullInputsAreRejected() {
    assertThrows(NullPointerException.class, () -> builder.build(null, TraceRecords.empty(), schema));
  }

  private BuildResult build(List<Requirement> requirements, List<TestReference> tests, List<CodeReference> code,
      List<Journey> journeys) {
    return builder.build(requirements, code, tests, List.of(), journeys, schema);
  }

  private static List<String> ids(TraceGraph graph) {
    return graph.nodes().stream().map(GraphNode::id).toList();
  }
}
