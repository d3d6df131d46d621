package ca.gc.cra.trace.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.diagnostic.Severity;
import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.ReferenceKind;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentParserTest {
  private static final String PATH = "spec/prd-auth.md";

  private final DocumentParser parser = new DocumentParser();

  @Test
  void parsesCompleteBlock() {
    ParseResult result = parser.parse("""
        # Product requirements

        ## REQ-p00001: Secure login

        **Level**: PRD | **Status**: Active

        Users must authenticate before accessing tax data.

        ## Rationale

        Protects taxpayer records.

        ## Assertions

        A. The system SHALL require a password.
        B. The system SHALL lock the account after five failures.
           Locked accounts stay locked for 30 minutes.

        *End* *REQ-p00001* | **Hash**: 1A2B3C4D
        """, PATH);

    assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
    assertEquals(1, result.requirements().size());
    Requirement requirement = result.requirements().get(0);
    assertEquals("REQ-p00001", requirement.idText());
    assertEquals("Secure login", requirement.title());
    assertEquals(Level.PRODUCT, requirement.level());
    assertEquals(RequirementStatus.ACTIVE, requirement.status());
    assertEquals("Users must authenticate before accessing tax data.", requirement.body());
    assertEquals("Protects taxpayer records.", requirement.rationale());
    assertEquals("1a2b3c4d", requirement.storedHash());
    assertEquals(8, requirement.computedHash().length());
    assertEquals(PATH, requirement.location().path());
    assertEquals(3, requirement.location().line());
    assertEquals(19, requirement.location().endLine().intValue());

    List<Assertion> assertions = requirement.assertions();
    assertEquals(2, assertions.size());
    assertEquals("REQ-p00001-A", assertions.get(0).id());
    assertEquals(15, assertions.get(0).line());
    assertEquals("The system SHALL lock the account after five failures. Locked accounts stay locked for 30 minutes.",
        assertions.get(1).text());
  }

  @Test
  void missingEndMarkerEndsBlockAtLastContentLine() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        Body text.

        ## REQ-p00002: Session timeout

        Idle sessions end.
        """, PATH);

    assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
    assertEquals(List.of("REQ-p00001", "REQ-p00002"),
        result.requirements().stream().map(Requirement::idText).toList());
    Requirement first = result.requirements().get(0);
    assertEquals("Body text.", first.body());
    assertEquals(3, first.location().endLine().intValue());
    assertNull(first.storedHash());
  }

  @Test
  void endMarkerNamingAnotherBlockIsReported() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        *End* *REQ-p00009*
        """, PATH);

    assertEquals(1, result.requirements().size());
    List<Diagnostic> malformed = only(result, CheckName.MALFORMED_BLOCK);
    assertEquals(1, malformed.size());
    assertEquals(Severity.WARNING, malformed.get(0).severity());
  }

  @Test
  void headerWithoutColonKeepsTitle() {
    ParseResult result = parser.parse("""
        ## REQ-p00001 User Authentication

        *End* *REQ-p00001*

        ## REQ-p00002

        *End* *REQ-p00002*
        """, PATH);

    assertEquals("User Authentication", result.requirements().get(0).title());
    assertEquals("", result.requirements().get(1).title());
    List<Diagnostic> malformed = only(result, CheckName.MALFORMED_BLOCK);
    assertEquals(1, malformed.size());
    assertEquals("REQ-p00002", malformed.get(0).nodeId());
  }

  @Test
  void malformedHeaderSkipsBlockAndRecovers() {
    ParseResult result = parser.parse("""
        ## REQQ-p00001: Broken header

        **Implements**: REQ-p00009

        *End* *REQQ-p00001*

        ## REQ-p00002: Good block

        *End* *REQ-p00002*
        """, PATH);

    assertEquals(List.of("REQ-p00002"), result.requirements().stream().map(Requirement::idText).toList());
    Diagnostic diagnostic = only(result, CheckName.MALFORMED_BLOCK).get(0);
    assertEquals(1, diagnostic.location().line());
    assertTrue(diagnostic.message().contains("did you mean 'REQ-p00001'"), diagnostic.message());
  }

  @Test
  void implementsTargetsAreCanonicalizedAndExpanded() {
    Requirement requirement = single("""
        ## REQ-d00001: Password hashing

        **Implements**: p00001-A-B, REQ-o00002, -

        *End* *REQ-d00001*
        """);

    assertEquals(List.of("REQ-p00001-A", "REQ-p00001-B", "REQ-o00002"),
        requirement.references(ReferenceKind.IMPLEMENTS).stream().map(r -> r.target()).toList());
    assertEquals(3, requirement.references().get(0).line());
  }

  @Test
  void rejectedTargetIsReportedWithSuggestion() {
    ParseResult result = parser.parse("""
        ## REQ-d00001: Password hashing

        **Implements**: REQ_p00001

        *End* *REQ-d00001*
        """, PATH);

    assertTrue(result.requirements().get(0).references().isEmpty());
    Diagnostic diagnostic = only(result, CheckName.MALFORMED_REFERENCE).get(0);
    assertTrue(diagnostic.message().contains("REQ-p00001"), diagnostic.message());
  }

  @Test
  void misspelledKeywordIsIgnoredWithSuggestion() {
    ParseResult result = parser.parse("""
        ## REQ-d00001: Password hashing

        **Implments**: REQ-p00001

        *End* *REQ-d00001*
        """, PATH);

    assertTrue(result.requirements().get(0).references().isEmpty());
    Diagnostic diagnostic = only(result, CheckName.MALFORMED_REFERENCE).get(0);
    assertEquals(Severity.WARNING, diagnostic.severity());
    assertTrue(diagnostic.message().contains("did you mean 'Implements'"), diagnostic.message());
  }

  @Test
  void miscasedKeywordIsUsedAndReported() {
    ParseResult result = parser.parse("""
        ## REQ-d00001: Password hashing

        **implements**: REQ-p00001
        status: Draft

        *End* *REQ-d00001*
        """, PATH);

    Requirement requirement = result.requirements().get(0);
    assertEquals(1, requirement.references(ReferenceKind.IMPLEMENTS).size());
    assertEquals(RequirementStatus.DRAFT, requirement.status());
    assertEquals(1, only(result, CheckName.MALFORMED_REFERENCE).size());
    assertEquals(1, only(result, CheckName.METADATA).size());
  }

  @Test
  void levelDisagreementAndUnknownStatusAreMetadataWarnings() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        **Level**: DEV | **Status**: Actve

        *End* *REQ-p00001*
        """, PATH);

    Requirement requirement = result.requirements().get(0);
    assertEquals(Level.PRODUCT, requirement.level());
    assertEquals(RequirementStatus.UNKNOWN, requirement.status());
    List<Diagnostic> metadata = only(result, CheckName.METADATA);
    assertEquals(2, metadata.size());
    assertTrue(metadata.get(1).message().contains("did you mean 'Active'"), metadata.get(1).message());
  }

  @Test
  void numberedAssertionsAreRelabelledWithOneInfo() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        ## Assertions

        1. First.
        2. Second.
        3. Third.

        *End* *REQ-p00001*
        """, PATH);

    assertEquals(List.of("A", "B", "C"),
        result.requirements().get(0).assertions().stream().map(Assertion::label).toList());
    List<Diagnostic> style = only(result, CheckName.MALFORMED_ASSERTION);
    assertEquals(1, style.size());
    assertEquals(Severity.INFO, style.get(0).severity());
  }

  @Test
  void bulletedAssertionsAreRelabelledAndWrappedLinesJoined() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        ## Assertions

        - The system SHALL require a password.
        * The system SHALL lock the account
          after five failures.

        *End* *REQ-p00001*
        """, PATH);

    List<Assertion> assertions = result.requirements().get(0).assertions();
    assertEquals(List.of("A", "B"), assertions.stream().map(Assertion::label).toList());
    assertEquals("The system SHALL lock the account after five failures.", assertions.get(1).text());
    List<Diagnostic> style = only(result, CheckName.MALFORMED_ASSERTION);
    assertEquals(1, style.size());
    assertEquals(Severity.INFO, style.get(0).severity());
  }

  @Test
  void lineAfterBlankContinuesAssertionAndChangesHash() {
    String base = """
        ## REQ-p00001: Secure login

        ## Assertions

        A. The system SHALL log in.
        %s
        *End* *REQ-p00001*
        """;
    ParseResult continued = parser.parse(
        base.formatted("\ncontinued after a blank line with SHALL NOT text.\n"), PATH);
    ParseResult plain = parser.parse(base.formatted(""), PATH);

    assertTrue(continued.diagnostics().isEmpty(), () -> continued.diagnostics().toString());
    Requirement requirement = continued.requirements().get(0);
    assertEquals("The system SHALL log in. continued after a blank line with SHALL NOT text.",
        requirement.assertions().get(0).text());
    assertFalse(requirement.computedHash().equals(plain.requirements().get(0).computedHash()));
  }

  @Test
  void textBeforeFirstAssertionIsReported() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        ## Assertions

        The system:

        A. SHALL require a password.

        *End* *REQ-p00001*
        """, PATH);

    assertEquals(1, result.requirements().get(0).assertions().size());
    Diagnostic diagnostic = only(result, CheckName.MALFORMED_ASSERTION).get(0);
    assertEquals(Severity.WARNING, diagnostic.severity());
    assertEquals(5, diagnostic.location().line());
  }

  @Test
  void duplicateLabelKeepsFirstDefinition() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        ## Assertions

        A. First.
        A. Again.

        *End* *REQ-p00001*
        """, PATH);

    List<Assertion> assertions = result.requirements().get(0).assertions();
    assertEquals(1, assertions.size());
    assertEquals("First.", assertions.get(0).text());
    assertEquals(Severity.WARNING, only(result, CheckName.MALFORMED_ASSERTION).get(0).severity());
  }

  @Test
  void expectedBrokenMarkerIsStripped() {
    Requirement requirement = single("""
        ## REQ-p00001: Secure login

        ## Assertions

        A. Legacy behaviour is kept. [expected-broken]
        B. Normal.

        *End* *REQ-p00001*
        """);

    assertTrue(requirement.assertions().get(0).expectedBroken());
    assertEquals("Legacy behaviour is kept.", requirement.assertions().get(0).text());
    assertFalse(requirement.assertions().get(1).expectedBroken());
  }

  @Test
  void journeyHeaderClosesOpenBlock() {
    ParseResult result = parser.parse("""
        ## REQ-p00001: Secure login

        Body.

        ## JNY-Login-01: Sign in

        **Actor**: Taxpayer
        """, PATH);

    assertEquals(1, result.requirements().size());
    assertEquals("Body.", result.requirements().get(0).body());
    assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
  }

  @Test
  void subdirectoryIsTakenBetweenRootAndFile() {
    assertEquals("roadmap", DocumentParser.subdirectory("spec/roadmap/a.md"));
    assertEquals("", DocumentParser.subdirectory("spec/a.md"));
    assertEquals("x/y", DocumentParser.subdirectory("./spec/x/y/a.md"));
  }

  private Requirement single(String text) {
    ParseResult result = parser.parse(text, PATH);
    assertEquals(1, result.requirements().size());
    return result.requirements().get(0);
  }

  private static List<Diagnostic> only(ParseResult result, CheckName check) {
    return result.diagnostics().stream().filter(d -> d.check() == check).toList();
  }
}
