package ca.gc.cra.trace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.application.build.HashPolicy;
import ca.gc.cra.trace.application.pipeline.TraceBuild;
import ca.gc.cra.trace.application.port.ClockPort;
import ca.gc.cra.trace.application.port.MetricsPort;
import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Severity;
import ca.gc.cra.trace.domain.record.TraceRecords;
import ca.gc.cra.trace.domain.requirement.SourceDocument;
import ca.gc.cra.trace.infrastructure.metrics.NoOpMetricsAdapter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final String DOCUMENT = """
      ## SPEC-p00001: Secure sign-in

      ## Assertions

      A. The system SHALL require a password.

      *End* *SPEC-p00001*
      """;

  @TempDir Path tempDir;

  @Test
  void defaultsSelectNoOpMetrics() {
    CompositionRoot root = new CompositionRoot(TraceConfig.defaults());

    assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    assertEquals("REQ", root.grammar().config().prefix());
  }

  @Test
  void configuredGrammarSchemaAndPolicyReachTheBuild() throws IOException {
    Path schema = tempDir.resolve("schema.yaml");
    Files.writeString(schema, """
        checks:
          assertionCoverage: false
        """);
    TraceConfig config = new TraceConfig("SPEC", 5, 3, "JNY", 8, HashPolicy.STRICT, 2, "none", false, schema);
    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP, ClockPort.SYSTEM);

    TraceBuild build = root.traceBuildUseCase()
        .run(List.of(new SourceDocument("spec/prd.md", DOCUMENT)), TraceRecords.empty());

    assertTrue(build.graph().findById("SPEC-p00001-A").isPresent());
    assertEquals(1, build.validation().count(CheckName.HASH_MISMATCH));
    assertEquals(Severity.WARNING, build.validation().byCheck(CheckName.HASH_MISMATCH).get(0).severity());
    assertEquals(0, build.validation().count(CheckName.COVERAGE_GAP));
  }

  @Test
  void defaultPrefixDoesNotRecognizeOtherPrefixes() throws IOException {
    CompositionRoot root = new CompositionRoot(TraceConfig.defaults(), MetricsPort.NO_OP, ClockPort.SYSTEM);

    TraceBuild build = root.traceBuildUseCase()
        .run(List.of(new SourceDocument("spec/prd.md", DOCUMENT)), TraceRecords.empty());

    assertEquals(0, build.graph().size());
    assertTrue(build.graph().isFrozen());
  }

  @Test
  void missingSchemaFileFailsWiring() {
    TraceConfig config = new TraceConfig("REQ", 5, 3, "JNY", 8, HashPolicy.LENIENT, 1, "none", false,
        tempDir.resolve("missing.yaml"));
    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP, ClockPort.SYSTEM);

    assertThrows(IOException.class, root::traceBuildUseCase);
  }
}
