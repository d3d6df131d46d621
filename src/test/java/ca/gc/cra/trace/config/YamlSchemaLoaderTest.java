package ca.gc.cra.trace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.domain.schema.NodeKind;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import ca.gc.cra.trace.domain.schema.SchemaViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlSchemaLoaderTest {
  private final YamlSchemaLoader loader = new YamlSchemaLoader();

  @TempDir Path tempDir;

  @Test
  void partialFileKeepsDefaultsForMissingSections() throws IOException {
    Path yaml = write("""
        version: 1
        roots:
          levels: [PRD, OPS]
        checks:
          orphan: false
        rollupExcludedStatuses: [Deprecated]
        """);

    GraphSchema schema = loader.load(yaml);

    assertEquals(GraphSchema.defaults().relationships(), schema.relationships());
    assertEquals(Set.of(Level.PRODUCT, Level.OPERATIONAL), schema.rootLevels());
    assertEquals(Set.of(NodeKind.JOURNEY), schema.rootKinds());
    assertFalse(schema.checks().orphan());
    assertTrue(schema.checks().cycle());
    assertEquals(Set.of(RequirementStatus.DEPRECATED), schema.rollupExcludedStatuses());
  }

  @Test
  void relationshipTableReplacesDefaults() throws IOException {
    Path yaml = write("""
        relationships:
          - name: contains
            from: [REQUIREMENT]
            to: [ASSERTION]
            direction: down
            field: assertions
            rollup: true
            required: true
          - name: verifies
            from: [test]
            to: [requirement, assertion]
            direction: up
            field: validates
            rollup: "true"
        levelRules:
          DEV: [PRD]
        """);

    GraphSchema schema = loader.load(yaml);

    List<String> names = schema.relationships().stream().map(RelationshipSchema::name).toList();
    assertEquals(List.of("contains", "verifies"), names);
    RelationshipSchema verifies = schema.relationship("verifies").orElseThrow();
    assertEquals(ContentField.VALIDATES, verifies.sourceField());
    assertTrue(verifies.rollup());
    assertFalse(verifies.requiredForNonRoot());
    assertTrue(schema.levelRules().allows(Level.DEVELOPMENT, Level.PRODUCT));
    assertFalse(schema.levelRules().allows(Level.DEVELOPMENT, Level.OPERATIONAL));
  }

  @Test
  void unknownKindIsASchemaViolation() throws IOException {
    Path yaml = write("""
        relationships:
          - name: mentions
            from: [WIDGET]
            to: [REQUIREMENT]
            direction: up
            field: validates
        """);

    SchemaViolationException ex = assertThrows(SchemaViolationException.class, () -> loader.load(yaml));
    assertTrue(ex.getMessage().contains("WIDGET"), ex.getMessage());
  }

  @Test
  void fieldNotSuppliedBySourceIsRejected() throws IOException {
    Path yaml = write("""
        relationships:
          - name: yields
            from: [REQUIREMENT]
            to: [TEST_RESULT]
            direction: down
            field: results
        """);

    assertThrows(SchemaViolationException.class, () -> loader.load(yaml));
  }

  @Test
  void unknownCheckAndVersionAreRejected() throws IOException {
    Path checks = write("""
        checks:
          spelling: true
        """);
    assertThrows(SchemaViolationException.class, () -> loader.load(checks));

    Path version = tempDir.resolve("v2.yaml");
    Files.writeString(version, "version: 2\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(version));
  }

  @Test
  void malformedYamlAndMissingFileAreReported() throws IOException {
    Path broken = write("relationships: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(broken));
    assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.yaml")));
  }

  @Test
  void emptyFileAndAbsentPathUseDefaults() throws IOException {
    Path empty = tempDir.resolve("empty.yaml");
    Files.writeString(empty, "");

    assertEquals(GraphSchema.defaults().relationships(), loader.load(empty).relationships());
    assertEquals(GraphSchema.defaults().rootLevels(), loader.loadOrDefaults(Optional.empty()).rootLevels());
  }

  private Path write(String yaml) throws IOException {
    Path file = tempDir.resolve("schema.yaml");
    Files.writeString(file, yaml);
    return file;
  }
}
