package ca.gc.cra.trace.domain.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GraphSchemaTest {

  @Test
  void defaultsDeclareTheStandardRelationships() {
    GraphSchema schema = GraphSchema.defaults();

    assertEquals(7, schema.relationships().size());
    RelationshipSchema implementsRow = schema.relationship("implements").orElseThrow();
    assertEquals(Direction.UP, implementsRow.direction());
    assertTrue(implementsRow.rollup());
    assertTrue(implementsRow.levelChecked());
    assertFalse(schema.relationship("refines").orElseThrow().rollup());
    assertTrue(schema.relationship("nope").isEmpty());
    assertEquals(Set.of(NodeKind.JOURNEY), schema.rootKinds());
    assertEquals(Set.of(Level.PRODUCT), schema.rootLevels());
    assertTrue(schema.rollupExcludedStatuses().contains(RequirementStatus.DEPRECATED));
  }

  @Test
  void orphanCheckedKindsAreChildrenOfRequiredRelationships() {
    Set<NodeKind> checked = GraphSchema.defaults().orphanCheckedKinds();

    assertTrue(checked.containsAll(EnumSet.of(NodeKind.REQUIREMENT, NodeKind.ASSERTION, NodeKind.TEST,
        NodeKind.CODE, NodeKind.TEST_RESULT)));
    assertFalse(checked.contains(NodeKind.JOURNEY));
  }

  @Test
  void relationshipsFromKindFollowTableOrder() {
    List<RelationshipSchema> fromRequirement = GraphSchema.defaults().relationshipsFrom(NodeKind.REQUIREMENT);

    assertEquals(List.of("contains", "implements", "refines", "addresses"),
        fromRequirement.stream().map(RelationshipSchema::name).toList());
  }

  @Test
  void duplicateRelationshipNameIsRejected() {
    RelationshipSchema row = row("validates", ContentField.VALIDATES);

    SchemaViolationException ex = assertThrows(SchemaViolationException.class, () -> schema(List.of(row, row)));
    assertTrue(ex.getMessage().contains("duplicate relationship"), ex.getMessage());
  }

  @Test
  void fieldNotSuppliedBySourceKindIsRejected() {
    RelationshipSchema row = row("validates", ContentField.IMPLEMENTS);

    assertThrows(SchemaViolationException.class, () -> schema(List.of(row)));
  }

  @Test
  void emptyTableIsRejected() {
    assertThrows(SchemaViolationException.class, () -> schema(List.of()));
  }

  @Test
  void levelRulesDefaultToStandardHierarchy() {
    LevelRules rules = LevelRules.defaults();

    assertTrue(rules.allows(Level.DEVELOPMENT, Level.PRODUCT));
    assertTrue(rules.allows(Level.DEVELOPMENT, Level.OPERATIONAL));
    assertTrue(rules.allows(Level.OPERATIONAL, Level.PRODUCT));
    assertFalse(rules.allows(Level.PRODUCT, Level.DEVELOPMENT));
    assertFalse(rules.allows(Level.OPERATIONAL, Level.DEVELOPMENT));
  }

  @Test
  void kindAndFieldNamesParseLeniently() {
    assertEquals(Optional.of(NodeKind.TEST_RESULT), NodeKind.fromName("test-result"));
    assertEquals(Optional.of(ContentField.VALIDATES), ContentField.fromName(" validates "));
    assertTrue(NodeKind.fromName("widget").isEmpty());
  }

  private static RelationshipSchema row(String name, ContentField field) {
    return new RelationshipSchema(name, EnumSet.of(NodeKind.TEST), EnumSet.of(NodeKind.REQUIREMENT),
        Direction.UP, field, true, true, false);
  }

  private static GraphSchema schema(List<RelationshipSchema> rows) {
    return new GraphSchema(rows, Set.of(), Set.of(Level.PRODUCT), LevelRules.defaults(),
        CheckToggles.allEnabled(), Set.of());
  }
}
