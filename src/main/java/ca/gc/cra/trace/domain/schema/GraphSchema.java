package ca.gc.cra.trace.domain.schema;

import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Declarative table of relationships, root declarations, level rules and check switches.
 * <p><strong>Why:</strong> The builder interprets this table generically, so a new relationship is a new row rather
 * than a new code path.</p>
 * <p><strong>Role:</strong> Configuration consumed by the graph builder; loaded by
 * {@code ca.gc.cra.trace.config.YamlSchemaLoader} or taken from {@link #defaults()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject inconsistent tables with {@link SchemaViolationException} at construction.</li>
 *   <li>Answer which relationships apply to a node kind, which kinds are orphan-checked and which nodes are
 *   declared roots.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across builds.</p>
 *
 * @since 0.1.0
 */
public final class GraphSchema {
  private final List<RelationshipSchema> relationships;
  private final Set<NodeKind> rootKinds;
  private final Set<Level> rootLevels;
  private final LevelRules levelRules;
  private final CheckToggles checks;
  private final Set<RequirementStatus> rollupExcludedStatuses;

  /**
   * Creates and validates a schema.
   *
   * @throws SchemaViolationException when the table is inconsistent
   */
  public GraphSchema(
      List<RelationshipSchema> relationships,
      Set<NodeKind> rootKinds,
      Set<Level> rootLevels,
      LevelRules levelRules,
      CheckToggles checks,
      Set<RequirementStatus> rollupExcludedStatuses) {
    this.relationships = List.copyOf(Objects.requireNonNull(relationships, "relationships"));
    this.rootKinds = enumCopy(rootKinds, NodeKind.class);
    this.rootLevels = enumCopy(rootLevels, Level.class);
    this.levelRules = Objects.requireNonNull(levelRules, "levelRules");
    this.checks = Objects.requireNonNull(checks, "checks");
    this.rollupExcludedStatuses = enumCopy(rollupExcludedStatuses, RequirementStatus.class);
    validate();
  }

  /** Relationship table used when no schema file is configured. */
  public static GraphSchema defaults() {
    List<RelationshipSchema> rows = List.of(
        new RelationshipSchema("contains", EnumSet.of(NodeKind.REQUIREMENT), EnumSet.of(NodeKind.ASSERTION),
            Direction.DOWN, ContentField.ASSERTIONS, true, true, false),
        new RelationshipSchema("implements", EnumSet.of(NodeKind.REQUIREMENT),
            EnumSet.of(NodeKind.REQUIREMENT, NodeKind.ASSERTION),
            Direction.UP, ContentField.IMPLEMENTS, true, true, true),
        new RelationshipSchema("refines", EnumSet.of(NodeKind.REQUIREMENT),
            EnumSet.of(NodeKind.REQUIREMENT, NodeKind.ASSERTION),
            Direction.UP, ContentField.REFINES, false, true, true),
        new RelationshipSchema("addresses", EnumSet.of(NodeKind.REQUIREMENT), EnumSet.of(NodeKind.JOURNEY),
            Direction.UP, ContentField.ADDRESSES, false, true, false),
        new RelationshipSchema("validates", EnumSet.of(NodeKind.TEST, NodeKind.CODE),
            EnumSet.of(NodeKind.REQUIREMENT, NodeKind.ASSERTION),
            Direction.UP, ContentField.VALIDATES, true, true, false),
        new RelationshipSchema("yields", EnumSet.of(NodeKind.TEST), EnumSet.of(NodeKind.TEST_RESULT),
            Direction.DOWN, ContentField.RESULTS, true, true, false),
        new RelationshipSchema("scopes", EnumSet.of(NodeKind.JOURNEY), EnumSet.of(NodeKind.REQUIREMENT),
            Direction.DOWN, ContentField.ADDRESSES, false, false, false));
    return new GraphSchema(
        rows,
        EnumSet.of(NodeKind.JOURNEY),
        EnumSet.of(Level.PRODUCT),
        LevelRules.defaults(),
        CheckToggles.allEnabled(),
        EnumSet.of(RequirementStatus.DEPRECATED, RequirementStatus.SUPERSEDED, RequirementStatus.DRAFT));
  }

  public List<RelationshipSchema> relationships() {
    return relationships;
  }

  public Optional<RelationshipSchema> relationship(String name) {
    for (RelationshipSchema r : relationships) {
      if (r.name().equals(name)) {
        return Optional.of(r);
      }
    }
    return Optional.empty();
  }

  /** Relationships declared by nodes of {@code kind}, in table order. */
  public List<RelationshipSchema> relationshipsFrom(NodeKind kind) {
    List<RelationshipSchema> out = new ArrayList<>();
    for (RelationshipSchema r : relationships) {
      if (r.fromKinds().contains(kind)) {
        out.add(r);
      }
    }
    return out;
  }

  /**
   * Kinds that need a parent through a required relationship unless declared roots: the children of every
   * required relationship.
   */
  public Set<NodeKind> orphanCheckedKinds() {
    Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
    for (RelationshipSchema r : relationships) {
      if (r.requiredForNonRoot()) {
        kinds.addAll(r.childKinds());
      }
    }
    return kinds;
  }

  public Set<NodeKind> rootKinds() {
    return rootKinds;
  }

  public Set<Level> rootLevels() {
    return rootLevels;
  }

  public LevelRules levelRules() {
    return levelRules;
  }

  public CheckToggles checks() {
    return checks;
  }

  public Set<RequirementStatus> rollupExcludedStatuses() {
    return rollupExcludedStatuses;
  }

  /** Copy with different check switches. */
  public GraphSchema withChecks(CheckToggles newChecks) {
    return new GraphSchema(relationships, rootKinds, rootLevels, levelRules, newChecks, rollupExcludedStatuses);
  }

  /** Copy with different requirement levels declared as roots. */
  public GraphSchema withRootLevels(Set<Level> levels) {
    return new GraphSchema(relationships, rootKinds, levels, levelRules, checks, rollupExcludedStatuses);
  }

  private void validate() {
    if (relationships.isEmpty()) {
      throw new SchemaViolationException("schema declares no relationships");
    }
    Set<String> names = new HashSet<>();
    for (RelationshipSchema r : relationships) {
      if (r.name().isBlank()) {
        throw new SchemaViolationException("relationship name must not be blank");
      }
      if (!names.add(r.name())) {
        throw new SchemaViolationException("duplicate relationship '" + r.name() + "'");
      }
      if (r.fromKinds().isEmpty() || r.toKinds().isEmpty()) {
        throw new SchemaViolationException("relationship '" + r.name() + "' must declare source and target kinds");
      }
      for (NodeKind from : r.fromKinds()) {
        if (!r.sourceField().isSuppliedBy(from)) {
          throw new SchemaViolationException("relationship '" + r.name() + "' reads field " + r.sourceField()
              + " which " + from + " nodes do not supply");
        }
      }
    }
  }

  private static <E extends Enum<E>> Set<E> enumCopy(Set<E> values, Class<E> type) {
    Set<E> copy = EnumSet.noneOf(type);
    if (values != null) {
      copy.addAll(values);
    }
    return Collections.unmodifiableSet(copy);
  }

  @Override
  public String toString() {
    List<String> names = new ArrayList<>();
    for (RelationshipSchema r : relationships) {
      names.add(r.name());
    }
    return "GraphSchema{relationships=" + names + ", rootKinds=" + rootKinds + ", rootLevels=" + rootLevels + "}";
  }
}
