package ca.gc.cra.trace.config;

import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.schema.CheckToggles;
import ca.gc.cra.trace.domain.schema.ContentField;
import ca.gc.cra.trace.domain.schema.Direction;
import ca.gc.cra.trace.domain.schema.GraphSchema;
import ca.gc.cra.trace.domain.schema.LevelRules;
import ca.gc.cra.trace.domain.schema.NodeKind;
import ca.gc.cra.trace.domain.schema.RelationshipSchema;
import ca.gc.cra.trace.domain.schema.SchemaViolationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link GraphSchema} from YAML. Sections left out keep their built-in defaults:
 *
 * <pre>
 * version: 1
 * relationships:
 *   - name: implements
 *     from: [REQUIREMENT]
 *     to: [REQUIREMENT, ASSERTION]
 *     direction: up
 *     field: IMPLEMENTS
 *     rollup: true
 *     required: true
 *     levelChecked: true
 * roots:
 *   kinds: [JOURNEY]
 *   levels: [PRD]
 * levelRules:
 *   DEV: [OPS, PRD]
 * checks:
 *   orphan: false
 * rollupExcludedStatuses: [Deprecated, Superseded]
 * </pre>
 *
 * @since 0.1.0
 */
public final class YamlSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);

  /**
   * Reads and validates a schema file.
   *
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the YAML is malformed or a value has the wrong shape
   * @throws SchemaViolationException when a kind, field or level is unknown or the table is inconsistent
   */
  public GraphSchema load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Schema file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        log.debug("Schema file {} is empty; using built-in schema", path);
        return GraphSchema.defaults();
      }
      GraphSchema schema = parse(asMap(rootObj, "root"), path);
      log.debug("Loaded schema from {}: {}", path, schema);
      return schema;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML schema at " + path, ex);
    }
  }

  /** Loads {@code path} when present, otherwise returns {@link GraphSchema#defaults()}. */
  public GraphSchema loadOrDefaults(Optional<Path> path) throws IOException {
    return path.isPresent() ? load(path.get()) : GraphSchema.defaults();
  }

  private GraphSchema parse(Map<String, Object> root, Path path) {
    Object versionNode = root.get("version");
    if (versionNode != null) {
      int version = toInt(versionNode, "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported schema version " + version + " in " + path);
      }
    }
    GraphSchema defaults = GraphSchema.defaults();

    List<RelationshipSchema> relationships = defaults.relationships();
    Object relationshipsNode = root.get("relationships");
    if (relationshipsNode != null) {
      if (!(relationshipsNode instanceof Iterable<?> rows)) {
        throw new IllegalArgumentException("relationships must be a list");
      }
      relationships = new ArrayList<>();
      for (Object row : rows) {
        relationships.add(parseRelationship(asMap(row, "relationship")));
      }
    }

    Set<NodeKind> rootKinds = defaults.rootKinds();
    Set<Level> rootLevels = defaults.rootLevels();
    Object rootsNode = root.get("roots");
    if (rootsNode != null) {
      Map<String, Object> roots = asMap(rootsNode, "roots");
      if (roots.containsKey("kinds")) {
        rootKinds = enumSet(roots.get("kinds"), "roots.kinds", NodeKind.class, NodeKind::fromName);
      }
      if (roots.containsKey("levels")) {
        rootLevels = enumSet(roots.get("levels"), "roots.levels", Level.class, Level::parse);
      }
    }

    LevelRules levelRules = defaults.levelRules();
    Object levelRulesNode = root.get("levelRules");
    if (levelRulesNode != null) {
      levelRules = parseLevelRules(asMap(levelRulesNode, "levelRules"));
    }

    CheckToggles checks = defaults.checks();
    Object checksNode = root.get("checks");
    if (checksNode != null) {
      checks = parseChecks(asMap(checksNode, "checks"), checks);
    }

    Set<RequirementStatus> excluded = defaults.rollupExcludedStatuses();
    if (root.containsKey("rollupExcludedStatuses")) {
      excluded = enumSet(root.get("rollupExcludedStatuses"), "rollupExcludedStatuses", RequirementStatus.class,
          RequirementStatus::parse);
    }
    return new GraphSchema(relationships, rootKinds, rootLevels, levelRules, checks, excluded);
  }

  private RelationshipSchema parseRelationship(Map<String, Object> map) {
    String name = requireString(map, "name");
    String context = "relationship '" + name + "'";
    Set<NodeKind> from = enumSet(require(map, "from"), context + ".from", NodeKind.class, NodeKind::fromName);
    Set<NodeKind> to = enumSet(require(map, "to"), context + ".to", NodeKind.class, NodeKind::fromName);
    String directionText = requireString(map, "direction");
    Direction direction = Direction.fromName(directionText)
        .orElseThrow(() -> new SchemaViolationException(context + " has unknown direction '" + directionText + "'"));
    String fieldText = requireString(map, "field");
    ContentField field = ContentField.fromName(fieldText)
        .orElseThrow(() -> new SchemaViolationException(context + " reads unknown field '" + fieldText + "'"));
    boolean rollup = map.containsKey("rollup") && toBoolean(map.get("rollup"), context + ".rollup");
    boolean required = map.containsKey("required") && toBoolean(map.get("required"), context + ".required");
    boolean levelChecked = map.containsKey("levelChecked")
        && toBoolean(map.get("levelChecked"), context + ".levelChecked");
    return new RelationshipSchema(name, from, to, direction, field, rollup, required, levelChecked);
  }

  private LevelRules parseLevelRules(Map<String, Object> map) {
    Map<Level, Set<Level>> rules = new EnumMap<>(Level.class);
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      Level child = Level.parse(entry.getKey())
          .orElseThrow(() -> new SchemaViolationException("levelRules names unknown level '" + entry.getKey() + "'"));
      rules.put(child, enumSet(entry.getValue(), "levelRules." + entry.getKey(), Level.class, Level::parse));
    }
    return new LevelRules(rules);
  }

  private CheckToggles parseChecks(Map<String, Object> map, CheckToggles base) {
    for (String key : map.keySet()) {
      if (!List.of("duplicate", "cycle", "orphan", "brokenLink", "levelConstraint", "assertionCoverage", "hash")
          .contains(key)) {
        throw new SchemaViolationException("checks names unknown check '" + key + "'");
      }
    }
    return new CheckToggles(
        toggle(map, "duplicate", base.duplicate()),
        toggle(map, "cycle", base.cycle()),
        toggle(map, "orphan", base.orphan()),
        toggle(map, "brokenLink", base.brokenLink()),
        toggle(map, "levelConstraint", base.levelConstraint()),
        toggle(map, "assertionCoverage", base.assertionCoverage()),
        toggle(map, "hash", base.hash()));
  }

  private boolean toggle(Map<String, Object> map, String key, boolean fallback) {
    return map.containsKey(key) ? toBoolean(map.get(key), "checks." + key) : fallback;
  }

  private <E extends Enum<E>> Set<E> enumSet(Object node, String context, Class<E> type,
      Function<String, Optional<E>> resolver) {
    Set<E> values = EnumSet.noneOf(type);
    if (node == null) {
      return values;
    }
    List<Object> items = new ArrayList<>();
    if (node instanceof Iterable<?> iterable) {
      for (Object item : iterable) {
        items.add(item);
      }
    } else {
      items.add(node);
    }
    for (Object item : items) {
      String text = toString(item);
      values.add(resolver.apply(text)
          .orElseThrow(() -> new SchemaViolationException(context + " names unknown value '" + text + "'")));
    }
    return values;
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private Object require(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return value;
  }

  private String requireString(Map<String, Object> map, String key) {
    return toString(require(map, key));
  }

  private String toString(Object value) {
    return value == null ? "" : value.toString().trim();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      String normalized = str.trim();
      if (normalized.equalsIgnoreCase("true")) {
        return true;
      }
      if (normalized.equalsIgnoreCase("false")) {
        return false;
      }
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }
}
