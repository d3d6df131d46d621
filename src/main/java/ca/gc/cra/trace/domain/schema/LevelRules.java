package ca.gc.cra.trace.domain.schema;

import ca.gc.cra.trace.domain.id.Level;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Which parent levels a requirement of a given level may point at through a level-checked relationship.
 *
 * @since 0.1.0
 */
public final class LevelRules {
  private final Map<Level, Set<Level>> allowedParents;

  public LevelRules(Map<Level, Set<Level>> allowedParents) {
    Objects.requireNonNull(allowedParents, "allowedParents");
    Map<Level, Set<Level>> copy = new EnumMap<>(Level.class);
    for (Map.Entry<Level, Set<Level>> e : allowedParents.entrySet()) {
      Set<Level> parents = e.getValue().isEmpty() ? EnumSet.noneOf(Level.class) : EnumSet.copyOf(e.getValue());
      copy.put(e.getKey(), Collections.unmodifiableSet(parents));
    }
    this.allowedParents = copy;
  }

  /** DEV may target OPS or PRD, OPS may target PRD, PRD may target PRD. */
  public static LevelRules defaults() {
    Map<Level, Set<Level>> rules = new EnumMap<>(Level.class);
    rules.put(Level.DEVELOPMENT, EnumSet.of(Level.OPERATIONAL, Level.PRODUCT));
    rules.put(Level.OPERATIONAL, EnumSet.of(Level.PRODUCT));
    rules.put(Level.PRODUCT, EnumSet.of(Level.PRODUCT));
    return new LevelRules(rules);
  }

  /** Levels without a rule accept any parent level. */
  public boolean allows(Level child, Level parent) {
    Set<Level> allowed = allowedParents.get(child);
    return allowed == null || allowed.contains(parent);
  }

  public Set<Level> allowedParents(Level child) {
    Set<Level> allowed = allowedParents.get(child);
    return allowed == null ? EnumSet.allOf(Level.class) : allowed;
  }

  public Map<Level, Set<Level>> asMap() {
    return Collections.unmodifiableMap(allowedParents);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LevelRules other && allowedParents.equals(other.allowedParents);
  }

  @Override
  public int hashCode() {
    return allowedParents.hashCode();
  }

  @Override
  public String toString() {
    return "LevelRules" + allowedParents;
  }
}
