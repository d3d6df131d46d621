package ca.gc.cra.trace.domain.id;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Structured requirement identifier, optionally namespaced and assertion-scoped.
 * <p><strong>Why:</strong> Coverage rollup distinguishes a whole-requirement reference from a reference to
 * specific assertions of the same requirement, so the label set is part of identity.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link IdentifierGrammar}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param prefix project prefix such as {@code REQ}
 * @param namespace associated repository namespace such as {@code CAL}; {@code null} for the core repository
 * @param level hierarchy level encoded by the level code
 * @param sequence fixed-width numeric sequence, kept as written to preserve zero padding
 * @param assertionLabels ordered single-letter labels; empty for a whole-requirement identifier
 * @since 0.1.0
 */
public record Identifier(
    String prefix,
    String namespace,
    Level level,
    String sequence,
    List<String> assertionLabels) {

  public Identifier {
    Objects.requireNonNull(prefix, "prefix");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(sequence, "sequence");
    assertionLabels = List.copyOf(new LinkedHashSet<>(
        Objects.requireNonNull(assertionLabels, "assertionLabels")));
    if (namespace != null && namespace.isBlank()) {
      namespace = null;
    }
  }

  public Optional<String> namespaceOptional() {
    return Optional.ofNullable(namespace);
  }

  /** Whether this identifier targets specific assertions rather than the whole requirement. */
  public boolean isAssertionScoped() {
    return !assertionLabels.isEmpty();
  }

  /** Returns the whole-requirement identifier with assertion labels removed. */
  public Identifier requirementId() {
    if (assertionLabels.isEmpty()) {
      return this;
    }
    return new Identifier(prefix, namespace, level, sequence, List.of());
  }

  /** Returns the identifier scoped to a single assertion label. */
  public Identifier withLabel(String label) {
    Objects.requireNonNull(label, "label");
    return new Identifier(prefix, namespace, level, sequence, List.of(label));
  }

  /**
   * Splits a multi-label identifier into one identifier per label.
   *
   * @return {@code [this]} for whole-requirement or single-label identifiers
   */
  public List<Identifier> expand() {
    if (assertionLabels.size() <= 1) {
      return List.of(this);
    }
    List<Identifier> expanded = new ArrayList<>(assertionLabels.size());
    for (String label : assertionLabels) {
      expanded.add(withLabel(label));
    }
    return List.copyOf(expanded);
  }

  /** Canonical, fully-qualified text form, e.g. {@code REQ-CAL-p00001-A-B}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(prefix.length() + sequence.length() + 12);
    sb.append(prefix).append('-');
    if (namespace != null) {
      sb.append(namespace).append('-');
    }
    sb.append(level.code()).append(sequence);
    for (String label : assertionLabels) {
      sb.append('-').append(label);
    }
    return sb.toString();
  }
}
