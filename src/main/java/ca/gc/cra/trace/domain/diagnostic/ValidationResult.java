package ca.gc.cra.trace.domain.diagnostic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered, immutable list of diagnostics from one parse or build.
 * <p><strong>Why:</strong> Every non-fatal problem is surfaced as data so callers can render a best-effort graph
 * together with what is wrong with it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link Builder} is not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ValidationResult {
  private static final ValidationResult EMPTY = new ValidationResult(List.of());

  private final List<Diagnostic> diagnostics;

  private ValidationResult(List<Diagnostic> diagnostics) {
    this.diagnostics = List.copyOf(diagnostics);
  }

  public static ValidationResult empty() {
    return EMPTY;
  }

  public static ValidationResult of(Collection<Diagnostic> diagnostics) {
    return diagnostics.isEmpty() ? EMPTY : new ValidationResult(new ArrayList<>(diagnostics));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Diagnostics in the order they were reported. */
  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  /** {@code true} when no diagnostic has {@link Severity#ERROR}. */
  public boolean isValid() {
    for (Diagnostic d : diagnostics) {
      if (d.severity() == Severity.ERROR) {
        return false;
      }
    }
    return true;
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int size() {
    return diagnostics.size();
  }

  public List<Diagnostic> errors() {
    return withSeverity(Severity.ERROR);
  }

  public List<Diagnostic> warnings() {
    return withSeverity(Severity.WARNING);
  }

  public List<Diagnostic> withSeverity(Severity severity) {
    List<Diagnostic> out = new ArrayList<>();
    for (Diagnostic d : diagnostics) {
      if (d.severity() == severity) {
        out.add(d);
      }
    }
    return out;
  }

  public List<Diagnostic> byCheck(CheckName check) {
    List<Diagnostic> out = new ArrayList<>();
    for (Diagnostic d : diagnostics) {
      if (d.check() == check) {
        out.add(d);
      }
    }
    return out;
  }

  public int count(CheckName check) {
    return byCheck(check).size();
  }

  /** Per-check counts, only for checks that reported something. */
  public Map<CheckName, Integer> countsByCheck() {
    Map<CheckName, Integer> counts = new EnumMap<>(CheckName.class);
    for (Diagnostic d : diagnostics) {
      counts.merge(d.check(), 1, Integer::sum);
    }
    return counts;
  }

  /** Returns a result holding this result's diagnostics followed by {@code other}'s. */
  public ValidationResult concat(ValidationResult other) {
    Objects.requireNonNull(other, "other");
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    List<Diagnostic> merged = new ArrayList<>(diagnostics.size() + other.diagnostics.size());
    merged.addAll(diagnostics);
    merged.addAll(other.diagnostics);
    return new ValidationResult(merged);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ValidationResult other && diagnostics.equals(other.diagnostics);
  }

  @Override
  public int hashCode() {
    return diagnostics.hashCode();
  }

  @Override
  public String toString() {
    return "ValidationResult" + diagnostics;
  }

  /** Accumulates diagnostics in report order. */
  public static final class Builder {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private Builder() {}

    public Builder add(Diagnostic diagnostic) {
      diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
      return this;
    }

    public Builder addAll(Collection<Diagnostic> more) {
      for (Diagnostic d : more) {
        add(d);
      }
      return this;
    }

    public int size() {
      return diagnostics.size();
    }

    public ValidationResult build() {
      return ValidationResult.of(diagnostics);
    }
  }
}
