package ca.gc.cra.trace.domain.record;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Source-code location that declares it implements requirements.
 *
 * @param file source file path
 * @param line 1-based line of the reference comment
 * @param symbol enclosing function or class; {@code null} when unknown
 * @param targets requirement or assertion identifiers as written
 * @param expectedBrokenTargets targets the author acknowledged as unresolved
 * @since 0.1.0
 */
public record CodeReference(
    String file, int line, String symbol, List<String> targets, Set<String> expectedBrokenTargets) {

  public CodeReference {
    Objects.requireNonNull(file, "file");
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    expectedBrokenTargets = expectedBrokenTargets == null ? Set.of() : Set.copyOf(expectedBrokenTargets);
  }

  public CodeReference(String file, int line, String symbol, List<String> targets) {
    this(file, line, symbol, targets, Set.of());
  }

  /** Graph node id, e.g. {@code code:src/auth.py:42#login}. */
  public String id() {
    return "code:" + file + ":" + line + (symbol == null ? "" : "#" + symbol);
  }

  public SourceLocation location() {
    return SourceLocation.of(file, line);
  }
}
