package ca.gc.cra.trace.domain.record;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Test definition that declares which requirements it validates.
 *
 * @param file test source file
 * @param line 1-based line of the test definition
 * @param name test function or method name
 * @param suite enclosing class or suite; {@code null} when none
 * @param targets requirement or assertion identifiers as written
 * @param expectedBrokenTargets targets the author acknowledged as unresolved
 * @since 0.1.0
 */
public record TestReference(
    String file, int line, String name, String suite, List<String> targets, Set<String> expectedBrokenTargets) {

  public TestReference {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(name, "name");
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    expectedBrokenTargets = expectedBrokenTargets == null ? Set.of() : Set.copyOf(expectedBrokenTargets);
  }

  public TestReference(String file, int line, String name, String suite, List<String> targets) {
    this(file, line, name, suite, targets, Set.of());
  }

  /** Key that {@link TestResult#testKey()} refers to: {@code file::[suite::]name}. */
  public String key() {
    return file + "::" + (suite == null || suite.isBlank() ? "" : suite + "::") + name;
  }

  /** Graph node id, {@code test:<key>}. */
  public String id() {
    return "test:" + key();
  }

  public SourceLocation location() {
    return SourceLocation.of(file, line);
  }
}
