package ca.gc.cra.trace.domain.requirement;

import java.util.Objects;

/**
 * Single testable obligation inside a requirement.
 *
 * @param label single upper-case letter, unique within the owning requirement
 * @param text normative text with continuation lines joined
 * @param requirementId canonical identifier of the owning requirement
 * @param line 1-based line where the assertion starts
 * @param expectedBroken {@code true} when the author marked the assertion {@code [expected-broken]}; suppresses the
 *     coverage gap diagnostic
 * @since 0.1.0
 */
public record Assertion(String label, String text, String requirementId, int line, boolean expectedBroken) {

  public Assertion {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(requirementId, "requirementId");
  }

  /** Assertion-scoped identifier, e.g. {@code REQ-p00001-A}. */
  public String id() {
    return requirementId + "-" + label;
  }
}
