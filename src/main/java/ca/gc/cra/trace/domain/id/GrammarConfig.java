package ca.gc.cra.trace.domain.id;

import java.util.Objects;

/**
 * Shape parameters of the identifier grammar.
 *
 * @param prefix project prefix written before every qualified identifier (e.g. {@code REQ})
 * @param sequenceDigits exact number of digits in the sequence component
 * @param namespaceLength exact number of upper-case letters in an associated-repository namespace
 * @since 0.1.0
 */
public record GrammarConfig(String prefix, int sequenceDigits, int namespaceLength) {

  public GrammarConfig {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches("[A-Z]+")) {
      throw new IllegalArgumentException("prefix must be upper-case letters (was '" + prefix + "')");
    }
    if (sequenceDigits < 1 || sequenceDigits > 12) {
      throw new IllegalArgumentException("sequenceDigits must be between 1 and 12 (was " + sequenceDigits + ")");
    }
    if (namespaceLength < 1 || namespaceLength > 8) {
      throw new IllegalArgumentException("namespaceLength must be between 1 and 8 (was " + namespaceLength + ")");
    }
  }

  /** {@code REQ}, five digits, three-letter namespaces. */
  public static GrammarConfig defaults() {
    return new GrammarConfig("REQ", 5, 3);
  }
}
