package ca.gc.cra.trace.domain.id;

/**
 * Outcome of {@link IdentifierGrammar#parse(String)}: either a {@link ParsedIdentifier} or a
 * {@link ParseFailure}. Failures are data, never exceptions.
 *
 * @since 0.1.0
 */
public sealed interface IdentifierParse permits ParsedIdentifier, ParseFailure {

  /** Original text handed to the grammar. */
  String input();

  default boolean isSuccess() {
    return this instanceof ParsedIdentifier;
  }
}
