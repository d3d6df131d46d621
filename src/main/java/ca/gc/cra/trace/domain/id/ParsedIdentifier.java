package ca.gc.cra.trace.domain.id;

import java.util.Objects;

/**
 * Successful identifier parse.
 *
 * @param input text as written
 * @param identifier parsed identifier, always carrying the configured prefix
 * @param qualified {@code true} when the input carried the prefix, {@code false} for bare forms such as
 *     {@code p00001}
 * @since 0.1.0
 */
public record ParsedIdentifier(String input, Identifier identifier, boolean qualified)
    implements IdentifierParse {

  public ParsedIdentifier {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(identifier, "identifier");
  }
}
