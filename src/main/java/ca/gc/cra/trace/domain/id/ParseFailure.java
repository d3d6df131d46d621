package ca.gc.cra.trace.domain.id;

import java.util.Objects;
import java.util.Optional;

/**
 * Rejected identifier text with a human-actionable reason and, when one could be derived, the corrected form.
 *
 * @param input text as written
 * @param reason why the text was rejected
 * @param suggestion corrected canonical text; {@code null} when no correction is known
 * @since 0.1.0
 */
public record ParseFailure(String input, String reason, String suggestion) implements IdentifierParse {

  public ParseFailure {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(reason, "reason");
  }

  public Optional<String> suggestionOptional() {
    return Optional.ofNullable(suggestion);
  }

  /** Reason followed by the correction hint when present, ready for a diagnostic message. */
  public String describe() {
    if (suggestion == null) {
      return reason;
    }
    return reason + " (did you mean '" + suggestion + "'?)";
  }
}
