package ca.gc.cra.trace.domain.id;

import ca.gc.cra.trace.domain.util.Suggestions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parser and validator for requirement identifiers such as {@code REQ-CAL-p00001-A}.
 * <p><strong>Why:</strong> Every reference in a document funnels through this grammar, so authoring mistakes must
 * come back as actionable failures rather than exceptions.</p>
 * <p><strong>Role:</strong> Domain service used by the document parser and the graph builder.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept canonical qualified identifiers and bare identifiers without the prefix.</li>
 *   <li>Explain rejected text and derive a corrected canonical form from known authoring mistakes.</li>
 *   <li>Fall back to an edit-distance match on the prefix token when normalization alone fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> One precompiled regex match per call; suggestions are only computed on failure.</p>
 *
 * @since 0.1.0
 */
public final class IdentifierGrammar {
  private static final Pattern SEPARATORS = Pattern.compile("[-_.:\\s]+");
  private static final Pattern WRONG_SEPARATOR = Pattern.compile("[_.:\\s]");
  private static final Pattern LEVEL_TOKEN = Pattern.compile("([A-Za-z])(\\d+)([A-Za-z]*)");
  private static final Pattern ALPHA = Pattern.compile("[A-Za-z]+");

  private final GrammarConfig config;
  private final Pattern canonical;

  /** Creates a grammar with {@link GrammarConfig#defaults()}. */
  public IdentifierGrammar() {
    this(GrammarConfig.defaults());
  }

  public IdentifierGrammar(GrammarConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    StringBuilder codes = new StringBuilder();
    for (Level level : Level.values()) {
      codes.append(level.code());
    }
    this.canonical = Pattern.compile(
        "^(?:(?<prefix>" + Pattern.quote(config.prefix()) + ")-)?"
            + "(?:(?<ns>[A-Z]{" + config.namespaceLength() + "})-)?"
            + "(?<level>[" + codes + "])"
            + "(?<seq>[0-9]{" + config.sequenceDigits() + "})"
            + "(?<labels>(?:-[A-Z])*)$");
  }

  public GrammarConfig config() {
    return config;
  }

  /**
   * Parses identifier text.
   *
   * @param text candidate identifier; {@code null} and blank text produce a failure
   * @return {@link ParsedIdentifier} on success, {@link ParseFailure} otherwise; never throws
   */
  public IdentifierParse parse(String text) {
    if (text == null || text.isBlank()) {
      return new ParseFailure(text == null ? "" : text, "identifier is empty", null);
    }
    String trimmed = text.trim();
    Matcher m = canonical.matcher(trimmed);
    if (m.matches()) {
      List<String> labels = splitLabels(m.group("labels"));
      if (new HashSet<>(labels).size() != labels.size()) {
        return new ParseFailure(text, "assertion label repeated in '" + trimmed + "'",
            new Identifier(config.prefix(), m.group("ns"), levelOf(m.group("level")), m.group("seq"), labels)
                .toString());
      }
      Identifier id = new Identifier(
          config.prefix(), m.group("ns"), levelOf(m.group("level")), m.group("seq"), labels);
      return new ParsedIdentifier(text, id, m.group("prefix") != null);
    }
    return new ParseFailure(text, reasonFor(trimmed), suggest(trimmed));
  }

  /** Convenience for callers that only need the identifier. */
  public Optional<Identifier> tryParse(String text) {
    return parse(text) instanceof ParsedIdentifier parsed ? Optional.of(parsed.identifier()) : Optional.empty();
  }

  public boolean isValid(String text) {
    return parse(text).isSuccess();
  }

  /**
   * Whether the leading token of {@code text} looks like an attempt at the configured prefix, used by the document
   * parser to decide if a heading was meant to be a requirement header.
   */
  public boolean looksLikeIdentifier(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    String[] tokens = SEPARATORS.split(text.trim());
    if (tokens.length < 2 || tokens[0].isEmpty() || !text.matches(".*\\d.*")) {
      return false;
    }
    String head = tokens[0];
    return head.equalsIgnoreCase(config.prefix())
        || Suggestions.distance(head.toUpperCase(Locale.ROOT), config.prefix()) <= 1;
  }

  /**
   * Formats a whole-requirement identifier with the configured prefix and zero padding.
   *
   * @throws IllegalArgumentException when {@code sequence} does not fit the configured width
   */
  public Identifier identifier(String namespace, Level level, int sequence) {
    Objects.requireNonNull(level, "level");
    String digits = Integer.toString(sequence);
    if (sequence < 0 || digits.length() > config.sequenceDigits()) {
      throw new IllegalArgumentException(
          "sequence " + sequence + " does not fit " + config.sequenceDigits() + " digits");
    }
    return new Identifier(config.prefix(), namespace, level, pad(digits), List.of());
  }

  private static Level levelOf(String code) {
    return Level.fromCode(code).orElseThrow(() -> new IllegalStateException("level code " + code));
  }

  private static List<String> splitLabels(String raw) {
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    List<String> labels = new ArrayList<>();
    for (String part : raw.split("-")) {
      if (!part.isEmpty()) {
        labels.add(part);
      }
    }
    return labels;
  }

  private String reasonFor(String text) {
    Matcher sep = WRONG_SEPARATOR.matcher(text);
    if (sep.find()) {
      String found = sep.group();
      return "identifier '" + text + "' uses '" + (found.isBlank() ? "space" : found)
          + "' as a separator; components are separated by '-'";
    }
    String[] tokens = SEPARATORS.split(text);
    String head = tokens[0];
    if (!head.equals(config.prefix()) && head.equalsIgnoreCase(config.prefix())) {
      return "prefix must be written '" + config.prefix() + "' in '" + text + "'";
    }
    for (String token : tokens) {
      Matcher lm = LEVEL_TOKEN.matcher(token);
      if (!lm.matches()) {
        continue;
      }
      String code = lm.group(1);
      if (Level.fromCode(code).isEmpty()) {
        if (Level.fromCode(code.toLowerCase(Locale.ROOT)).isPresent()) {
          return "level code must be lower case ('" + code.toLowerCase(Locale.ROOT) + "') in '" + text + "'";
        }
        return "unknown level code '" + code + "' in '" + text + "'; expected one of p, o, d";
      }
      if (lm.group(2).length() != config.sequenceDigits()) {
        return "sequence must have exactly " + config.sequenceDigits() + " digits in '" + text + "'";
      }
      if (!lm.group(3).isEmpty()) {
        return "assertion label must follow '-' in '" + text + "'";
      }
    }
    for (int i = 1; i < tokens.length; i++) {
      if (tokens[i].length() == 1 && Character.isLowerCase(tokens[i].charAt(0))) {
        return "assertion labels must be upper case in '" + text + "'";
      }
    }
    if (ALPHA.matcher(head).matches() && !head.equalsIgnoreCase(config.prefix())
        && head.length() != config.namespaceLength()) {
      return "unknown prefix '" + head + "' in '" + text + "'; expected '" + config.prefix() + "'";
    }
    return "'" + text + "' does not match " + config.prefix() + "-[NS-]<p|o|d><"
        + config.sequenceDigits() + " digits>[-A...]";
  }

  private String suggest(String text) {
    String normalized = normalize(text, false);
    if (normalized != null && !normalized.equals(text) && canonical.matcher(normalized).matches()) {
      return normalized;
    }
    String fuzzy = normalize(text, true);
    if (fuzzy != null && !fuzzy.equals(text) && canonical.matcher(fuzzy).matches()) {
      return fuzzy;
    }
    return null;
  }

  /**
   * Rebuilds text token by token, applying the known-mistake corrections. With {@code fuzzyPrefix} the leading token
   * is also replaced by the prefix when it is within edit distance of it.
   *
   * @return candidate canonical text, or {@code null} when the tokens cannot be mapped onto the grammar
   */
  private String normalize(String text, boolean fuzzyPrefix) {
    String[] tokens = SEPARATORS.split(text.trim());
    List<String> out = new ArrayList<>();
    out.add(config.prefix());
    int i = 0;
    if (i < tokens.length && ALPHA.matcher(tokens[i]).matches() && tokens.length > 1) {
      String head = tokens[i];
      if (head.equalsIgnoreCase(config.prefix())) {
        i++;
      } else if (fuzzyPrefix && Suggestions.nearest(head, List.of(config.prefix())).isPresent()) {
        i++;
      }
    }
    if (i < tokens.length && tokens.length > i + 1 && ALPHA.matcher(tokens[i]).matches()
        && tokens[i].length() == config.namespaceLength()) {
      out.add(tokens[i].toUpperCase(Locale.ROOT));
      i++;
    }
    if (i >= tokens.length) {
      return null;
    }
    Matcher lm = LEVEL_TOKEN.matcher(tokens[i]);
    if (!lm.matches()) {
      return null;
    }
    String code = lm.group(1).toLowerCase(Locale.ROOT);
    if (Level.fromCode(code).isEmpty()) {
      return null;
    }
    String digits = lm.group(2);
    if (digits.length() > config.sequenceDigits()) {
      String stripped = digits.replaceFirst("^0+(?=\\d)", "");
      if (stripped.length() > config.sequenceDigits()) {
        return null;
      }
      digits = stripped;
    }
    out.add(code + pad(digits));
    Set<String> labels = new LinkedHashSet<>();
    for (char glued : lm.group(3).toCharArray()) {
      labels.add(String.valueOf(Character.toUpperCase(glued)));
    }
    i++;
    for (; i < tokens.length; i++) {
      if (!ALPHA.matcher(tokens[i]).matches()) {
        return null;
      }
      for (char label : tokens[i].toCharArray()) {
        labels.add(String.valueOf(Character.toUpperCase(label)));
      }
    }
    out.addAll(labels);
    return String.join("-", out);
  }

  private String pad(String digits) {
    StringBuilder sb = new StringBuilder(config.sequenceDigits());
    for (int k = digits.length(); k < config.sequenceDigits(); k++) {
      sb.append('0');
    }
    return sb.append(digits).toString();
  }
}
