package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.id.Identifier;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.id.IdentifierParse;
import ca.gc.cra.trace.domain.id.ParseFailure;
import ca.gc.cra.trace.domain.id.ParsedIdentifier;
import ca.gc.cra.trace.domain.record.Journey;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads user journey blocks ({@code ## JNY-Login-01: Title}) from the same documents that hold requirements.
 *
 * <p>A journey block runs until a heading of the same or higher rank, a {@code ---} rule, an {@code *End*} marker
 * or the end of the document. {@code **Actor**}, {@code **Goal**} and {@code **Addresses**} fields are read; steps
 * are the numbered or bulleted items after a {@code Steps} heading or field.</p>
 *
 * @since 0.1.0
 */
public final class JourneyParser {
  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*$");
  private static final Pattern FIELD = Pattern.compile("^\\s*\\*\\*(?<key>[^*]+?)\\*\\*\\s*:\\s*(?<value>.*?)\\s*$");
  private static final Pattern STEP = Pattern.compile("^\\s*(?:\\d+[.)]|[-*+])\\s+(.+)$");
  private static final Pattern END = Pattern.compile("^\\s*(?:-{3,}|\\*End\\*.*)\\s*$", Pattern.CASE_INSENSITIVE);

  private final IdentifierGrammar grammar;
  private final String prefix;
  private final Pattern idPattern;

  public JourneyParser(IdentifierGrammar grammar, String prefix) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.idPattern = Pattern.compile("^" + Pattern.quote(prefix) + "(?:-[A-Za-z0-9]+)+$");
  }

  public JourneyParseResult parse(String text, String path) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(path, "path");
    List<Journey> journeys = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();
    String[] lines = text.split("\\R", -1);

    Draft draft = null;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      int lineNo = i + 1;
      Matcher heading = HEADING.matcher(line);
      if (heading.matches()) {
        int depth = heading.group(1).length();
        String content = heading.group(2);
        if (content.regionMatches(true, 0, prefix + "-", 0, prefix.length() + 1)) {
          draft = close(draft, journeys);
          int colon = content.indexOf(':');
          String id = (colon >= 0 ? content.substring(0, colon) : content).trim();
          String title = colon >= 0 ? content.substring(colon + 1).trim() : "";
          if (!idPattern.matcher(id).matches()) {
            diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_BLOCK, null,
                "malformed journey header '" + id + "'; expected " + prefix + "-<Descriptor>-<nn>: <title>",
                SourceLocation.of(path, lineNo)));
            continue;
          }
          draft = new Draft(id, title, depth, SourceLocation.of(path, lineNo));
          continue;
        }
        if (draft != null) {
          if (content.trim().equalsIgnoreCase("steps")) {
            draft.inSteps = true;
            continue;
          }
          if (depth <= draft.depth) {
            draft = close(draft, journeys);
          } else {
            draft.inSteps = false;
          }
        }
        continue;
      }
      if (draft == null) {
        continue;
      }
      if (END.matcher(line).matches()) {
        draft = close(draft, journeys);
        continue;
      }
      Matcher field = FIELD.matcher(line);
      if (field.matches()) {
        String key = field.group("key").trim().toLowerCase(Locale.ROOT);
        String value = field.group("value");
        draft.inSteps = false;
        switch (key) {
          case "actor" -> draft.actor = value;
          case "goal" -> draft.goal = value;
          case "steps" -> draft.inSteps = true;
          case "addresses" -> addresses(draft, value, path, lineNo, diagnostics);
          default -> {
            // other fields are descriptive only
          }
        }
        continue;
      }
      if (draft.inSteps) {
        Matcher step = STEP.matcher(line);
        if (step.matches()) {
          draft.steps.add(step.group(1).trim());
        }
      }
    }
    close(draft, journeys);
    return new JourneyParseResult(journeys, diagnostics);
  }

  private void addresses(Draft draft, String value, String path, int lineNo, List<Diagnostic> diagnostics) {
    for (String part : value.split(",")) {
      String target = part.trim();
      if (target.isEmpty() || target.equals("-")) {
        continue;
      }
      IdentifierParse parsed = grammar.parse(target);
      if (parsed instanceof ParsedIdentifier ok) {
        for (Identifier id : ok.identifier().expand()) {
          draft.addresses.add(id.toString());
        }
      } else if (parsed instanceof ParseFailure failure) {
        diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_REFERENCE, draft.id,
            "Addresses target rejected: " + failure.describe(), SourceLocation.of(path, lineNo)));
      }
    }
  }

  private static Draft close(Draft draft, List<Journey> journeys) {
    if (draft != null) {
      journeys.add(new Journey(draft.id, draft.title, draft.actor, draft.goal, draft.steps, draft.addresses,
          draft.location));
    }
    return null;
  }

  private static final class Draft {
    final String id;
    final String title;
    final int depth;
    final SourceLocation location;
    final List<String> steps = new ArrayList<>();
    final List<String> addresses = new ArrayList<>();
    String actor = "";
    String goal = "";
    boolean inSteps;

    Draft(String id, String title, int depth, SourceLocation location) {
      this.id = id;
      this.title = title;
      this.depth = depth;
      this.location = location;
    }
  }
}
