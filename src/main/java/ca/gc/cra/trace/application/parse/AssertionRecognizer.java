package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant recognizer for the lines of one requirement's assertions section.
 *
 * <p>Accepts lettered ({@code A.}, {@code A)}, {@code (A)}), numbered ({@code 1.}, {@code 1)}) and bulleted
 * ({@code -}, {@code *}, {@code +}) items. Numbered and bulleted items are relabelled {@code A}, {@code B}, ... and
 * reported once at INFO. A non-blank line that matches no style continues the previous item, blank lines
 * included; before the first item such a line is reported once. One instance per block; not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class AssertionRecognizer {
  static final String EXPECTED_BROKEN_MARKER = "[expected-broken]";

  private static final Pattern LETTERED =
      Pattern.compile("^\\s*(?:\\(([A-Za-z])\\)|([A-Za-z])[.)])\\s+(.+)$");
  private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d{1,3})[.)]\\s+(.+)$");
  private static final Pattern BULLETED = Pattern.compile("^\\s*[-*+]\\s+(.+)$");
  private static final Pattern MARKER =
      Pattern.compile("\\s*" + Pattern.quote(EXPECTED_BROKEN_MARKER) + "\\s*", Pattern.CASE_INSENSITIVE);

  private final String requirementId;
  private final String path;
  private final List<Diagnostic> diagnostics;
  private final List<Pending> items = new ArrayList<>();
  private final Set<String> labels = new HashSet<>();
  private Pending current;
  private boolean strayReported;
  private boolean styleReported;

  AssertionRecognizer(String requirementId, String path, List<Diagnostic> diagnostics) {
    this.requirementId = Objects.requireNonNull(requirementId, "requirementId");
    this.path = Objects.requireNonNull(path, "path");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /** Feeds one line of the assertions section. */
  void accept(String line, int lineNo) {
    if (line.isBlank()) {
      return;
    }
    Matcher lettered = LETTERED.matcher(line);
    if (lettered.matches()) {
      String letter = lettered.group(1) != null ? lettered.group(1) : lettered.group(2);
      start(letter.toUpperCase(Locale.ROOT), lettered.group(3), lineNo);
      return;
    }
    Matcher numbered = NUMBERED.matcher(line);
    if (numbered.matches()) {
      int n = Integer.parseInt(numbered.group(1));
      if (n < 1 || n > 26) {
        diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_ASSERTION, requirementId,
            "assertion number " + n + " cannot be mapped to a letter label", SourceLocation.of(path, lineNo)));
        current = null;
        return;
      }
      reportStyle("numbered", lineNo);
      start(String.valueOf((char) ('A' + n - 1)), numbered.group(2), lineNo);
      return;
    }
    Matcher bulleted = BULLETED.matcher(line);
    if (bulleted.matches()) {
      int position = items.size();
      if (position >= 26) {
        diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_ASSERTION, requirementId,
            "more than 26 assertions; bullet ignored", SourceLocation.of(path, lineNo)));
        current = null;
        return;
      }
      reportStyle("bulleted", lineNo);
      start(String.valueOf((char) ('A' + position)), bulleted.group(1), lineNo);
      return;
    }
    if (current != null) {
      current.text.append(' ').append(line.trim());
    } else if (items.isEmpty() && !strayReported) {
      strayReported = true;
      diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_ASSERTION, requirementId,
          "text before the first assertion is not part of any assertion", SourceLocation.of(path, lineNo)));
    }
  }

  /** Assertions recognized so far, in document order. */
  List<Assertion> assertions() {
    List<Assertion> out = new ArrayList<>(items.size());
    for (Pending item : items) {
      String text = item.text.toString();
      Matcher marker = MARKER.matcher(text);
      boolean expectedBroken = marker.find();
      if (expectedBroken) {
        text = marker.replaceAll(" ");
      }
      out.add(new Assertion(item.label, text.trim().replaceAll("\\s+", " "), requirementId, item.line,
          expectedBroken));
    }
    return out;
  }

  private void start(String label, String text, int lineNo) {
    if (!labels.add(label)) {
      diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_ASSERTION, requirementId,
          "duplicate assertion label " + label + "; later definition ignored", SourceLocation.of(path, lineNo)));
      current = null;
      return;
    }
    current = new Pending(label, lineNo, new StringBuilder(text.trim()));
    items.add(current);
  }

  private void reportStyle(String style, int lineNo) {
    if (styleReported) {
      return;
    }
    styleReported = true;
    diagnostics.add(Diagnostic.info(CheckName.MALFORMED_ASSERTION, requirementId,
        "assertions use " + style + " style; labels assigned A, B, ... in order", SourceLocation.of(path, lineNo)));
  }

  private record Pending(String label, int line, StringBuilder text) {}
}
