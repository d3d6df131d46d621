package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.application.parse.MetadataKeywords.Match;
import ca.gc.cra.trace.application.parse.MetadataKeywords.Resolution;
import ca.gc.cra.trace.domain.diagnostic.CheckName;
import ca.gc.cra.trace.domain.diagnostic.Diagnostic;
import ca.gc.cra.trace.domain.id.Identifier;
import ca.gc.cra.trace.domain.id.IdentifierGrammar;
import ca.gc.cra.trace.domain.id.IdentifierParse;
import ca.gc.cra.trace.domain.id.Level;
import ca.gc.cra.trace.domain.id.ParseFailure;
import ca.gc.cra.trace.domain.id.ParsedIdentifier;
import ca.gc.cra.trace.domain.requirement.Assertion;
import ca.gc.cra.trace.domain.requirement.ContentHasher;
import ca.gc.cra.trace.domain.requirement.Reference;
import ca.gc.cra.trace.domain.requirement.ReferenceKind;
import ca.gc.cra.trace.domain.requirement.Requirement;
import ca.gc.cra.trace.domain.requirement.RequirementStatus;
import ca.gc.cra.trace.domain.requirement.SourceLocation;
import ca.gc.cra.trace.domain.util.Suggestions;
import ca.gc.cra.trace.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Line-oriented, recovering parser that turns one document's text into {@link Requirement}
 * records and parse diagnostics.
 * <p><strong>Why:</strong> Documents are hand-written; one malformed block must cost a diagnostic, not the rest of the
 * document.</p>
 * <p><strong>Role:</strong> Application service invoked once per document by {@link DocumentCorpusParser}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect requirement blocks from {@code ## <id>: <title>} headers through {@code *End*} markers, or through
 *   the next header when the marker is missing.</li>
 *   <li>Read metadata fields, delegating reference targets to {@link IdentifierGrammar}.</li>
 *   <li>Collect assertions through {@link AssertionRecognizer} and rationale text.</li>
 *   <li>Read the stored hash and compute the expected one with {@link ContentHasher}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; one instance may parse documents concurrently.</p>
 * <p><strong>Performance:</strong> Single pass over the lines with precompiled patterns.</p>
 * <p><strong>Observability:</strong> Logs per-document counts at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class DocumentParser {
  private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*$");
  private static final Pattern END_MARKER = Pattern.compile(
      "^\\s*\\*End\\*\\s+\\*(?<name>[^*]+)\\*(?:\\s*\\|\\s*\\*\\*Hash\\*\\*\\s*:\\s*(?<hash>\\S+))?\\s*$",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern BOLD_FIELD = Pattern.compile("^\\s*\\*\\*(?<key>[^*]+?)\\*\\*\\s*:\\s*(?<value>.*?)\\s*$");
  private static final Pattern PLAIN_FIELD = Pattern.compile("^(?<key>[A-Za-z]+)\\s*:\\s*(?<value>.*?)\\s*$");
  private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");
  private static final Set<String> NO_REFERENCE = Set.of("-", "none", "n/a", "null", "x");
  private static final int LOG_TITLE_BYTES = 80;

  private final IdentifierGrammar grammar;
  private final ContentHasher hasher;
  private final String journeyPrefix;

  /** Parser with the default grammar, hash length and {@code JNY} journey prefix. */
  public DocumentParser() {
    this(new IdentifierGrammar(), new ContentHasher(), "JNY");
  }

  /**
   * Creates a parser.
   *
   * @param grammar identifier grammar for headers and reference targets
   * @param hasher content hasher producing {@link Requirement#computedHash()}
   * @param journeyPrefix prefix of journey headers, which close any open requirement block
   */
  public DocumentParser(IdentifierGrammar grammar, ContentHasher hasher, String journeyPrefix) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.journeyPrefix = Objects.requireNonNull(journeyPrefix, "journeyPrefix");
  }

  /**
   * Parses one document.
   *
   * @param text full document text
   * @param path document path used in source locations
   * @return requirements in document order with their diagnostics; never throws for malformed content
   */
  public ParseResult parse(String text, String path) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(path, "path");
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Requirement> requirements = new ArrayList<>();
    String subdirectory = subdirectory(path);
    String[] lines = text.split("\\R", -1);

    Block block = null;
    boolean skipping = false;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      int lineNo = i + 1;

      Matcher end = END_MARKER.matcher(line);
      if (end.matches()) {
        if (block != null) {
          requirements.add(finish(block, lineNo, true, end.group("name"), end.group("hash"), subdirectory,
              diagnostics));
          block = null;
        }
        skipping = false;
        continue;
      }

      Matcher heading = HEADING.matcher(line);
      if (heading.matches()) {
        String content = heading.group(2);
        if (content.regionMatches(true, 0, journeyPrefix + "-", 0, journeyPrefix.length() + 1)) {
          block = closeOpen(block, lineNo, subdirectory, requirements, diagnostics);
          skipping = false;
          continue;
        }
        Header header = header(content);
        IdentifierParse parsed = grammar.parse(header.idToken());
        if (parsed instanceof ParsedIdentifier ok && !ok.identifier().isAssertionScoped()) {
          block = closeOpen(block, lineNo, subdirectory, requirements, diagnostics);
          skipping = false;
          block = new Block(ok.identifier(), header.title(), lineNo, path, diagnostics);
          if (header.title().isEmpty()) {
            diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_BLOCK, ok.identifier().toString(),
                "header has no title; expected '" + ok.identifier() + ": <title>'", SourceLocation.of(path, lineNo)));
          }
          continue;
        }
        if (parsed instanceof ParseFailure failure && grammar.looksLikeIdentifier(header.idToken())) {
          block = closeOpen(block, lineNo, subdirectory, requirements, diagnostics);
          skipping = true;
          diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_BLOCK, null,
              "malformed requirement header: " + failure.describe() + "; block skipped",
              SourceLocation.of(path, lineNo)));
          continue;
        }
        if (block != null) {
          block.section(content, line);
        }
        continue;
      }

      if (block == null || skipping) {
        continue;
      }
      switch (block.section) {
        case ASSERTIONS -> block.assertions.accept(line, lineNo);
        case RATIONALE -> block.rationale.add(line);
        case BODY -> {
          if (!metadata(block, line, lineNo, diagnostics)) {
            block.body.add(line);
          }
        }
      }
      if (!line.isBlank()) {
        block.lastContentLine = lineNo;
      }
    }
    closeOpen(block, lines.length, subdirectory, requirements, diagnostics);
    log.debug("Parsed {} requirements from {} ({} diagnostics)", requirements.size(), path, diagnostics.size());
    return new ParseResult(requirements, diagnostics);
  }

  /**
   * Directory classification of a document: the path components between the first directory and the file name,
   * e.g. {@code spec/roadmap/a.md} gives {@code roadmap}.
   */
  public static String subdirectory(String path) {
    String[] parts = path.replace('\\', '/').split("/");
    List<String> components = new ArrayList<>();
    for (String part : parts) {
      if (!part.isEmpty() && !part.equals(".")) {
        components.add(part);
      }
    }
    if (components.size() < 3) {
      return "";
    }
    return String.join("/", components.subList(1, components.size() - 1));
  }

  private Block closeOpen(Block block, int lineNo, String subdirectory, List<Requirement> requirements,
      List<Diagnostic> diagnostics) {
    if (block != null) {
      int last = block.lastContentLine > 0 ? block.lastContentLine : lineNo;
      requirements.add(finish(block, last, false, null, null, subdirectory, diagnostics));
    }
    return null;
  }

  private Requirement finish(Block block, int endLine, boolean endMarker, String endName, String rawHash,
      String subdirectory, List<Diagnostic> diagnostics) {
    String id = block.id.toString();
    if (!endMarker) {
      log.debug("No end marker for {} in {}; block ends at line {}", id, block.path, endLine);
    } else if (endName != null && !matchesEndName(block, endName.trim())) {
      diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_BLOCK, id,
          "end marker names '" + endName.trim() + "' but closes " + id, SourceLocation.of(block.path, endLine)));
    }
    String storedHash = null;
    if (rawHash != null) {
      if (HEX.matcher(rawHash).matches()) {
        storedHash = rawHash.toLowerCase(Locale.ROOT);
      } else {
        diagnostics.add(Diagnostic.warning(CheckName.METADATA, id,
            "stored hash '" + rawHash + "' is not hexadecimal; ignored", SourceLocation.of(block.path, endLine)));
      }
    }
    List<Assertion> assertions = block.assertions.assertions();
    String body = trimBlankLines(block.body);
    String computed = hasher.hash(block.title, body, assertions);
    Requirement requirement = new Requirement(
        block.id,
        block.title,
        block.id.level(),
        block.status,
        body,
        trimBlankLines(block.rationale),
        assertions,
        block.references,
        storedHash,
        computed,
        new SourceLocation(block.path, block.startLine, endLine),
        block.tags,
        subdirectory,
        false);
    if (log.isDebugEnabled()) {
      log.debug("Parsed {} '{}' at {}:{} with {} assertions", id, Logs.truncate(block.title, LOG_TITLE_BYTES),
          block.path, block.startLine, assertions.size());
    }
    return requirement;
  }

  private static boolean matchesEndName(Block block, String name) {
    return name.equals(block.id.toString()) || name.equalsIgnoreCase(block.title.trim())
        || name.equals(block.id.toString().substring(block.id.prefix().length() + 1));
  }

  private boolean metadata(Block block, String line, int lineNo, List<Diagnostic> diagnostics) {
    boolean recognized = false;
    for (String segment : line.split("\\|")) {
      Matcher field = BOLD_FIELD.matcher(segment);
      if (!field.matches()) {
        continue;
      }
      String written = field.group("key").trim();
      Resolution resolution = MetadataKeywords.resolve(written);
      if (resolution.match() == Match.UNKNOWN) {
        continue;
      }
      recognized = true;
      if (resolution.match() == Match.MISSPELLED) {
        diagnostics.add(Diagnostic.warning(checkFor(resolution.keyword()), block.id.toString(),
            "unknown metadata keyword '" + written + "' (did you mean '" + resolution.keyword() + "'?); value ignored",
            SourceLocation.of(block.path, lineNo)));
        continue;
      }
      if (resolution.match() == Match.MISCASED) {
        reportMiscased(block, written, resolution.keyword(), lineNo, diagnostics);
      }
      apply(block, resolution.keyword(), field.group("value"), lineNo, diagnostics);
    }
    if (recognized) {
      return true;
    }
    Matcher plain = PLAIN_FIELD.matcher(line);
    if (plain.matches()) {
      Resolution resolution = MetadataKeywords.resolve(plain.group("key"));
      if (resolution.usable()) {
        if (resolution.match() == Match.MISCASED) {
          reportMiscased(block, plain.group("key"), resolution.keyword(), lineNo, diagnostics);
        }
        apply(block, resolution.keyword(), plain.group("value"), lineNo, diagnostics);
        return true;
      }
    }
    return false;
  }

  private static void reportMiscased(Block block, String written, String keyword, int lineNo,
      List<Diagnostic> diagnostics) {
    diagnostics.add(Diagnostic.warning(checkFor(keyword), block.id.toString(),
        "metadata keyword '" + written + "' should be written '" + keyword + "'",
        SourceLocation.of(block.path, lineNo)));
  }

  private static CheckName checkFor(String keyword) {
    return MetadataKeywords.isReferenceKeyword(keyword) ? CheckName.MALFORMED_REFERENCE : CheckName.METADATA;
  }

  private void apply(Block block, String keyword, String value, int lineNo, List<Diagnostic> diagnostics) {
    SourceLocation at = SourceLocation.of(block.path, lineNo);
    String id = block.id.toString();
    switch (keyword) {
      case MetadataKeywords.LEVEL -> {
        Optional<Level> level = Level.parse(value);
        if (level.isEmpty()) {
          diagnostics.add(Diagnostic.warning(CheckName.METADATA, id,
              hint("unknown level '" + value + "'", Suggestions.nearest(value, Level.keywords())), at));
        } else if (level.get() != block.id.level()) {
          diagnostics.add(Diagnostic.warning(CheckName.METADATA, id,
              "declared level " + level.get().shortName() + " disagrees with identifier level code '"
                  + block.id.level().code() + "'; using " + block.id.level().shortName(), at));
        }
      }
      case MetadataKeywords.STATUS -> {
        Optional<RequirementStatus> status = RequirementStatus.parse(value);
        if (status.isPresent()) {
          block.status = status.get();
        } else {
          block.status = RequirementStatus.UNKNOWN;
          diagnostics.add(Diagnostic.warning(CheckName.METADATA, id,
              hint("unknown status '" + value + "'", Suggestions.nearest(value, RequirementStatus.keywords())), at));
        }
      }
      case MetadataKeywords.IMPLEMENTS -> identifiers(block, ReferenceKind.IMPLEMENTS, value, lineNo, diagnostics);
      case MetadataKeywords.REFINES -> identifiers(block, ReferenceKind.REFINES, value, lineNo, diagnostics);
      case MetadataKeywords.ADDRESSES -> {
        for (String target : values(value)) {
          block.references.add(new Reference(ReferenceKind.ADDRESSES, target, lineNo));
        }
      }
      case MetadataKeywords.TAGS -> block.tags.addAll(values(value));
      default -> throw new IllegalStateException("unhandled metadata keyword " + keyword);
    }
  }

  private void identifiers(Block block, ReferenceKind kind, String value, int lineNo, List<Diagnostic> diagnostics) {
    for (String target : values(value)) {
      IdentifierParse parsed = grammar.parse(target);
      if (parsed instanceof ParsedIdentifier ok) {
        for (Identifier expanded : ok.identifier().expand()) {
          block.references.add(new Reference(kind, expanded.toString(), lineNo));
        }
      } else if (parsed instanceof ParseFailure failure) {
        diagnostics.add(Diagnostic.warning(CheckName.MALFORMED_REFERENCE, block.id.toString(),
            kind.keyword() + " target rejected: " + failure.describe(), SourceLocation.of(block.path, lineNo)));
      }
    }
  }

  private static List<String> values(String value) {
    List<String> out = new ArrayList<>();
    if (value == null) {
      return out;
    }
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty() && !NO_REFERENCE.contains(trimmed.toLowerCase(Locale.ROOT))) {
        out.add(trimmed);
      }
    }
    return out;
  }

  private static String hint(String message, Optional<String> suggestion) {
    return suggestion.map(s -> message + " (did you mean '" + s + "'?)").orElse(message);
  }

  private static String trimBlankLines(List<String> lines) {
    int from = 0;
    int to = lines.size();
    while (from < to && lines.get(from).isBlank()) {
      from++;
    }
    while (to > from && lines.get(to - 1).isBlank()) {
      to--;
    }
    List<String> kept = new ArrayList<>(to - from);
    for (String line : lines.subList(from, to)) {
      kept.add(line.stripTrailing());
    }
    return String.join("\n", kept);
  }

  private static Header header(String content) {
    int colon = content.indexOf(':');
    if (colon >= 0) {
      return new Header(content.substring(0, colon).trim(), content.substring(colon + 1).trim());
    }
    String[] parts = content.trim().split("\\s+", 2);
    return new Header(parts[0], parts.length > 1 ? parts[1].trim() : "");
  }

  private record Header(String idToken, String title) {}

  private enum Section {
    BODY,
    RATIONALE,
    ASSERTIONS
  }

  private static final class Block {
    final Identifier id;
    final String title;
    final int startLine;
    final String path;
    final List<String> body = new ArrayList<>();
    final List<String> rationale = new ArrayList<>();
    final List<Reference> references = new ArrayList<>();
    final List<String> tags = new ArrayList<>();
    final AssertionRecognizer assertions;
    RequirementStatus status = RequirementStatus.ACTIVE;
    Section section = Section.BODY;
    int lastContentLine;

    Block(Identifier id, String title, int startLine, String path, List<Diagnostic> diagnostics) {
      this.id = id;
      this.title = title;
      this.startLine = startLine;
      this.path = path;
      this.lastContentLine = startLine;
      this.assertions = new AssertionRecognizer(id.toString(), path, diagnostics);
    }

    void section(String headingText, String line) {
      String name = headingText.trim().toLowerCase(Locale.ROOT);
      if (name.equals("assertions")) {
        section = Section.ASSERTIONS;
      } else if (name.equals("rationale")) {
        section = Section.RATIONALE;
      } else {
        section = Section.BODY;
        body.add(line);
      }
    }
  }
}
