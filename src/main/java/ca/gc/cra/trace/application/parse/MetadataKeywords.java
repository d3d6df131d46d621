package ca.gc.cra.trace.application.parse;

import ca.gc.cra.trace.domain.util.Suggestions;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves metadata field names such as {@code Implements} as written by authors, classifying exact, miscased and
 * misspelled spellings.
 *
 * @since 0.1.0
 */
final class MetadataKeywords {
  static final String LEVEL = "Level";
  static final String STATUS = "Status";
  static final String IMPLEMENTS = "Implements";
  static final String REFINES = "Refines";
  static final String ADDRESSES = "Addresses";
  static final String TAGS = "Tags";

  static final List<String> KEYWORDS = List.of(LEVEL, STATUS, IMPLEMENTS, REFINES, ADDRESSES, TAGS);

  private static final Map<String, String> KNOWN_MISTAKES = Map.ofEntries(
      Map.entry("implement", IMPLEMENTS),
      Map.entry("implemented", IMPLEMENTS),
      Map.entry("implementation", IMPLEMENTS),
      Map.entry("impl", IMPLEMENTS),
      Map.entry("implments", IMPLEMENTS),
      Map.entry("refine", REFINES),
      Map.entry("refined", REFINES),
      Map.entry("refinement", REFINES),
      Map.entry("address", ADDRESSES),
      Map.entry("adresses", ADDRESSES),
      Map.entry("addressess", ADDRESSES),
      Map.entry("tag", TAGS),
      Map.entry("state", STATUS),
      Map.entry("lvl", LEVEL));

  /** How a written key relates to the keyword table. */
  enum Match {
    EXACT,
    /** Right keyword, wrong case; the value is still used. */
    MISCASED,
    /** Known mistake or near miss; the value is ignored. */
    MISSPELLED,
    UNKNOWN
  }

  record Resolution(Match match, String keyword) {

    Optional<String> keywordOptional() {
      return Optional.ofNullable(keyword);
    }

    boolean usable() {
      return match == Match.EXACT || match == Match.MISCASED;
    }
  }

  private MetadataKeywords() {
    // Utility
  }

  static Resolution resolve(String written) {
    Objects.requireNonNull(written, "written");
    String key = written.trim();
    for (String keyword : KEYWORDS) {
      if (keyword.equals(key)) {
        return new Resolution(Match.EXACT, keyword);
      }
    }
    for (String keyword : KEYWORDS) {
      if (keyword.equalsIgnoreCase(key)) {
        return new Resolution(Match.MISCASED, keyword);
      }
    }
    Optional<String> known = Suggestions.fromTable(key, KNOWN_MISTAKES);
    if (known.isPresent()) {
      return new Resolution(Match.MISSPELLED, known.get());
    }
    Optional<String> nearest = Suggestions.nearest(key, KEYWORDS);
    return nearest.map(keyword -> new Resolution(Match.MISSPELLED, keyword))
        .orElseGet(() -> new Resolution(Match.UNKNOWN, null));
  }

  static boolean isReferenceKeyword(String keyword) {
    return IMPLEMENTS.equals(keyword) || REFINES.equals(keyword) || ADDRESSES.equals(keyword);
  }
}
