package ca.gc.cra.trace.domain.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Correction hints for authoring mistakes in keywords and identifiers.
 * <p><strong>Why:</strong> Diagnostics are only actionable when they name the intended spelling.</p>
 * <p><strong>Role:</strong> Domain support used by the identifier grammar and the document parser.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Look up a fixed table of known mistake to correction mappings.</li>
 *   <li>Fall back to the nearest keyword by Levenshtein distance within a bound.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(n*m) per comparison on short keyword strings.</p>
 *
 * @since 0.1.0
 */
public final class Suggestions {
  /** Default maximum edit distance accepted by {@link #nearest(String, Collection)}. */
  public static final int DEFAULT_MAX_DISTANCE = 2;

  private Suggestions() {
    // Utility
  }

  /**
   * Resolves a correction from a known-mistake table, comparing keys case-insensitively.
   *
   * @param candidate text as written by the author; may be {@code null}
   * @param knownMistakes mistake to correction table with lower-case keys
   * @return correction when the candidate is a known mistake
   */
  public static Optional<String> fromTable(String candidate, Map<String, String> knownMistakes) {
    Objects.requireNonNull(knownMistakes, "knownMistakes");
    if (candidate == null || candidate.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(knownMistakes.get(candidate.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Finds the keyword closest to {@code candidate} within {@link #DEFAULT_MAX_DISTANCE}.
   *
   * @param candidate text as written by the author
   * @param keywords accepted spellings
   * @return closest keyword, or empty when none is close enough or the closest is ambiguous
   */
  public static Optional<String> nearest(String candidate, Collection<String> keywords) {
    return nearest(candidate, keywords, DEFAULT_MAX_DISTANCE);
  }

  /**
   * Finds the keyword closest to {@code candidate}, ignoring case.
   *
   * @param candidate text as written by the author
   * @param keywords accepted spellings
   * @param maxDistance inclusive distance bound
   * @return closest keyword, or empty when none is within {@code maxDistance} or two keywords tie
   */
  public static Optional<String> nearest(String candidate, Collection<String> keywords, int maxDistance) {
    Objects.requireNonNull(keywords, "keywords");
    if (candidate == null || candidate.isBlank()) {
      return Optional.empty();
    }
    String needle = candidate.trim().toLowerCase(Locale.ROOT);
    String best = null;
    int bestDistance = Integer.MAX_VALUE;
    boolean tie = false;
    for (String keyword : keywords) {
      int distance = distance(needle, keyword.toLowerCase(Locale.ROOT));
      if (distance < bestDistance) {
        best = keyword;
        bestDistance = distance;
        tie = false;
      } else if (distance == bestDistance && !keyword.equalsIgnoreCase(best)) {
        tie = true;
      }
    }
    if (best == null || tie || bestDistance > maxDistance) {
      return Optional.empty();
    }
    return Optional.of(best);
  }

  /**
   * Computes the Levenshtein edit distance between two strings.
   *
   * @param a first string; must not be {@code null}
   * @param b second string; must not be {@code null}
   * @return number of single-character insertions, deletions or substitutions
   */
  public static int distance(String a, String b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
