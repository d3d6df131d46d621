package ca.gc.cra.trace.domain.record;

import java.util.Locale;

/**
 * Outcome of one test execution.
 *
 * @since 0.1.0
 */
public enum TestStatus {
  PASSED,
  FAILED,
  SKIPPED,
  UNKNOWN;

  /**
   * Lenient mapping of result-format spellings ({@code pass}, {@code error}, {@code ignored}, ...).
   *
   * @param raw status text; may be {@code null}
   * @return matching status, {@link #UNKNOWN} when unrecognised
   */
  public static TestStatus parse(String raw) {
    if (raw == null) {
      return UNKNOWN;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "passed", "pass", "success", "ok" -> PASSED;
      case "failed", "fail", "failure", "error", "errored" -> FAILED;
      case "skipped", "skip", "ignored", "disabled", "pending" -> SKIPPED;
      default -> UNKNOWN;
    };
  }
}
