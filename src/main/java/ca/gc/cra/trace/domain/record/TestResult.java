package ca.gc.cra.trace.domain.record;

import ca.gc.cra.trace.domain.requirement.SourceLocation;
import java.util.Objects;
import java.util.Optional;

/**
 * One execution outcome of a test, produced by a result-format adapter.
 *
 * @param testKey {@link TestReference#key()} of the executed test
 * @param status execution outcome
 * @param durationMillis wall time; {@code 0} when not reported
 * @param message failure or skip message; {@code null} when none
 * @param location result file position; {@code null} when not reported
 * @since 0.1.0
 */
public record TestResult(
    String testKey, TestStatus status, long durationMillis, String message, SourceLocation location) {

  public TestResult {
    Objects.requireNonNull(testKey, "testKey");
    Objects.requireNonNull(status, "status");
    if (durationMillis < 0) {
      throw new IllegalArgumentException("durationMillis must be >= 0");
    }
  }

  public TestResult(String testKey, TestStatus status) {
    this(testKey, status, 0L, null, null);
  }

  public Optional<String> messageOptional() {
    return Optional.ofNullable(message);
  }

  public Optional<SourceLocation> locationOptional() {
    return Optional.ofNullable(location);
  }
}
