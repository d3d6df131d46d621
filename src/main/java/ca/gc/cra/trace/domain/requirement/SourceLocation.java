package ca.gc.cra.trace.domain.requirement;

import java.util.Objects;
import java.util.Optional;

/**
 * Position of an element in a source document or external artifact.
 *
 * @param path document or artifact path as supplied by the caller
 * @param line 1-based start line
 * @param endLine 1-based inclusive end line; {@code null} when unknown
 * @since 0.1.0
 */
public record SourceLocation(String path, int line, Integer endLine) {

  public SourceLocation {
    Objects.requireNonNull(path, "path");
    if (line < 0) {
      throw new IllegalArgumentException("line must be >= 0");
    }
  }

  public static SourceLocation of(String path, int line) {
    return new SourceLocation(path, line, null);
  }

  public SourceLocation withEndLine(int end) {
    return new SourceLocation(path, line, end);
  }

  public Optional<Integer> endLineOptional() {
    return Optional.ofNullable(endLine);
  }

  @Override
  public String toString() {
    return path + ":" + line;
  }
}
