package ca.gc.cra.trace.domain.requirement;

import java.util.Objects;

/**
 * Already-read document handed to the parser.
 *
 * @param path document path used for source locations and subdirectory classification
 * @param text full document text
 * @since 0.1.0
 */
public record SourceDocument(String path, String text) {

  public SourceDocument {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(text, "text");
  }
}
