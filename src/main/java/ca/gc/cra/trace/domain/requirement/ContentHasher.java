package ca.gc.cra.trace.domain.requirement;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Computes the short content hash written into requirement end markers.
 * <p><strong>Why:</strong> Comparing the stored hash with a recomputed one reveals edits made without regenerating
 * the hash.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize whitespace so reformatting alone does not change the hash.</li>
 *   <li>Digest title, body and labelled assertion lines with SHA-256 and keep a hex prefix.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; a fresh {@link MessageDigest} is used per call.</p>
 *
 * @since 0.1.0
 */
public final class ContentHasher {
  /** Hex characters kept by {@link #ContentHasher()}. */
  public static final int DEFAULT_LENGTH = 8;

  private final int length;

  public ContentHasher() {
    this(DEFAULT_LENGTH);
  }

  public ContentHasher(int length) {
    if (length < 4 || length > 64) {
      throw new IllegalArgumentException("hash length must be between 4 and 64 (was " + length + ")");
    }
    this.length = length;
  }

  public int length() {
    return length;
  }

  /**
   * Hashes requirement content.
   *
   * @param title requirement title
   * @param body normative body text
   * @param assertions assertions in document order
   * @return lower-case hex prefix of {@link #length()} characters
   */
  public String hash(String title, String body, List<Assertion> assertions) {
    Objects.requireNonNull(assertions, "assertions");
    return digest(normalize(title, body, assertions));
  }

  /** Normalized text fed to the digest; exposed for diagnostics and tests. */
  public static String normalize(String title, String body, List<Assertion> assertions) {
    StringBuilder sb = new StringBuilder();
    sb.append(collapse(title == null ? "" : title)).append('\n');
    sb.append(normalizeBody(body == null ? "" : body)).append('\n');
    for (Assertion assertion : assertions) {
      sb.append(assertion.label()).append(". ").append(collapse(assertion.text())).append('\n');
    }
    return sb.toString();
  }

  static String normalizeBody(String body) {
    List<String> lines = new ArrayList<>();
    boolean previousBlank = true;
    for (String raw : body.split("\\R", -1)) {
      String line = raw.stripTrailing();
      boolean blank = line.isEmpty();
      if (blank && previousBlank) {
        continue;
      }
      lines.add(line);
      previousBlank = blank;
    }
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    return String.join("\n", lines);
  }

  private static String collapse(String text) {
    return text.trim().replaceAll("\\s+", " ");
  }

  private String digest(String text) {
    try {
      MessageDigest sha = MessageDigest.getInstance("SHA-256");
      byte[] bytes = sha.digest(text.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(bytes).substring(0, length);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
