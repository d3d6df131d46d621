package ca.gc.cra.trace.domain.requirement;

/**
 * Relationship keywords a requirement can declare in its metadata.
 *
 * @since 0.1.0
 */
public enum ReferenceKind {
  IMPLEMENTS("Implements"),
  REFINES("Refines"),
  /** Targets are journey identifiers rather than requirement identifiers. */
  ADDRESSES("Addresses");

  private final String keyword;

  ReferenceKind(String keyword) {
    this.keyword = keyword;
  }

  /** Keyword as written in documents, e.g. {@code Implements}. */
  public String keyword() {
    return keyword;
  }
}
