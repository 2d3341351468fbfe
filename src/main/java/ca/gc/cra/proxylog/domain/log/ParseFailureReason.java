package ca.gc.cra.proxylog.domain.log;

/**
 * Why a raw line could not become a {@link LogRecord}.
 *
 * @since 0.1.0
 */
public enum ParseFailureReason {
  /** The line does not have the shape of an HAProxy log line. */
  GRAMMAR_MISMATCH(Category.STRUCTURAL),
  /** A slash-separated section (timers, connections, queues) has the wrong number of fields. */
  FIELD_COUNT_MISMATCH(Category.STRUCTURAL),
  /** A quoted request is present but is not {@code METHOD path PROTOCOL/ver}. */
  MALFORMED_REQUEST(Category.STRUCTURAL),
  /** The line exceeds the reader's length cap and was truncated before parsing. */
  LINE_TOO_LONG(Category.STRUCTURAL),
  /** A numeric field holds something that is not an integer in range. */
  INVALID_NUMBER(Category.VALUE),
  /** The accept date cannot be parsed. */
  INVALID_TIMESTAMP(Category.VALUE);

  /** Coarse grouping used in malformed-line statistics. */
  public enum Category {
    /** The line's layout is wrong. */
    STRUCTURAL,
    /** The layout is right but a field value is not. */
    VALUE
  }

  private final Category category;

  ParseFailureReason(Category category) {
    this.category = category;
  }

  /**
   * Returns whether this reason is a structural or value mismatch.
   *
   * @return failure category
   */
  public Category category() {
    return category;
  }
}
