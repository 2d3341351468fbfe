package ca.gc.cra.proxylog.domain.log;

import java.util.Objects;

/**
 * A line the parser rejected, kept as data so scans can count and sample failures.
 *
 * @param rawLine offending line
 * @param reason classified reason
 * @param detail short human-readable explanation (field name, offending token)
 * @since 0.1.0
 */
public record ParseFailure(String rawLine, ParseFailureReason reason, String detail) {

  public ParseFailure {
    Objects.requireNonNull(rawLine, "rawLine");
    Objects.requireNonNull(reason, "reason");
    detail = detail == null ? "" : detail;
  }

  /**
   * Indicates whether the line's layout (rather than a value) was wrong.
   *
   * @return {@code true} for structural failures
   */
  public boolean structural() {
    return reason.category() == ParseFailureReason.Category.STRUCTURAL;
  }
}
