package ca.gc.cra.proxylog.domain.log;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of parsing one line: exactly one of a {@link LogRecord} or a {@link ParseFailure}.
 *
 * @since 0.1.0
 */
public final class ParseResult {
  private final LogRecord record;
  private final ParseFailure failure;

  private ParseResult(LogRecord record, ParseFailure failure) {
    this.record = record;
    this.failure = failure;
  }

  /**
   * Wraps a parsed record.
   *
   * @param record parsed record; must not be {@code null}
   * @return successful result
   */
  public static ParseResult success(LogRecord record) {
    return new ParseResult(Objects.requireNonNull(record, "record"), null);
  }

  /**
   * Wraps a rejected line.
   *
   * @param failure failure description; must not be {@code null}
   * @return failed result
   */
  public static ParseResult failure(ParseFailure failure) {
    return new ParseResult(null, Objects.requireNonNull(failure, "failure"));
  }

  /**
   * Shorthand for {@code failure(new ParseFailure(rawLine, reason, detail))}.
   *
   * @param rawLine offending line
   * @param reason classified reason
   * @param detail explanation
   * @return failed result
   */
  public static ParseResult failure(String rawLine, ParseFailureReason reason, String detail) {
    return failure(new ParseFailure(rawLine, reason, detail));
  }

  public boolean isSuccess() {
    return record != null;
  }

  /**
   * Returns the parsed record.
   *
   * @return record
   * @throws NoSuchElementException when the line failed to parse
   */
  public LogRecord record() {
    if (record == null) {
      throw new NoSuchElementException("line did not parse: " + failure.reason());
    }
    return record;
  }

  /**
   * Returns the failure.
   *
   * @return failure
   * @throws NoSuchElementException when the line parsed successfully
   */
  public ParseFailure failure() {
    if (failure == null) {
      throw new NoSuchElementException("line parsed successfully");
    }
    return failure;
  }

  @Override
  public String toString() {
    return isSuccess() ? "ParseResult[success]" : "ParseResult[failure=" + failure.reason() + ']';
  }
}
