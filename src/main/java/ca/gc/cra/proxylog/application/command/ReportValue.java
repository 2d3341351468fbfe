package ca.gc.cra.proxylog.application.command;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Value computed by one report command.
 * <p>Exactly one of three shapes:
 * <ul>
 *   <li>{@link Kind#COUNTS}: ordered category to count mapping;</li>
 *   <li>{@link Kind#SCALAR}: a single number (whole counts as {@code long}, averages as a
 *       {@link BigDecimal} with a fixed scale);</li>
 *   <li>{@link Kind#RECORDS}: flagged records in file order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ReportValue {
  /** Shape of a report value. */
  public enum Kind {
    COUNTS,
    SCALAR,
    RECORDS
  }

  private final Kind kind;
  private final Map<String, Long> counts;
  private final Number scalar;
  private final List<LogRecord> records;

  private ReportValue(Kind kind, Map<String, Long> counts, Number scalar, List<LogRecord> records) {
    this.kind = kind;
    this.counts = counts;
    this.scalar = scalar;
    this.records = records;
  }

  /**
   * Wraps a category mapping; iteration order of {@code counts} is preserved.
   *
   * @param counts category to count mapping
   * @return counts value
   */
  public static ReportValue counts(Map<String, Long> counts) {
    Objects.requireNonNull(counts, "counts");
    return new ReportValue(Kind.COUNTS, Collections.unmodifiableMap(new LinkedHashMap<>(counts)), null, null);
  }

  public static ReportValue scalar(long value) {
    return new ReportValue(Kind.SCALAR, null, value, null);
  }

  public static ReportValue scalar(BigDecimal value) {
    return new ReportValue(Kind.SCALAR, null, Objects.requireNonNull(value, "value"), null);
  }

  public static ReportValue records(List<LogRecord> records) {
    return new ReportValue(Kind.RECORDS, null, null, List.copyOf(Objects.requireNonNull(records, "records")));
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the category mapping.
   *
   * @return unmodifiable ordered map
   * @throws IllegalStateException if this is not a {@link Kind#COUNTS} value
   */
  public Map<String, Long> counts() {
    requireKind(Kind.COUNTS);
    return counts;
  }

  /**
   * Returns the scalar.
   *
   * @return {@link Long} or {@link BigDecimal}
   * @throws IllegalStateException if this is not a {@link Kind#SCALAR} value
   */
  public Number scalar() {
    requireKind(Kind.SCALAR);
    return scalar;
  }

  /**
   * Returns the flagged records.
   *
   * @return unmodifiable list in file order
   * @throws IllegalStateException if this is not a {@link Kind#RECORDS} value
   */
  public List<LogRecord> records() {
    requireKind(Kind.RECORDS);
    return records;
  }

  private void requireKind(Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("report value is " + kind + ", not " + expected);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ReportValue that)) {
      return false;
    }
    // Counts compare entry order too: top-N and chronological reports are ordered.
    return kind == that.kind
        && Objects.equals(counts == null ? null : List.copyOf(counts.entrySet()),
            that.counts == null ? null : List.copyOf(that.counts.entrySet()))
        && Objects.equals(scalar, that.scalar)
        && Objects.equals(records, that.records);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, counts, scalar, records);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case COUNTS -> "ReportValue[counts=" + counts + ']';
      case SCALAR -> "ReportValue[scalar=" + scalar + ']';
      case RECORDS -> "ReportValue[records=" + records.size() + ']';
    };
  }
}
