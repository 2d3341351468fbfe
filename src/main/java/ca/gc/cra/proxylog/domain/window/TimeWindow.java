package ca.gc.cra.proxylog.domain.window;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Half-open time range {@code [start, start + duration)} selecting records by
 * accept date.
 * <p><strong>Why:</strong> Operators usually analyze one incident period of a large log; the window
 * is applied next to user filters and also tells the scan when an ordered file has moved past the
 * range.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>No start: every timestamp is inside.</li>
 *   <li>Start only: timestamps {@code >= start} are inside.</li>
 *   <li>Start and duration: {@code start <= timestamp < start + duration}.</li>
 *   <li>Duration without start is rejected; a window needs an anchor.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class TimeWindow {
  private static final TimeWindow UNBOUNDED = new TimeWindow(null, null);

  private final LocalDateTime start;
  private final Duration duration;
  private final LocalDateTime end;

  private TimeWindow(LocalDateTime start, Duration duration) {
    this.start = start;
    this.duration = duration;
    this.end = (start != null && duration != null) ? start.plus(duration) : null;
  }

  /**
   * Returns a window that accepts every timestamp.
   *
   * @return unbounded window
   */
  public static TimeWindow unbounded() {
    return UNBOUNDED;
  }

  /**
   * Builds a window from optional bounds.
   *
   * @param start optional inclusive lower bound
   * @param duration optional span after {@code start}
   * @return window for the supplied bounds
   * @throws IllegalArgumentException if {@code duration} is negative, given without {@code start},
   *     or so large that {@code start + duration} is not a representable date
   */
  public static TimeWindow of(Optional<LocalDateTime> start, Optional<Duration> duration) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(duration, "duration");
    if (duration.isPresent()) {
      if (duration.get().isNegative()) {
        throw new IllegalArgumentException("duration must not be negative (was " + duration.get() + ")");
      }
      if (start.isEmpty()) {
        throw new IllegalArgumentException("duration requires a start timestamp");
      }
    }
    if (start.isEmpty()) {
      return UNBOUNDED;
    }
    try {
      return new TimeWindow(start.get(), duration.orElse(null));
    } catch (DateTimeException | ArithmeticException ex) {
      throw new IllegalArgumentException(
          "window end " + start.get() + " + " + duration.get() + " is out of range", ex);
    }
  }

  /**
   * Convenience for a window with both bounds.
   *
   * @param start inclusive lower bound
   * @param duration span after {@code start}
   * @return bounded window
   */
  public static TimeWindow between(LocalDateTime start, Duration duration) {
    return of(Optional.of(start), Optional.of(duration));
  }

  /**
   * Convenience for a window open on the right.
   *
   * @param start inclusive lower bound
   * @return window with no upper bound
   */
  public static TimeWindow from(LocalDateTime start) {
    return of(Optional.of(start), Optional.empty());
  }

  public boolean contains(LogRecord record) {
    return contains(Objects.requireNonNull(record, "record").timestamp());
  }

  /**
   * Tests a timestamp against the window.
   *
   * @param timestamp candidate timestamp
   * @return {@code true} when inside the half-open range
   */
  public boolean contains(LocalDateTime timestamp) {
    Objects.requireNonNull(timestamp, "timestamp");
    if (start != null && timestamp.isBefore(start)) {
      return false;
    }
    return end == null || timestamp.isBefore(end);
  }

  /**
   * Indicates that {@code timestamp} lies at or beyond the upper bound.
   *
   * @param timestamp candidate timestamp
   * @return {@code false} for windows without an upper bound
   */
  public boolean isPastEnd(LocalDateTime timestamp) {
    return end != null && !timestamp.isBefore(end);
  }

  public boolean isUnbounded() {
    return start == null;
  }

  public Optional<LocalDateTime> start() {
    return Optional.ofNullable(start);
  }

  public Optional<Duration> duration() {
    return Optional.ofNullable(duration);
  }

  public Optional<LocalDateTime> end() {
    return Optional.ofNullable(end);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TimeWindow that)) {
      return false;
    }
    return Objects.equals(start, that.start) && Objects.equals(duration, that.duration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, duration);
  }

  @Override
  public String toString() {
    if (start == null) {
      return "[unbounded]";
    }
    return "[" + start + ", " + (end == null ? "..." : end.toString()) + ")";
  }
}
