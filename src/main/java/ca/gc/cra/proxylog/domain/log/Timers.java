package ca.gc.cra.proxylog.domain.log;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> The five HAProxy session timers of one log line, in milliseconds.
 * <p><strong>Why:</strong> HAProxy writes {@code -1} when a phase never happened (for example the
 * request was aborted before reaching a server). Holding each timer as an {@link OptionalLong} keeps
 * those values out of sums and averages.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param requestWait time spent waiting for the full client request ({@code Tq})
 * @param queued time spent in the backend or server queues ({@code Tw})
 * @param connect time spent establishing the server connection ({@code Tc})
 * @param response time the server took to send response headers ({@code Tr})
 * @param total total session time from accept to close ({@code Tt})
 * @since 0.1.0
 */
public record Timers(
    OptionalLong requestWait,
    OptionalLong queued,
    OptionalLong connect,
    OptionalLong response,
    OptionalLong total) {

  /** Textual value HAProxy logs for a phase that did not apply. */
  public static final long NOT_APPLICABLE = -1L;

  public Timers {
    Objects.requireNonNull(requestWait, "requestWait");
    Objects.requireNonNull(queued, "queued");
    Objects.requireNonNull(connect, "connect");
    Objects.requireNonNull(response, "response");
    Objects.requireNonNull(total, "total");
  }

  /**
   * Builds timers from the raw logged values, mapping {@link #NOT_APPLICABLE} to empty.
   *
   * @param tq request wait
   * @param tw queue time
   * @param tc connect time
   * @param tr response time
   * @param tt total session time
   * @return timers with sentinels mapped to {@link OptionalLong#empty()}
   * @throws IllegalArgumentException if a value is negative other than the sentinel
   */
  public static Timers fromLogged(long tq, long tw, long tc, long tr, long tt) {
    return new Timers(
        logged("Tq", tq), logged("Tw", tw), logged("Tc", tc), logged("Tr", tr), logged("Tt", tt));
  }

  private static OptionalLong logged(String name, long value) {
    if (value == NOT_APPLICABLE) {
      return OptionalLong.empty();
    }
    if (value < 0) {
      throw new IllegalArgumentException(name + " must be -1 or non-negative (was " + value + ")");
    }
    return OptionalLong.of(value);
  }
}
