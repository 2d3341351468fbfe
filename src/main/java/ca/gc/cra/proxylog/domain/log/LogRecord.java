package ca.gc.cra.proxylog.domain.log;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Structured form of one successfully parsed HAProxy log line.
 * <p><strong>Why:</strong> Filters and report commands work on typed fields instead of re-scanning
 * text, and "not applicable" values are explicit {@code Optional*} instead of {@code -1}.</p>
 * <p><strong>Role:</strong> Domain value flowing from the parser through the filter chain to the
 * aggregators.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Invariant:</strong> Only the parser creates records, and only for lines that matched
 * the whole grammar; there is no partially filled record.</p>
 *
 * @param timestamp accept date with second precision
 * @param clientIp client address as logged
 * @param clientPort client TCP port
 * @param frontend frontend name
 * @param backend backend name ({@code <NOSRV>} style sentinels kept verbatim)
 * @param server server name ({@code <NOSRV>} when no server was selected)
 * @param timers session timers
 * @param statusCode HTTP status; empty when the connection closed before a response ({@code -1})
 * @param bytesRead bytes sent to the client
 * @param capturedRequestCookie captured request cookie token ({@code -} when none)
 * @param capturedResponseCookie captured response cookie token ({@code -} when none)
 * @param terminationState session termination code
 * @param connectionCounts connection counters at logging time
 * @param queueLengths queue depths at logging time
 * @param capturedRequestHeaders captured request headers without braces, when logged
 * @param capturedResponseHeaders captured response headers without braces, when logged
 * @param httpRequest request line; empty for TCP-mode sessions
 * @param rawLine original text of the line
 * @since 0.1.0
 */
public record LogRecord(
    LocalDateTime timestamp,
    String clientIp,
    int clientPort,
    String frontend,
    String backend,
    String server,
    Timers timers,
    OptionalInt statusCode,
    long bytesRead,
    String capturedRequestCookie,
    String capturedResponseCookie,
    TerminationState terminationState,
    ConnectionCounts connectionCounts,
    QueueLengths queueLengths,
    Optional<String> capturedRequestHeaders,
    Optional<String> capturedResponseHeaders,
    Optional<HttpRequest> httpRequest,
    String rawLine) {

  /** Server or backend name HAProxy logs when no server could be selected. */
  public static final String NO_SERVER = "<NOSRV>";

  private static final int MIN_CLASSIFIED_STATUS = 100;
  private static final int MAX_CLASSIFIED_STATUS = 599;

  public LogRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(clientIp, "clientIp");
    Objects.requireNonNull(frontend, "frontend");
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(timers, "timers");
    Objects.requireNonNull(statusCode, "statusCode");
    Objects.requireNonNull(capturedRequestCookie, "capturedRequestCookie");
    Objects.requireNonNull(capturedResponseCookie, "capturedResponseCookie");
    Objects.requireNonNull(terminationState, "terminationState");
    Objects.requireNonNull(connectionCounts, "connectionCounts");
    Objects.requireNonNull(queueLengths, "queueLengths");
    Objects.requireNonNull(capturedRequestHeaders, "capturedRequestHeaders");
    Objects.requireNonNull(capturedResponseHeaders, "capturedResponseHeaders");
    Objects.requireNonNull(httpRequest, "httpRequest");
    Objects.requireNonNull(rawLine, "rawLine");
    if (clientPort < 0 || clientPort > 65535) {
      throw new IllegalArgumentException("clientPort out of range: " + clientPort);
    }
    if (bytesRead < 0) {
      throw new IllegalArgumentException("bytesRead must be non-negative");
    }
  }

  /**
   * Indicates whether HAProxy selected a server for this session.
   *
   * @return {@code false} when the server field holds {@link #NO_SERVER}
   */
  public boolean serverSelected() {
    return !NO_SERVER.equals(server);
  }

  /**
   * Returns the status class label ({@code "2xx"}, {@code "5xx"}, ...).
   *
   * @return label derived from the first digit; empty when no status was logged or the code lies
   *     outside {@code 100..599}
   */
  public Optional<String> statusClass() {
    if (statusCode.isEmpty()) {
      return Optional.empty();
    }
    int code = statusCode.getAsInt();
    if (code < MIN_CLASSIFIED_STATUS || code > MAX_CLASSIFIED_STATUS) {
      return Optional.empty();
    }
    return Optional.of((code / 100) + "xx");
  }

  /**
   * Indicates whether the session was logged in HTTP mode.
   *
   * @return {@code true} when a request line was captured
   */
  public boolean isHttp() {
    return httpRequest.isPresent();
  }
}
