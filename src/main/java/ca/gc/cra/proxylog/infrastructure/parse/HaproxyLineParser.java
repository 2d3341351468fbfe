package ca.gc.cra.proxylog.infrastructure.parse;

import ca.gc.cra.proxylog.application.port.LineParser;
import ca.gc.cra.proxylog.domain.log.ConnectionCounts;
import ca.gc.cra.proxylog.domain.log.HttpRequest;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.ParseFailureReason;
import ca.gc.cra.proxylog.domain.log.ParseResult;
import ca.gc.cra.proxylog.domain.log.QueueLengths;
import ca.gc.cra.proxylog.domain.log.TerminationState;
import ca.gc.cra.proxylog.domain.log.Timers;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parses HAProxy HTTP and TCP log lines as written through syslog.
 * <p><strong>Grammar:</strong></p>
 * <pre>
 * SYSLOG_DATE [host] process[pid]: ip:port [accept_date] frontend backend/server
 *     Tq/Tw/Tc/Tr/Tt status bytes req_cookie res_cookie term_state
 *     act/fe/be/srv/retries srv_queue/backend_queue [{req_headers}] [{res_headers}] ["request"]
 * </pre>
 * <p>{@code SYSLOG_DATE} may be the classic {@code Mmm dd HH:mm:ss}, an ISO-8601 timestamp or a
 * bracketed timestamp.</p>
 * <p><strong>Approach:</strong> one anchored pattern locates the whitespace-separated sections;
 * each section is then checked on its own so a failure can be classified as a layout problem
 * ({@link ParseFailureReason.Category#STRUCTURAL}) or a bad value
 * ({@link ParseFailureReason.Category#VALUE}).</p>
 * <p><strong>Thread-safety:</strong> Stateless; compiled patterns and formatters are immutable.</p>
 *
 * @since 0.1.0
 */
public final class HaproxyLineParser implements LineParser {
  private static final Pattern LINE = Pattern.compile(
      "^(?:\\[[^\\]]*\\]|[A-Z][a-z]{2}\\s+\\d{1,2}\\s+\\d{2}:\\d{2}:\\d{2}|\\d{4}-\\d{2}-\\d{2}T\\S+)\\s+"
          + "(?:\\S+\\s+)?"
          + "[\\w.-]+(?:\\[\\d+\\])?:\\s+"
          + "(?<client>\\S+):(?<port>[^\\s:]+)\\s+"
          + "\\[(?<acceptDate>[^\\]]*)\\]\\s+"
          + "(?<frontend>\\S+)\\s+"
          + "(?<backend>[^\\s/]+)/(?<server>\\S+)\\s+"
          + "(?<timers>\\S+)\\s+"
          + "(?<status>\\S+)\\s+"
          + "(?<bytes>\\S+)\\s+"
          + "(?<reqCookie>\\S+)\\s+"
          + "(?<resCookie>\\S+)\\s+"
          + "(?<term>\\S+)\\s+"
          + "(?<conns>\\S+)\\s+"
          + "(?<queues>\\S+)"
          + "(?:\\s+\\{(?<reqHeaders>[^}]*)\\})?"
          + "(?:\\s+\\{(?<resHeaders>[^}]*)\\})?"
          + "(?:\\s+\"(?<request>.*)\")?"
          + "\\s*$");

  private static final Pattern REQUEST = Pattern.compile(
      "^(?<method>[A-Za-z][A-Za-z-]*)\\s+(?<target>\\S+)\\s+(?<protocol>[A-Za-z]+/\\d+(?:\\.\\d+)?)$");

  private static final Pattern TERMINATION = Pattern.compile("^[A-Za-z-]{2,4}$");

  private static final DateTimeFormatter ACCEPT_DATE = new DateTimeFormatterBuilder()
      .appendPattern("dd/MMM/yyyy:HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .toFormatter(Locale.ENGLISH);

  @Override
  public ParseResult parse(String rawLine) {
    Objects.requireNonNull(rawLine, "rawLine");
    Matcher m = LINE.matcher(rawLine);
    if (!m.matches()) {
      return ParseResult.failure(rawLine, ParseFailureReason.GRAMMAR_MISMATCH,
          "line does not follow the HAProxy log layout");
    }
    try {
      return ParseResult.success(toRecord(rawLine, m));
    } catch (LineRejected rejected) {
      return ParseResult.failure(rawLine, rejected.reason, rejected.getMessage());
    }
  }

  private LogRecord toRecord(String rawLine, Matcher m) {
    String[] timerFields = split(m.group("timers"), 5, "timers");
    String[] connectionFields = split(m.group("conns"), 5, "connection counts");
    String[] queueFields = split(m.group("queues"), 2, "queue lengths");

    String term = m.group("term");
    if (!TERMINATION.matcher(term).matches()) {
      throw new LineRejected(ParseFailureReason.GRAMMAR_MISMATCH, "termination state: " + term);
    }

    Optional<HttpRequest> request = Optional.empty();
    String requestText = m.group("request");
    if (requestText != null) {
      request = Optional.of(parseRequest(requestText));
    }

    LocalDateTime timestamp = parseAcceptDate(m.group("acceptDate"));
    int port = (int) number("client port", m.group("port"), 0, 65_535);

    Timers timers = Timers.fromLogged(
        timer("Tq", timerFields[0]),
        timer("Tw", timerFields[1]),
        timer("Tc", timerFields[2]),
        timer("Tr", timerFields[3]),
        timer("Tt", timerFields[4]));

    long status = number("status code", m.group("status"), -1, 999);
    OptionalInt statusCode = status == -1 ? OptionalInt.empty() : OptionalInt.of((int) status);
    long bytes = number("bytes read", m.group("bytes"), 0, Long.MAX_VALUE);

    String retriesField = connectionFields[4];
    boolean redispatched = retriesField.startsWith("+");
    ConnectionCounts connections = new ConnectionCounts(
        count("active connections", connectionFields[0]),
        count("frontend connections", connectionFields[1]),
        count("backend connections", connectionFields[2]),
        count("server connections", connectionFields[3]),
        count("retries", redispatched ? retriesField.substring(1) : retriesField),
        redispatched);
    QueueLengths queues = new QueueLengths(
        count("server queue", queueFields[0]),
        count("backend queue", queueFields[1]));

    return new LogRecord(
        timestamp,
        m.group("client"),
        port,
        m.group("frontend"),
        m.group("backend"),
        m.group("server"),
        timers,
        statusCode,
        bytes,
        m.group("reqCookie"),
        m.group("resCookie"),
        new TerminationState(term),
        connections,
        queues,
        Optional.ofNullable(m.group("reqHeaders")),
        Optional.ofNullable(m.group("resHeaders")),
        request,
        rawLine);
  }

  private static HttpRequest parseRequest(String text) {
    Matcher rm = REQUEST.matcher(text.trim());
    if (!rm.matches()) {
      throw new LineRejected(ParseFailureReason.MALFORMED_REQUEST,
          "request is not 'METHOD path PROTOCOL/ver': " + text);
    }
    return HttpRequest.of(rm.group("method"), rm.group("target"), rm.group("protocol"));
  }

  private static LocalDateTime parseAcceptDate(String text) {
    try {
      return LocalDateTime.parse(text, ACCEPT_DATE).truncatedTo(ChronoUnit.SECONDS);
    } catch (DateTimeParseException ex) {
      throw new LineRejected(ParseFailureReason.INVALID_TIMESTAMP, "accept date: " + text);
    }
  }

  private static String[] split(String section, int expected, String name) {
    String[] parts = section.split("/", -1);
    if (parts.length != expected) {
      throw new LineRejected(ParseFailureReason.FIELD_COUNT_MISMATCH,
          name + " expects " + expected + " fields (was " + parts.length + "): " + section);
    }
    return parts;
  }

  private static long timer(String name, String text) {
    return number(name, text, Timers.NOT_APPLICABLE, Long.MAX_VALUE);
  }

  private static int count(String name, String text) {
    return (int) number(name, text, 0, Integer.MAX_VALUE);
  }

  private static long number(String name, String text, long min, long max) {
    long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new LineRejected(ParseFailureReason.INVALID_NUMBER, name + " is not an integer: " + text);
    }
    if (value < min || value > max) {
      throw new LineRejected(ParseFailureReason.INVALID_NUMBER,
          name + " out of range [" + min + ", " + max + "]: " + text);
    }
    return value;
  }

  /** Internal control flow for the first rejected section; never escapes {@link #parse}. */
  private static final class LineRejected extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ParseFailureReason reason;

    LineRejected(ParseFailureReason reason, String message) {
      super(message, null, false, false);
      this.reason = reason;
    }
  }
}
