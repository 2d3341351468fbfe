package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.CommandRegistry;
import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.command.builtin.KeyCounter.Order;
import ca.gc.cra.proxylog.domain.log.HttpRequest;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.Timers;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers the report commands shipped with PROXYLOG.
 *
 * @since 0.1.0
 */
public final class BuiltInCommands {
  private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");
  private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:00");

  private BuiltInCommands() {}

  /**
   * Adds every built-in command to {@code registry}.
   *
   * @param registry registry to populate
   * @param settings thresholds and limits used by the parameterized commands
   * @return the same registry
   */
  public static CommandRegistry registerAll(CommandRegistry registry, CommandSettings settings) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(settings, "settings");
    long slowMs = settings.slowRequestThresholdMs();
    int topN = settings.topN();
    return registry
        .register("counter", "number of valid records", RecordCounter::new)
        .register("counter_invalid", "number of lines that could not be parsed", InvalidLineCounter::new)
        .register("http_methods", "requests per HTTP method",
            () -> new KeyCounter(BuiltInCommands::method, Order.BY_COUNT))
        .register("ip_counter", "requests per client IP",
            () -> new KeyCounter(r -> Optional.of(r.clientIp()), Order.BY_COUNT))
        .register("top_ips", "the " + topN + " busiest client IPs",
            () -> new KeyCounter(r -> Optional.of(r.clientIp()), Order.BY_COUNT, topN))
        .register("status_codes_counter", "requests per HTTP status code",
            () -> new KeyCounter(BuiltInCommands::status, Order.BY_COUNT))
        .register("status_code_families", "requests per status class (2xx, 5xx, ...)",
            () -> new KeyCounter(LogRecord::statusClass, Order.BY_KEY))
        .register("request_path_counter", "requests per path",
            () -> new KeyCounter(BuiltInCommands::path, Order.BY_COUNT))
        .register("top_request_paths", "the " + topN + " most requested paths",
            () -> new KeyCounter(BuiltInCommands::path, Order.BY_COUNT, topN))
        .register("slow_requests", "requests slower than " + slowMs + " ms, in file order",
            () -> new SlowRequestCollector(slowMs, true))
        .register("counter_slow_requests", "number of requests slower than " + slowMs + " ms",
            () -> new SlowRequestCollector(slowMs, false))
        .register("average_response_time", "mean server response time (Tr) in ms",
            () -> new TimerAverage(Timers::response))
        .register("average_waiting_time", "mean time spent in queues (Tw) in ms",
            () -> new TimerAverage(Timers::queued))
        .register("server_load", "requests per server",
            () -> new KeyCounter(r -> Optional.of(r.server()), Order.BY_COUNT))
        .register("backend_load", "requests per backend",
            () -> new KeyCounter(r -> Optional.of(r.backend()), Order.BY_COUNT))
        .register("bytes_read_total", "total bytes sent to clients", BytesReadTotal::new)
        .register("connection_type", "SSL versus NON-SSL requests",
            () -> new KeyCounter(BuiltInCommands::connectionType, Order.BY_KEY))
        .register("requests_per_minute", "requests per minute, chronological",
            () -> new KeyCounter(r -> Optional.of(MINUTE.format(r.timestamp())), Order.BY_KEY))
        .register("requests_per_hour", "requests per hour, chronological",
            () -> new KeyCounter(r -> Optional.of(HOUR.format(r.timestamp())), Order.BY_KEY));
  }

  private static Optional<String> method(LogRecord record) {
    return record.httpRequest().map(HttpRequest::method);
  }

  private static Optional<String> path(LogRecord record) {
    return record.httpRequest().map(HttpRequest::path);
  }

  private static Optional<String> status(LogRecord record) {
    return record.statusCode().isPresent()
        ? Optional.of(Integer.toString(record.statusCode().getAsInt()))
        : Optional.empty();
  }

  private static Optional<String> connectionType(LogRecord record) {
    boolean ssl = record.httpRequest().map(HttpRequest::isHttps).orElse(false);
    return Optional.of(ssl ? "SSL" : "NON-SSL");
  }
}
