package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.Timers;
import java.util.Objects;

/**
 * Registers the filters shipped with PROXYLOG.
 *
 * @since 0.1.0
 */
public final class BuiltInFilters {

  private BuiltInFilters() {}

  /**
   * Adds every built-in filter to {@code registry}.
   *
   * @param registry registry to populate
   * @return the same registry
   */
  public static FilterRegistry registerAll(FilterRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    return registry
        .register("ip", "client IP equals the given address", IpFilter::new)
        .register("ip_range", "client IP inside the given CIDR block", IpRangeFilter::new)
        .register("path", "request path contains the given text", PathFilter::new)
        .register("ssl", "HTTPS requests only", SslFilter::new)
        .register("slow_requests", "total session time above the given milliseconds",
            arg -> new TimerThresholdFilter("slow_requests", Timers::total, arg))
        .register("wait_on_queues", "queue time above the given milliseconds",
            arg -> new TimerThresholdFilter("wait_on_queues", Timers::queued, arg))
        .register("status_code", "HTTP status equals the given code", StatusCodeFilter::new)
        .register("status_code_family", "HTTP status class (1-5 or 1xx-5xx)",
            StatusCodeFamilyFilter::new)
        .register("http_method", "request method equals the given method", HttpMethodFilter::new)
        .register("frontend", "frontend name equals the given name",
            arg -> new ProxyNameFilter("frontend", LogRecord::frontend, arg))
        .register("backend", "backend name equals the given name",
            arg -> new ProxyNameFilter("backend", LogRecord::backend, arg))
        .register("server", "server name equals the given name",
            arg -> new ProxyNameFilter("server", LogRecord::server, arg))
        .register("response_size", "bytes read compared to +N (above), -N (below) or N (equal)",
            ResponseSizeFilter::new)
        .register("termination_state", "termination code starts with the given letters",
            TerminationStateFilter::new);
  }

  static long parseNonNegativeLong(String name, String argument) {
    if (argument == null || argument.isBlank()) {
      throw new IllegalArgumentException(name + " requires a numeric parameter");
    }
    String trimmed = argument.trim();
    for (int i = 0; i < trimmed.length(); i++) {
      if (!Character.isDigit(trimmed.charAt(i))) {
        throw new IllegalArgumentException(name + " must be a non-negative integer (was '" + argument + "')");
      }
    }
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " is out of range (was '" + argument + "')", ex);
    }
  }
}
