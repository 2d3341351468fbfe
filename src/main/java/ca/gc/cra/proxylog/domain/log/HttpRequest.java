package ca.gc.cra.proxylog.domain.log;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> The request line HAProxy captured for an HTTP-mode session.
 * <p><strong>Role:</strong> Domain value object attached to {@link LogRecord} when present.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param method request method as logged (e.g., {@code GET})
 * @param path request target up to (not including) the first {@code '?'}
 * @param query text after the first {@code '?'}; empty when the target has no query
 * @param protocol protocol token such as {@code HTTP/1.1}
 * @since 0.1.0
 */
public record HttpRequest(String method, String path, Optional<String> query, String protocol) {

  public HttpRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    query = query == null ? Optional.empty() : query;
    Objects.requireNonNull(protocol, "protocol");
  }

  /**
   * Splits a request target into path and query at the first {@code '?'}.
   *
   * @param method request method
   * @param target raw request target
   * @param protocol protocol token
   * @return request with path and query separated
   */
  public static HttpRequest of(String method, String target, String protocol) {
    Objects.requireNonNull(target, "target");
    int idx = target.indexOf('?');
    if (idx < 0) {
      return new HttpRequest(method, target, Optional.empty(), protocol);
    }
    return new HttpRequest(
        method, target.substring(0, idx), Optional.of(target.substring(idx + 1)), protocol);
  }

  /**
   * Indicates whether the request went over TLS, judged from an absolute {@code https://} target or
   * an explicit {@code :443} authority.
   *
   * @return {@code true} for HTTPS requests
   */
  public boolean isHttps() {
    String lower = path.toLowerCase(Locale.ROOT);
    if (lower.startsWith("https://")) {
      return true;
    }
    int schemeEnd = lower.indexOf("://");
    String authority = schemeEnd < 0 ? lower : lower.substring(schemeEnd + 3);
    int slash = authority.indexOf('/');
    if (slash >= 0) {
      authority = authority.substring(0, slash);
    }
    return authority.endsWith(":443");
  }
}
