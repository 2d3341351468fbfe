package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.HttpRequest;
import ca.gc.cra.proxylog.domain.log.LogRecord;

/**
 * Selects HTTPS requests; takes no parameter.
 */
final class SslFilter implements Filter {

  SslFilter(String argument) {
    if (argument != null && !argument.isBlank()) {
      throw new IllegalArgumentException("ssl takes no parameter (was '" + argument + "')");
    }
  }

  @Override
  public String name() {
    return "ssl";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.httpRequest().map(HttpRequest::isHttps).orElse(false);
  }
}
