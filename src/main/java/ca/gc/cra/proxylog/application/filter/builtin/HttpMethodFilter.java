package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Strings;
import java.util.Locale;

/**
 * Selects HTTP records with one request method, compared case-insensitively.
 */
final class HttpMethodFilter implements Filter {
  private final String method;

  HttpMethodFilter(String argument) {
    this.method = Strings.requireIdentifier("http_method", argument).toUpperCase(Locale.ROOT);
  }

  @Override
  public String name() {
    return "http_method";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.httpRequest()
        .map(request -> request.method().toUpperCase(Locale.ROOT).equals(method))
        .orElse(false);
  }
}
