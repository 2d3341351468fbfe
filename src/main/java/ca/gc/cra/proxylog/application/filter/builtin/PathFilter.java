package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Strings;

/**
 * Selects HTTP records whose request path contains the argument.
 */
final class PathFilter implements Filter {
  private final String fragment;

  PathFilter(String argument) {
    this.fragment = Strings.requireNonBlank("path", argument);
  }

  @Override
  public String name() {
    return "path";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.httpRequest().map(request -> request.path().contains(fragment)).orElse(false);
  }
}
