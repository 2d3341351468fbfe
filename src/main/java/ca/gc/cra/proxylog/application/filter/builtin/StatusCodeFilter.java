package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Numbers;

/**
 * Selects records with one exact HTTP status ({@code status_code:503}).
 */
final class StatusCodeFilter implements Filter {
  private final int status;

  StatusCodeFilter(String argument) {
    this.status = (int) Numbers.requireRange(
        "status_code", BuiltInFilters.parseNonNegativeLong("status_code", argument), 100, 999);
  }

  @Override
  public String name() {
    return "status_code";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.statusCode().isPresent() && record.statusCode().getAsInt() == status;
  }
}
