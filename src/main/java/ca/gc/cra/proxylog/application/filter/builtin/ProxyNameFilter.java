package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Strings;
import java.util.function.Function;

/**
 * Selects records handled by a named frontend, backend or server.
 */
final class ProxyNameFilter implements Filter {
  private final String name;
  private final Function<LogRecord, String> component;
  private final String expected;

  ProxyNameFilter(String name, Function<LogRecord, String> component, String argument) {
    this.name = name;
    this.component = component;
    this.expected = Strings.requireNonBlank(name, argument);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean matches(LogRecord record) {
    return expected.equals(component.apply(record));
  }
}
