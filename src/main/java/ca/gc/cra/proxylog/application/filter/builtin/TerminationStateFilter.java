package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import java.util.regex.Pattern;

/**
 * Selects records whose termination code starts with the argument ({@code termination_state:C}
 * for client aborts, {@code termination_state:sH} for server header timeouts).
 */
final class TerminationStateFilter implements Filter {
  private static final Pattern CODE_PREFIX = Pattern.compile("^[A-Za-z-]{1,4}$");

  private final String prefix;

  TerminationStateFilter(String argument) {
    String value = argument == null ? "" : argument.trim();
    if (!CODE_PREFIX.matcher(value).matches()) {
      throw new IllegalArgumentException(
          "termination_state must be 1-4 letters or '-' (was '" + argument + "')");
    }
    this.prefix = value;
  }

  @Override
  public String name() {
    return "termination_state";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.terminationState().code().startsWith(prefix);
  }
}
