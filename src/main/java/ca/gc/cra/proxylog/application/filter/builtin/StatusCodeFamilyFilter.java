package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Selects records in one status class; accepts {@code 5} or {@code 5xx}.
 */
final class StatusCodeFamilyFilter implements Filter {
  private static final Pattern FAMILY = Pattern.compile("^[1-5](?:xx)?$");

  private final String family;

  StatusCodeFamilyFilter(String argument) {
    String normalized = argument == null ? "" : argument.trim().toLowerCase(Locale.ROOT);
    if (!FAMILY.matcher(normalized).matches()) {
      throw new IllegalArgumentException(
          "status_code_family must be a digit 1-5, optionally followed by 'xx' (was '" + argument + "')");
    }
    this.family = normalized.charAt(0) + "xx";
  }

  @Override
  public String name() {
    return "status_code_family";
  }

  @Override
  public boolean matches(LogRecord record) {
    return record.statusClass().map(family::equals).orElse(false);
  }
}
