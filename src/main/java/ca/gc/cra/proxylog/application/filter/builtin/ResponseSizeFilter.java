package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.validation.Strings;

/**
 * Compares bytes read against a size: {@code +N} greater than, {@code -N} less than, {@code N}
 * equal.
 */
final class ResponseSizeFilter implements Filter {
  private final char operator;
  private final long size;

  ResponseSizeFilter(String argument) {
    String value = Strings.requireNonBlank("response_size", argument);
    char first = value.charAt(0);
    if (first == '+' || first == '-') {
      this.operator = first;
      value = value.substring(1);
    } else {
      this.operator = '=';
    }
    this.size = BuiltInFilters.parseNonNegativeLong("response_size", value);
  }

  @Override
  public String name() {
    return "response_size";
  }

  @Override
  public boolean matches(LogRecord record) {
    long bytes = record.bytesRead();
    return switch (operator) {
      case '+' -> bytes > size;
      case '-' -> bytes < size;
      default -> bytes == size;
    };
  }
}
