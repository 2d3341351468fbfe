package ca.gc.cra.proxylog.application.filter;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of activated filters; a record passes only if every filter matches.
 *
 * <p>An empty chain accepts everything. Evaluation stops at the first rejecting filter.</p>
 *
 * @since 0.1.0
 */
public final class FilterChain {
  private static final FilterChain EMPTY = new FilterChain(List.of());

  private final List<Filter> filters;

  private FilterChain(List<Filter> filters) {
    this.filters = filters;
  }

  public static FilterChain empty() {
    return EMPTY;
  }

  /**
   * Creates a chain over already activated filters.
   *
   * @param filters filters in evaluation order
   * @return chain
   */
  public static FilterChain of(List<Filter> filters) {
    Objects.requireNonNull(filters, "filters");
    return filters.isEmpty() ? EMPTY : new FilterChain(List.copyOf(filters));
  }

  public boolean matches(LogRecord record) {
    for (Filter filter : filters) {
      if (!filter.matches(record)) {
        return false;
      }
    }
    return true;
  }

  public List<Filter> filters() {
    return filters;
  }

  public boolean isEmpty() {
    return filters.isEmpty();
  }

  @Override
  public String toString() {
    return filters.stream().map(Filter::name).toList().toString();
  }
}
