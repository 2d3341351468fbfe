package ca.gc.cra.proxylog.application.filter;

/**
 * Builds a {@link Filter} from its textual parameter.
 *
 * <p>Factories validate the parameter immediately, so a bad value is reported when the filter is
 * activated and never during the scan.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FilterFactory {
  /**
   * Creates a filter.
   *
   * @param argument parameter text; empty for filters that take none
   * @return validated filter
   * @throws IllegalArgumentException if the argument is missing or malformed
   */
  Filter create(String argument);
}
