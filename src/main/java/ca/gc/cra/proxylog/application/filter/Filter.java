package ca.gc.cra.proxylog.application.filter;

import ca.gc.cra.proxylog.domain.log.LogRecord;

/**
 * <strong>What:</strong> Named predicate selecting the records that take part in an analysis.
 * <p><strong>Role:</strong> Created by a {@link FilterFactory} with its parameter already validated,
 * then combined with other filters in a {@link FilterChain}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable once created.</p>
 *
 * @since 0.1.0
 */
public interface Filter {
  /**
   * Returns the registered name this filter was activated under.
   *
   * @return filter name, e.g. {@code status_code}
   */
  String name();

  /**
   * Tests one record.
   *
   * @param record parsed record; never {@code null}
   * @return {@code true} when the record is selected
   */
  boolean matches(LogRecord record);

  /**
   * Returns a filter selecting exactly the records this one rejects.
   *
   * @return negated filter named {@code "!" + name()}
   */
  default Filter negate() {
    Filter self = this;
    return new Filter() {
      @Override
      public String name() {
        return FilterActivation.NEGATION_PREFIX + self.name();
      }

      @Override
      public boolean matches(LogRecord record) {
        return !self.matches(record);
      }

      @Override
      public Filter negate() {
        return self;
      }
    };
  }
}
