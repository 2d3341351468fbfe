package ca.gc.cra.proxylog.application.command;

/**
 * Creates a fresh {@link Aggregator} for each invocation of a command.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AggregatorFactory {
  Aggregator create();
}
