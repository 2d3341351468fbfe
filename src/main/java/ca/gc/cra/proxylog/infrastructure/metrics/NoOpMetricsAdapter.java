package ca.gc.cra.proxylog.infrastructure.metrics;

import ca.gc.cra.proxylog.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Selected when {@code metricsExporter=none}; stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void add(String key, long delta) {}

  @Override
  public void observe(String key, long value) {}
}
