package ca.gc.cra.proxylog.application.port;

/**
 * <strong>What:</strong> Port abstracting PROXYLOG metrics emission.
 * <p><strong>Why:</strong> Lets the scan record counters and timings without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code analyze.lines.read}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds {@code delta} to the named counter.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param delta non-negative amount
   */
  void add(String key, long delta);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, line counts, ...)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
