/**
 * Metrics adapters that bridge the PROXYLOG {@code MetricsPort} to OpenTelemetry or a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code analyze.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported, never log contents.</p>
 */
package ca.gc.cra.proxylog.infrastructure.metrics;
