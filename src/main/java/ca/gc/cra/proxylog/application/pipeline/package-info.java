/**
 * <strong>Purpose:</strong> The analysis pipeline: opening a log as a stream of valid records and
 * driving report commands over it.
 * <p><strong>Concurrency:</strong> Single-threaded per invocation; each scan owns its reader.
 * <p><strong>Observability:</strong> SLF4J logging with the scanned file in MDC and {@code analyze.*}
 * metrics through {@link ca.gc.cra.proxylog.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxylog.application.pipeline;
