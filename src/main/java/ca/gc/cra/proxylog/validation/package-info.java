/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap and
 * filter activation.
 * <p><strong>Pipeline role:</strong> Rejects invalid inputs before any log file is opened.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxylog.validation;
