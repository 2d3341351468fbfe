/**
 * <strong>Purpose:</strong> Report commands: the {@link ca.gc.cra.proxylog.application.command.Aggregator}
 * contract, the registry that names them, and the values they produce.
 * <p><strong>Pipeline role:</strong> Consumes valid records only; never sees raw lines or files.
 * <p><strong>Concurrency:</strong> One aggregator instance per invocation, driven by one thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxylog.application.command;
