/**
 * Command-line entry points for PROXYLOG.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments and flags, merges configuration, runs
 * the analyze use case and maps failures to {@link ca.gc.cra.proxylog.api.ExitCode}.</p>
 * <p><strong>Concurrency:</strong> Invoked once per process on the main thread.</p>
 */
package ca.gc.cra.proxylog.api;
