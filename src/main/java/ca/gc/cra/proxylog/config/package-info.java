/**
 * Configuration for PROXYLOG runs and the composition root wiring use cases to adapters.
 * <p><strong>Precedence:</strong> CLI arguments override YAML ({@code config=}), which overrides
 * {@link ca.gc.cra.proxylog.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths and names are checked with {@code ca.gc.cra.proxylog.validation}
 * utilities before use.</p>
 */
package ca.gc.cra.proxylog.config;
