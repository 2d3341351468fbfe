/**
 * Record filters: the {@link ca.gc.cra.proxylog.application.filter.Filter} abstraction, the
 * name-keyed {@link ca.gc.cra.proxylog.application.filter.FilterRegistry} and the AND-ing
 * {@link ca.gc.cra.proxylog.application.filter.FilterChain}.
 */
package ca.gc.cra.proxylog.application.filter;
