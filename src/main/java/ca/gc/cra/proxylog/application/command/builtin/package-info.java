/**
 * Report commands shipped with PROXYLOG, registered through
 * {@link ca.gc.cra.proxylog.application.command.builtin.BuiltInCommands#registerAll}.
 */
package ca.gc.cra.proxylog.application.command.builtin;
