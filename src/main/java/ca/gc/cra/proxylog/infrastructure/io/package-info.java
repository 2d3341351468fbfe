/** File-system adapters for the {@code LineReader} port. */
package ca.gc.cra.proxylog.infrastructure.io;
