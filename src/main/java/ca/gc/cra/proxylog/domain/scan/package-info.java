/** Per-traversal scan accounting shared by the pipeline and report commands. */
package ca.gc.cra.proxylog.domain.scan;
