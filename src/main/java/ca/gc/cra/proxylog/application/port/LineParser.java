package ca.gc.cra.proxylog.application.port;

import ca.gc.cra.proxylog.domain.log.ParseResult;

/**
 * <strong>What:</strong> Port turning one raw log line into a record or a classified failure.
 * <p><strong>Role:</strong> Implemented by {@code HaproxyLineParser}; consumed by
 * {@link ca.gc.cra.proxylog.application.pipeline.LogSource}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless and safe for concurrent
 * calls.</p>
 *
 * @since 0.1.0
 */
public interface LineParser {
  /**
   * Parses one line.
   *
   * @param rawLine line without its terminator; must not be {@code null}
   * @return success or failure; never {@code null}, never throws for bad input
   */
  ParseResult parse(String rawLine);
}
