package ca.gc.cra.proxylog.application.port;

import java.io.IOException;

/**
 * Forward-only reader over the raw lines of one log input.
 *
 * <p>One instance is one traversal; a second traversal needs a new reader from
 * {@link LineReaderFactory}.</p>
 *
 * @since 0.1.0
 */
public interface LineReader extends AutoCloseable {
  /**
   * Returns the next line without its terminator.
   *
   * @return next line, or {@code null} at end of input
   * @throws IOException if the underlying input fails
   */
  String nextLine() throws IOException;

  /**
   * Indicates that the line last returned by {@link #nextLine()} was cut at the reader's length cap.
   *
   * @return {@code true} when the returned text is only a prefix of the line
   */
  default boolean lastLineTruncated() {
    return false;
  }

  @Override
  void close() throws IOException;
}
