package ca.gc.cra.proxylog.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens {@link LineReader}s for a log file.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LineReaderFactory {
  /**
   * Opens a fresh traversal of {@code path}.
   *
   * @param path log file
   * @return reader positioned at the first line
   * @throws IOException if the file is missing or unreadable
   */
  LineReader open(Path path) throws IOException;
}
