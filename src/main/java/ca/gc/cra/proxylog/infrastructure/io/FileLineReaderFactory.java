package ca.gc.cra.proxylog.infrastructure.io;

import ca.gc.cra.proxylog.application.port.LineReader;
import ca.gc.cra.proxylog.application.port.LineReaderFactory;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens local log files, failing with a precise {@link IOException} subtype before any line is read.
 *
 * @since 0.1.0
 */
public final class FileLineReaderFactory implements LineReaderFactory {
  /** Longest line, in characters, kept in memory. */
  public static final int DEFAULT_MAX_LINE_CHARS = 64 * 1024;

  private final int maxLineChars;

  public FileLineReaderFactory() {
    this(DEFAULT_MAX_LINE_CHARS);
  }

  FileLineReaderFactory(int maxLineChars) {
    this.maxLineChars = maxLineChars;
  }

  @Override
  public LineReader open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    if (!Files.isRegularFile(path)) {
      throw new IOException("not a regular file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new AccessDeniedException(path.toString());
    }
    return new FileLineReader(path, maxLineChars);
  }
}
