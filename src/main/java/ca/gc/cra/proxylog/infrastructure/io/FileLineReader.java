package ca.gc.cra.proxylog.infrastructure.io;

import ca.gc.cra.proxylog.application.port.LineReader;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a text file line by line as UTF-8, replacing malformed byte sequences.
 *
 * <p>Logs written with a single-byte charset therefore never abort a scan; the affected characters
 * come out as U+FFFD.</p>
 *
 * <p>At most {@code maxLineChars} characters of a line are kept. The rest of an over-long line is
 * read and discarded up to its terminator, and {@link #lastLineTruncated()} reports the cut. Line
 * terminators are {@code \n}, {@code \r} and {@code \r\n}.</p>
 *
 * @since 0.1.0
 */
public final class FileLineReader implements LineReader {
  private static final int BUFFER_CHARS = 64 * 1024;

  private final BufferedReader reader;
  private final int maxLineChars;
  private final StringBuilder line = new StringBuilder(256);
  private boolean truncated;

  FileLineReader(Path path, int maxLineChars) throws IOException {
    if (maxLineChars <= 0) {
      throw new IllegalArgumentException("maxLineChars must be positive (was " + maxLineChars + ")");
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    this.reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder), BUFFER_CHARS);
    this.maxLineChars = maxLineChars;
  }

  @Override
  public String nextLine() throws IOException {
    line.setLength(0);
    truncated = false;
    int c = reader.read();
    if (c == -1) {
      return null;
    }
    while (c != -1 && c != '\n') {
      if (c == '\r') {
        reader.mark(1);
        if (reader.read() != '\n') {
          reader.reset();
        }
        break;
      }
      if (line.length() < maxLineChars) {
        line.append((char) c);
      } else {
        truncated = true;
      }
      c = reader.read();
    }
    return line.toString();
  }

  @Override
  public boolean lastLineTruncated() {
    return truncated;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
