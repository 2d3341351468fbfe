package ca.gc.cra.proxylog.application.pipeline;

import ca.gc.cra.proxylog.application.filter.FilterChain;
import ca.gc.cra.proxylog.application.port.LineParser;
import ca.gc.cra.proxylog.application.port.LineReader;
import ca.gc.cra.proxylog.application.port.LineReaderFactory;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Opens a log file as a lazy stream of valid records.
 * <p><strong>Why:</strong> Keeps line reading, parsing and selection in one forward-only pass so
 * memory stays bounded on files with millions of lines.</p>
 * <p><strong>Ordering:</strong> with {@code assumeOrdered} the stream stops parsing once a record
 * lies past the window's upper bound, unless an out-of-order timestamp was seen earlier; the rest of
 * the file is then only counted. Without it every line is parsed.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each {@link RecordStream} belongs to
 * one thread.</p>
 *
 * @since 0.1.0
 */
public final class LogSource {
  /** Default number of rejected lines kept as samples in the diagnostics. */
  public static final int DEFAULT_MAX_FAILURE_SAMPLES = 10;

  private final LineReaderFactory readers;
  private final LineParser parser;
  private final boolean assumeOrdered;
  private final int maxFailureSamples;

  public LogSource(LineReaderFactory readers, LineParser parser) {
    this(readers, parser, false, DEFAULT_MAX_FAILURE_SAMPLES);
  }

  /**
   * Creates a source.
   *
   * @param readers opens the physical file
   * @param parser turns lines into records
   * @param assumeOrdered whether early exit past the window is allowed
   * @param maxFailureSamples rejected lines to keep as samples; zero disables sampling
   */
  public LogSource(LineReaderFactory readers, LineParser parser, boolean assumeOrdered, int maxFailureSamples) {
    this.readers = Objects.requireNonNull(readers, "readers");
    this.parser = Objects.requireNonNull(parser, "parser");
    if (maxFailureSamples < 0) {
      throw new IllegalArgumentException("maxFailureSamples must be >= 0");
    }
    this.assumeOrdered = assumeOrdered;
    this.maxFailureSamples = maxFailureSamples;
  }

  /**
   * Opens a traversal of {@code path}.
   *
   * @param path log file
   * @param window time window records must fall in
   * @param filters filters records must satisfy
   * @return stream yielding valid records in file order; the caller closes it
   * @throws IOException if the file cannot be opened
   */
  public RecordStream open(Path path, TimeWindow window, FilterChain filters) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(filters, "filters");
    LineReader reader = readers.open(path);
    return new RecordStream(reader, parser, window, filters, assumeOrdered, maxFailureSamples);
  }

  public boolean assumeOrdered() {
    return assumeOrdered;
  }
}
