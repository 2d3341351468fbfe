package ca.gc.cra.proxylog.application.pipeline;

import ca.gc.cra.proxylog.application.filter.FilterChain;
import ca.gc.cra.proxylog.application.port.LineParser;
import ca.gc.cra.proxylog.application.port.LineReader;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.ParseFailure;
import ca.gc.cra.proxylog.domain.log.ParseFailureReason;
import ca.gc.cra.proxylog.domain.log.ParseResult;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import ca.gc.cra.proxylog.logging.Logs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-pass iterator over the valid records of one log file.
 *
 * <p>Every line is read once and parsed at most once. Read failures surface as
 * {@link UncheckedIOException} from {@link #hasNext()}; {@link #diagnostics()} may be called at any
 * time and reflects the lines consumed so far.</p>
 *
 * @since 0.1.0
 */
public final class RecordStream implements Iterator<LogRecord>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordStream.class);

  private final LineReader reader;
  private final LineParser parser;
  private final TimeWindow window;
  private final FilterChain filters;
  private final boolean assumeOrdered;
  private final int maxFailureSamples;
  private final List<ParseFailure> samples = new ArrayList<>();

  private long linesRead;
  private long malformedStructural;
  private long malformedValue;
  private long filteredOut;
  private long valid;
  private long unscanned;
  private LocalDateTime latest;
  private boolean outOfOrder;
  private boolean exhausted;
  private LogRecord next;

  RecordStream(
      LineReader reader,
      LineParser parser,
      TimeWindow window,
      FilterChain filters,
      boolean assumeOrdered,
      int maxFailureSamples) {
    this.reader = reader;
    this.parser = parser;
    this.window = window;
    this.filters = filters;
    this.assumeOrdered = assumeOrdered;
    this.maxFailureSamples = maxFailureSamples;
  }

  @Override
  public boolean hasNext() {
    if (next == null && !exhausted) {
      try {
        advance();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }
    return next != null;
  }

  @Override
  public LogRecord next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    LogRecord record = next;
    next = null;
    return record;
  }

  /**
   * Snapshot of the counters for the lines consumed so far.
   *
   * @return diagnostics; final once {@link #hasNext()} returned {@code false}
   */
  public ScanDiagnostics diagnostics() {
    return new ScanDiagnostics(
        linesRead, malformedStructural, malformedValue, filteredOut, valid, unscanned, samples);
  }

  @Override
  public void close() throws IOException {
    exhausted = true;
    next = null;
    reader.close();
  }

  private void advance() throws IOException {
    while (next == null && !exhausted) {
      String line = reader.nextLine();
      if (line == null) {
        exhausted = true;
        return;
      }
      if (line.isBlank()) {
        continue;
      }
      linesRead++;
      if (reader.lastLineTruncated()) {
        reject(new ParseFailure(line, ParseFailureReason.LINE_TOO_LONG,
            "line truncated after " + line.length() + " characters"));
        continue;
      }
      ParseResult result = parser.parse(line);
      if (!result.isSuccess()) {
        reject(result.failure());
        continue;
      }
      LogRecord record = result.record();
      trackOrder(record.timestamp());
      if (!window.contains(record)) {
        filteredOut++;
        if (assumeOrdered && !outOfOrder && window.isPastEnd(record.timestamp())) {
          skipRemainder(record.timestamp());
        }
        continue;
      }
      if (!filters.matches(record)) {
        filteredOut++;
        continue;
      }
      valid++;
      next = record;
    }
  }

  private void reject(ParseFailure failure) {
    if (failure.structural()) {
      malformedStructural++;
    } else {
      malformedValue++;
    }
    if (samples.size() < maxFailureSamples) {
      samples.add(failure);
    }
    if (log.isDebugEnabled()) {
      log.debug("Skipping line {} ({}: {}): {}", linesRead, failure.reason(), failure.detail(),
          Logs.rawLine(failure.rawLine()));
    }
  }

  private void trackOrder(LocalDateTime timestamp) {
    if (latest != null && timestamp.isBefore(latest)) {
      if (!outOfOrder) {
        log.debug("Out-of-order timestamp {} after {} at line {}; early exit disabled", timestamp, latest, linesRead);
      }
      outOfOrder = true;
      return;
    }
    latest = timestamp;
  }

  private void skipRemainder(LocalDateTime trigger) throws IOException {
    String line;
    while ((line = reader.nextLine()) != null) {
      if (!line.isBlank()) {
        unscanned++;
      }
    }
    exhausted = true;
    log.debug("Timestamp {} is past window end {}; skipped {} remaining lines without parsing",
        trigger, window.end().orElse(null), unscanned);
  }
}
