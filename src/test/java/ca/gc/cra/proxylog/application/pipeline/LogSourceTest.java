package ca.gc.cra.proxylog.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxylog.application.filter.FilterActivation;
import ca.gc.cra.proxylog.application.filter.FilterChain;
import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.application.filter.builtin.BuiltInFilters;
import ca.gc.cra.proxylog.application.port.LineReader;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.ParseFailureReason;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import ca.gc.cra.proxylog.infrastructure.io.FileLineReaderFactory;
import ca.gc.cra.proxylog.infrastructure.parse.HaproxyLineParser;
import ca.gc.cra.proxylog.testing.InMemoryLineReaderFactory;
import ca.gc.cra.proxylog.testing.LogLines;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogSourceTest {
  private static final Path LOG = Path.of("access.log");
  private static final LocalDateTime START = LocalDateTime.of(2013, 12, 11, 1, 0, 0);

  private static String at(String time) {
    return LogLines.line().at("11/Dec/2013:" + time).build();
  }

  private static List<LogRecord> drain(RecordStream stream) {
    List<LogRecord> records = new ArrayList<>();
    while (stream.hasNext()) {
      records.add(stream.next());
    }
    return records;
  }

  @Test
  void countsEveryLineCategory() throws IOException {
    List<String> lines = List.of(
        LogLines.line().ip("10.0.0.5").build(),
        "",
        "garbage",
        LogLines.line().status("x").build(),
        LogLines.line().ip("10.0.0.9").build(),
        "   ");
    FilterChain chain = BuiltInFilters.registerAll(new FilterRegistry())
        .chain(List.of(FilterActivation.of("ip", "10.0.0.5")));
    LogSource source = new LogSource(new InMemoryLineReaderFactory(lines), new HaproxyLineParser());

    ScanDiagnostics diagnostics;
    List<LogRecord> records;
    try (RecordStream stream = source.open(LOG, TimeWindow.unbounded(), chain)) {
      records = drain(stream);
      diagnostics = stream.diagnostics();
    }

    assertEquals(1, records.size());
    assertEquals(4, diagnostics.linesRead());
    assertEquals(1, diagnostics.malformedStructural());
    assertEquals(1, diagnostics.malformedValue());
    assertEquals(1, diagnostics.filteredOut());
    assertEquals(1, diagnostics.valid());
    assertEquals(0, diagnostics.unscannedLines());
    assertEquals(List.of(ParseFailureReason.GRAMMAR_MISMATCH, ParseFailureReason.INVALID_NUMBER),
        diagnostics.failureSamples().stream().map(f -> f.reason()).toList());
  }

  @Test
  void overLongLineIsStructuralFailureAndScanContinues(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("access.log");
    String huge = LogLines.line().request("GET", "/" + "a".repeat(FileLineReaderFactory.DEFAULT_MAX_LINE_CHARS)).build();
    Files.writeString(file, huge + "\n" + LogLines.line().build() + "\n", StandardCharsets.UTF_8);
    LogSource source = new LogSource(new FileLineReaderFactory(), new HaproxyLineParser());

    try (RecordStream stream = source.open(file, TimeWindow.unbounded(), FilterChain.empty())) {
      assertEquals(1, drain(stream).size());
      ScanDiagnostics diagnostics = stream.diagnostics();
      assertEquals(2, diagnostics.linesRead());
      assertEquals(1, diagnostics.malformedStructural());
      assertEquals(ParseFailureReason.LINE_TOO_LONG, diagnostics.failureSamples().get(0).reason());
      assertEquals(FileLineReaderFactory.DEFAULT_MAX_LINE_CHARS,
          diagnostics.failureSamples().get(0).rawLine().length());
    }
  }

  @Test
  void failureSamplesAreBounded() throws IOException {
    List<String> lines = List.of("bad 1", "bad 2", "bad 3", "bad 4");
    LogSource source = new LogSource(new InMemoryLineReaderFactory(lines), new HaproxyLineParser(), false, 2);

    try (RecordStream stream = source.open(LOG, TimeWindow.unbounded(), FilterChain.empty())) {
      drain(stream);
      ScanDiagnostics diagnostics = stream.diagnostics();
      assertEquals(4, diagnostics.malformedCount());
      assertEquals(List.of("bad 1", "bad 2"),
          diagnostics.failureSamples().stream().map(f -> f.rawLine()).toList());
    }
  }

  @Test
  void windowExcludesRecordsOutsideWithoutEarlyExitByDefault() throws IOException {
    List<String> lines = List.of(at("00:59:59"), at("01:00:00"), at("01:00:01"), at("00:00:00"));
    InMemoryLineReaderFactory readers = new InMemoryLineReaderFactory(lines);
    LogSource source = new LogSource(readers, new HaproxyLineParser());

    try (RecordStream stream = source.open(LOG, TimeWindow.between(START, Duration.ofSeconds(1)),
        FilterChain.empty())) {
      List<LogRecord> records = drain(stream);
      assertEquals(1, records.size());
      assertEquals(START, records.get(0).timestamp());
      assertEquals(3, stream.diagnostics().filteredOut());
      assertFalse(stream.diagnostics().stoppedEarly());
    }
    assertEquals(4, readers.linesServed());
  }

  @Test
  void orderedFileStopsParsingPastWindowEnd() throws IOException {
    List<String> lines = List.of(at("00:59:59"), at("01:00:00"), at("01:00:01"), "tail junk", "", at("02:00:00"));
    InMemoryLineReaderFactory readers = new InMemoryLineReaderFactory(lines);
    LogSource source = new LogSource(readers, new HaproxyLineParser(), true, LogSource.DEFAULT_MAX_FAILURE_SAMPLES);

    try (RecordStream stream = source.open(LOG, TimeWindow.between(START, Duration.ofSeconds(1)),
        FilterChain.empty())) {
      assertEquals(1, drain(stream).size());
      ScanDiagnostics diagnostics = stream.diagnostics();
      assertEquals(3, diagnostics.linesRead());
      assertEquals(2, diagnostics.unscannedLines());
      assertEquals(0, diagnostics.malformedCount());
      assertTrue(diagnostics.stoppedEarly());
    }
  }

  @Test
  void outOfOrderTimestampDisablesEarlyExit() throws IOException {
    List<String> lines = List.of(at("01:00:00"), at("00:30:00"), at("01:00:05"), at("01:00:00"));
    LogSource source = new LogSource(new InMemoryLineReaderFactory(lines), new HaproxyLineParser(), true, 10);

    try (RecordStream stream = source.open(LOG, TimeWindow.between(START, Duration.ofSeconds(1)),
        FilterChain.empty())) {
      assertEquals(2, drain(stream).size());
      assertEquals(0, stream.diagnostics().unscannedLines());
      assertEquals(4, stream.diagnostics().linesRead());
    }
  }

  @Test
  void closeReleasesReaderAndEndsIteration() throws IOException {
    InMemoryLineReaderFactory readers = new InMemoryLineReaderFactory(List.of(at("01:00:00"), at("01:00:01")));
    LogSource source = new LogSource(readers, new HaproxyLineParser());

    RecordStream stream = source.open(LOG, TimeWindow.unbounded(), FilterChain.empty());
    stream.next();
    stream.close();

    assertFalse(stream.hasNext());
    assertThrows(NoSuchElementException.class, stream::next);
    assertEquals(1, readers.closes());
  }

  @Test
  void readFailureSurfacesAsUncheckedIo() throws IOException {
    LogSource source = new LogSource(path -> new LineReader() {
      @Override
      public String nextLine() throws IOException {
        throw new IOException("disk gone");
      }

      @Override
      public void close() {}
    }, new HaproxyLineParser());

    try (RecordStream stream = source.open(LOG, TimeWindow.unbounded(), FilterChain.empty())) {
      UncheckedIOException ex = assertThrows(UncheckedIOException.class, stream::hasNext);
      assertEquals("disk gone", ex.getCause().getMessage());
    }
  }

  @Test
  void negativeSampleSizeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new LogSource(new InMemoryLineReaderFactory(List.of()), new HaproxyLineParser(), false, -1));
  }
}
