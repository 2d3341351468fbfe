package ca.gc.cra.proxylog.application.command.builtin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxylog.application.command.CommandRegistry;
import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.testing.LogLines;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuiltInCommandsTest {
  private final CommandRegistry registry =
      BuiltInCommands.registerAll(new CommandRegistry(), new CommandSettings(1000, 2));

  private final List<LogRecord> records = List.of(
      LogLines.line().ip("10.0.0.1").at("11/Dec/2013:00:59:10").request("GET", "/a")
          .backend("web").server("s1").timers("1/0/1/10/12").status(200).bytes(100).record(),
      LogLines.line().ip("10.0.0.2").at("11/Dec/2013:00:59:50").request("GET", "/b?x=1")
          .backend("web").server("s2").timers("1/4/1/30/1500").status(200).bytes(200).record(),
      LogLines.line().ip("10.0.0.2").at("11/Dec/2013:01:00:05").request("POST", "https://shop/a")
          .backend("api").server("s1").timers("1/-1/-1/-1/2000").status(503).bytes(300).record(),
      LogLines.line().ip("10.0.0.3").at("11/Dec/2013:01:00:30").noRequest()
          .backend("db").server("s3").timers("0/0/1/-1/900").status(-1).bytes(400).record());

  private ReportValue run(String command) {
    return registry.run(command, records, ScanDiagnostics.empty());
  }

  @Test
  void registersEveryBuiltInCommand() {
    assertEquals(List.of("counter", "counter_invalid", "http_methods", "ip_counter", "top_ips",
        "status_codes_counter", "status_code_families", "request_path_counter", "top_request_paths",
        "slow_requests", "counter_slow_requests", "average_response_time", "average_waiting_time",
        "server_load", "backend_load", "bytes_read_total", "connection_type", "requests_per_minute",
        "requests_per_hour"), List.copyOf(registry.names()));
  }

  @Test
  void counterCountsValidRecords() {
    assertEquals(4L, run("counter").scalar());
  }

  @Test
  void counterInvalidReadsDiagnostics() {
    ScanDiagnostics diagnostics = new ScanDiagnostics(10, 2, 1, 0, 7, 0, List.of());

    assertEquals(3L, registry.run("counter_invalid", List.of(), diagnostics).scalar());
  }

  @Test
  void countsOrderedByCountThenKey() {
    assertCounts(ordered("10.0.0.2", 2L, "10.0.0.1", 1L, "10.0.0.3", 1L), run("ip_counter"));
    assertCounts(ordered("10.0.0.2", 2L, "10.0.0.1", 1L), run("top_ips"));
    assertCounts(ordered("GET", 2L, "POST", 1L), run("http_methods"));
    assertCounts(ordered("s1", 2L, "s2", 1L, "s3", 1L), run("server_load"));
    assertCounts(ordered("web", 2L, "api", 1L, "db", 1L), run("backend_load"));
  }

  @Test
  void pathsDropQueryAndTcpLines() {
    assertCounts(ordered("/a", 1L, "/b", 1L, "https://shop/a", 1L), run("request_path_counter"));
    assertEquals(2, run("top_request_paths").counts().size());
  }

  @Test
  void statusCountsExcludeMissingStatus() {
    assertCounts(ordered("200", 2L, "503", 1L), run("status_codes_counter"));
    assertCounts(ordered("2xx", 2L, "5xx", 1L), run("status_code_families"));
  }

  @Test
  void slowRequestsKeepFileOrder() {
    List<LogRecord> slow = run("slow_requests").records();

    assertEquals(List.of(records.get(1), records.get(2)), slow);
    assertEquals(2L, run("counter_slow_requests").scalar());
  }

  @Test
  void averagesSkipNotApplicableTimers() {
    assertEquals(new BigDecimal("20.00"), run("average_response_time").scalar());
    assertEquals(new BigDecimal("1.33"), run("average_waiting_time").scalar());
  }

  @Test
  void averageWithoutSamplesIsZero() {
    ReportValue value = registry.run("average_response_time", List.of(), ScanDiagnostics.empty());

    assertEquals(new BigDecimal("0.00"), value.scalar());
  }

  @Test
  void bytesReadTotalSumsAll() {
    assertEquals(1000L, run("bytes_read_total").scalar());
  }

  @Test
  void bytesReadTotalKeepsCountingPastLongRange() {
    List<LogRecord> huge = List.of(
        LogLines.line().bytes(Long.MAX_VALUE).record(),
        LogLines.line().bytes(1).record(),
        LogLines.line().bytes(9).record());

    ReportValue total = registry.run("bytes_read_total", huge, ScanDiagnostics.empty());

    assertEquals(new BigDecimal("9223372036854775817"), total.scalar());
  }

  @Test
  void bytesReadTotalStaysLongAtExactlyMaxValue() {
    List<LogRecord> edge = List.of(
        LogLines.line().bytes(Long.MAX_VALUE - 1).record(),
        LogLines.line().bytes(1).record());

    assertEquals(Long.MAX_VALUE, registry.run("bytes_read_total", edge, ScanDiagnostics.empty()).scalar());
  }

  @Test
  void statusFamiliesIgnoreCodesOutsideHttpClasses() {
    List<LogRecord> odd = List.of(
        LogLines.line().status(0).record(),
        LogLines.line().status(99).record(),
        LogLines.line().status(100).record(),
        LogLines.line().status(200).record(),
        LogLines.line().status(599).record(),
        LogLines.line().status(600).record(),
        LogLines.line().status(999).record());

    assertCounts(ordered("1xx", 1L, "2xx", 1L, "5xx", 1L),
        registry.run("status_code_families", odd, ScanDiagnostics.empty()));
    assertEquals(7, registry.run("status_codes_counter", odd, ScanDiagnostics.empty()).counts().size());
  }

  @Test
  void connectionTypeTreatsTcpAsNonSsl() {
    assertCounts(ordered("NON-SSL", 3L, "SSL", 1L), run("connection_type"));
  }

  @Test
  void requestsPerMinuteAndHourAreChronological() {
    assertCounts(ordered("2013-12-11T00:59", 2L, "2013-12-11T01:00", 2L), run("requests_per_minute"));
    assertCounts(ordered("2013-12-11T00:00", 2L, "2013-12-11T01:00", 2L), run("requests_per_hour"));
  }

  @Test
  void emptyInputYieldsEmptyCounts() {
    ReportValue value = registry.run("ip_counter", List.of(), ScanDiagnostics.empty());

    assertTrue(value.counts().isEmpty());
  }

  private static void assertCounts(Map<String, Long> expected, ReportValue actual) {
    assertEquals(List.copyOf(expected.entrySet()), List.copyOf(actual.counts().entrySet()));
  }

  private static Map<String, Long> ordered(Object... pairs) {
    Map<String, Long> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], (Long) pairs[i + 1]);
    }
    return map;
  }
}
