package ca.gc.cra.proxylog.application.filter.builtin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.testing.LogLines;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BuiltInFiltersTest {
  private final FilterRegistry registry = BuiltInFilters.registerAll(new FilterRegistry());

  @Test
  void registersEveryBuiltInFilter() {
    assertEquals(Set.of("ip", "ip_range", "path", "ssl", "slow_requests", "wait_on_queues",
        "status_code", "status_code_family", "http_method", "frontend", "backend", "server",
        "response_size", "termination_state"), registry.names());
  }

  @Test
  void ipMatchesExactAndEquivalentIpv6Forms() {
    Filter ip = registry.activate("ip", "2001:db8::1");

    assertTrue(ip.matches(LogLines.line().ip("2001:db8:0:0:0:0:0:1").record()));
    assertFalse(ip.matches(LogLines.line().ip("2001:db8::2").record()));
    assertTrue(registry.activate("ip", "10.0.0.5").matches(LogLines.line().ip("10.0.0.5").record()));
  }

  @Test
  void ipRangeUsesPrefixLength() {
    Filter range = registry.activate("ip_range", "10.1.0.0/16");

    assertTrue(range.matches(LogLines.line().ip("10.1.200.3").record()));
    assertFalse(range.matches(LogLines.line().ip("10.2.0.1").record()));
    assertFalse(range.matches(LogLines.line().ip("2001:db8::1").record()));
  }

  @Test
  void pathMatchesSubstringOfPathOnly() {
    Filter path = registry.activate("path", "/api/");

    assertTrue(path.matches(LogLines.line().request("GET", "/api/orders?id=3").record()));
    assertFalse(path.matches(LogLines.line().request("GET", "/index.html?next=/api/").record()));
    assertFalse(path.matches(LogLines.line().noRequest().record()));
  }

  @Test
  void sslMatchesHttpsTargetsAndPort443() {
    Filter ssl = registry.activate("ssl", "");

    assertTrue(ssl.matches(LogLines.line().request("GET", "https://example.com/").record()));
    assertTrue(ssl.matches(LogLines.line().request("CONNECT", "example.com:443").record()));
    assertFalse(ssl.matches(LogLines.line().request("GET", "/plain").record()));
    assertThrows(IllegalArgumentException.class, () -> registry.activate("ssl", "yes"));
  }

  @Test
  void slowRequestsIgnoresMissingTotal() {
    Filter slow = registry.activate("slow_requests", "1000");

    assertTrue(slow.matches(LogLines.line().timers("0/0/0/0/1001").record()));
    assertFalse(slow.matches(LogLines.line().timers("0/0/0/0/1000").record()));
    assertFalse(slow.matches(LogLines.line().timers("0/0/0/0/-1").record()));
  }

  @Test
  void waitOnQueuesUsesQueueTimer() {
    Filter queued = registry.activate("wait_on_queues", "50");

    assertTrue(queued.matches(LogLines.line().timers("0/51/0/0/60").record()));
    assertFalse(queued.matches(LogLines.line().timers("0/-1/0/0/60").record()));
  }

  @Test
  void statusCodeAndFamily() {
    LogRecord notFound = LogLines.line().status(404).record();
    LogRecord closed = LogLines.line().status(-1).record();

    assertTrue(registry.activate("status_code", "404").matches(notFound));
    assertTrue(registry.activate("status_code_family", "4").matches(notFound));
    assertTrue(registry.activate("status_code_family", "4XX").matches(notFound));
    assertFalse(registry.activate("status_code_family", "2").matches(notFound));
    assertFalse(registry.activate("status_code_family", "4").matches(closed));
  }

  @Test
  void httpMethodIsCaseInsensitive() {
    assertTrue(registry.activate("http_method", "post").matches(LogLines.line().request("POST", "/").record()));
    assertFalse(registry.activate("http_method", "GET").matches(LogLines.line().noRequest().record()));
  }

  @Test
  void proxyComponentNames() {
    LogRecord record = LogLines.line().frontend("fe1").backend("be1").server("s1").record();

    assertTrue(registry.activate("frontend", "fe1").matches(record));
    assertTrue(registry.activate("backend", "be1").matches(record));
    assertTrue(registry.activate("server", "s1").matches(record));
    assertFalse(registry.activate("server", "s2").matches(record));
  }

  @Test
  void responseSizeComparisons() {
    LogRecord record = LogLines.line().bytes(500).record();

    assertTrue(registry.activate("response_size", "+499").matches(record));
    assertFalse(registry.activate("response_size", "+500").matches(record));
    assertTrue(registry.activate("response_size", "-501").matches(record));
    assertTrue(registry.activate("response_size", "500").matches(record));
  }

  @Test
  void terminationStatePrefix() {
    LogRecord record = LogLines.line().term("SH--").record();

    assertTrue(registry.activate("termination_state", "S").matches(record));
    assertTrue(registry.activate("termination_state", "SH").matches(record));
    assertFalse(registry.activate("termination_state", "CD").matches(record));
  }

  @ParameterizedTest
  @CsvSource({
      "ip, not-an-ip",
      "ip, 300.1.1.1",
      "ip_range, 10.0.0.0/33",
      "ip_range, 10.0.0.0/x",
      "slow_requests, ''",
      "slow_requests, -5",
      "wait_on_queues, 1.5",
      "status_code, 42",
      "status_code, abc",
      "status_code_family, 6",
      "status_code_family, 2x",
      "http_method, ''",
      "frontend, ''",
      "response_size, +",
      "response_size, big",
      "termination_state, SHORT1",
      "path, ''"
  })
  void malformedParametersFailAtActivation(String name, String argument) {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> registry.activate(name, argument));
    assertTrue(ex.getMessage().startsWith("invalid parameter for filter " + name), ex.getMessage());
  }
}
