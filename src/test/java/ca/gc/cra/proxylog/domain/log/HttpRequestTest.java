package ca.gc.cra.proxylog.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class HttpRequestTest {

  @Test
  void splitsQueryAtFirstQuestionMark() {
    HttpRequest request = HttpRequest.of("GET", "/search?q=a?b", "HTTP/1.1");

    assertEquals("/search", request.path());
    assertEquals(Optional.of("q=a?b"), request.query());
  }

  @Test
  void targetWithoutQuery() {
    assertEquals(Optional.empty(), HttpRequest.of("GET", "/", "HTTP/1.0").query());
  }

  @Test
  void httpsDetectedFromSchemeOrPort() {
    assertTrue(HttpRequest.of("GET", "https://example.com/a", "HTTP/1.1").isHttps());
    assertTrue(HttpRequest.of("CONNECT", "example.com:443", "HTTP/1.1").isHttps());
    assertTrue(HttpRequest.of("GET", "http://example.com:443/a", "HTTP/1.1").isHttps());
    assertFalse(HttpRequest.of("GET", "/a:443", "HTTP/1.1").isHttps());
    assertFalse(HttpRequest.of("GET", "http://example.com/a", "HTTP/1.1").isHttps());
  }
}
