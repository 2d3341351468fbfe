package ca.gc.cra.proxylog.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"log=/tmp/haproxy.log", " commands=counter "});
    assertEquals("/tmp/haproxy.log", map.get("log"));
    assertEquals("counter", map.get("commands"));
  }

  @Test
  void splitsOnFirstEqualsOnly() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"filters=path:/a?b=c"});
    assertEquals("path:/a?b=c", map.get("filters"));
  }

  @Test
  void keepsArgumentOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"topN=3", "log=x", "commands=counter"});
    assertEquals(List.of("topN", "log", "commands"), List.copyOf(map.keySet()));
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"log="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsRepeatedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"commands=counter", "commands=ip_counter"}));
    assertEquals("argument given more than once: commands", ex.getMessage());
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
