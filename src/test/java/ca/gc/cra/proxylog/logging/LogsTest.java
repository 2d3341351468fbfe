package ca.gc.cra.proxylog.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    String line = "GET /index.html";
    assertSame(line, Logs.truncate(line, 64));
  }

  @Test
  void longValuesReportOriginalLength() {
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void splitMultiByteCharacterIsDropped() {
    // "é" is two bytes in UTF-8; a three byte budget cuts it in half.
    assertEquals("ab... (truncated, 3 of 5 bytes)", Logs.truncate("abéc", 3));
  }

  @Test
  void nullAndInvalidBudget() {
    assertEquals("<null>", Logs.truncate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void rawLineUsesFixedBudget() {
    String truncated = Logs.rawLine("x".repeat(1_000));
    assertTrue(truncated.startsWith("x".repeat(Logs.RAW_LINE_BUDGET) + "..."));
    assertTrue(truncated.endsWith("(truncated, 256 of 1000 bytes)"));
  }
}
