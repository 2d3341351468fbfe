package ca.gc.cra.proxylog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void sanitizeNormalizesPath() {
    Path raw = tempDir.resolve("logs/../haproxy.log");

    assertEquals(
        tempDir.resolve("haproxy.log").toAbsolutePath().normalize(),
        Paths.sanitize("log", raw.toString()));
  }

  @Test
  void sanitizeDoesNotRequireExistence() {
    Path absent = tempDir.resolve("absent.log");

    assertEquals(absent.toAbsolutePath().normalize(), Paths.sanitize("log", absent.toString()));
  }

  @Test
  void sanitizeRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Paths.sanitize("log", " "));
    assertThrows(IllegalArgumentException.class, () -> Paths.sanitize("log", "a\0b"));
    assertThrows(IllegalArgumentException.class, () -> Paths.sanitize("log", "a\nb"));
  }
}
