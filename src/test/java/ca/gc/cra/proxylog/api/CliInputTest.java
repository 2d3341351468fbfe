package ca.gc.cra.proxylog.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"analyze", "--DRY-RUN", "log=a.log", "-h", "--debug", " "});

    assertArrayEquals(new String[] {"analyze", "log=a.log"}, input.keyValueArgs());
    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag("--list-commands"));
  }

  @Test
  void reportsUnknownFlags() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "--list-commands", "--bogus"});

    assertEquals(List.of("--bogus"), input.unknownFlags(Set.of("--list-commands")));
  }

  @Test
  void dropFirstRemovesSubCommandAndKeepsFlags() {
    CliInput input = CliInput.parse(new String[] {"analyze", "--dry-run", "commands=counter"}).dropFirst();

    assertArrayEquals(new String[] {"commands=counter"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
  }
}
