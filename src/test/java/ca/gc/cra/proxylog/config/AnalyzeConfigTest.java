package ca.gc.cra.proxylog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.filter.FilterActivation;
import ca.gc.cra.proxylog.application.pipeline.AnalysisRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzeConfigTest {

  @TempDir Path tempDir;

  private Map<String, String> options(String... pairs) {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("analyze"));
    options.put("log", tempDir.resolve("haproxy.log").toString());
    options.put("commands", "counter");
    for (int i = 0; i + 1 < pairs.length; i += 2) {
      options.put(pairs[i], pairs[i + 1]);
    }
    return options;
  }

  @Test
  void defaultsProduceMinimalConfig() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(options());

    assertEquals(tempDir.resolve("haproxy.log").toAbsolutePath().normalize(), config.logFile());
    assertEquals(List.of("counter"), config.commands());
    assertTrue(config.start().isEmpty());
    assertTrue(config.delta().isEmpty());
    assertTrue(config.filters().isEmpty());
    assertEquals(OutputFormat.TEXT, config.format());
    assertEquals(1000L, config.slowRequestThresholdMs());
    assertEquals(10, config.topN());
    assertFalse(config.assumeOrdered());
    assertEquals(10, config.maxFailureSamples());
  }

  @Test
  void parsesEveryOption() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(options(
        "commands", " http_methods , ip_counter ,",
        "start", "11/Dec/2013:14:15",
        "delta", "2m",
        "filters", "status_code:200,!ip_range:10.0.0.0/8",
        "format", "JSON",
        "slowThresholdMs", "250",
        "topN", "3",
        "assumeOrdered", "true",
        "maxFailureSamples", "0"));

    assertEquals(List.of("http_methods", "ip_counter"), config.commands());
    assertEquals(LocalDateTime.of(2013, 12, 11, 14, 15), config.start().orElseThrow());
    assertEquals(Duration.ofMinutes(2), config.delta().orElseThrow());
    assertEquals(
        List.of(FilterActivation.of("status_code", "200"), new FilterActivation("ip_range", "10.0.0.0/8", true)),
        config.filters());
    assertEquals(OutputFormat.JSON, config.format());
    assertEquals(new CommandSettings(250, 3), config.commandSettings());
    assertTrue(config.assumeOrdered());
    assertEquals(0, config.maxFailureSamples());

    AnalysisRequest request = config.toRequest();
    assertEquals(config.logFile(), request.logFile());
    assertEquals(config.commands(), request.commands());
    assertEquals(config.filters(), request.filters());
  }

  @Test
  void missingLogIsRejected() {
    Map<String, String> options = options();
    options.put("log", " ");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options));
    assertEquals("log is required", ex.getMessage());
  }

  @Test
  void missingCommandsAreRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("commands", " , ")));
    assertEquals("commands is required", ex.getMessage());
  }

  @Test
  void commandNamesMustBeIdentifiers() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("commands", "counter;rm")));
    assertTrue(ex.getMessage().startsWith("commands must only contain"), ex.getMessage());
  }

  @Test
  void deltaWithoutStartIsRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("delta", "1h")));
    assertEquals("delta requires start", ex.getMessage());
  }

  @Test
  void outOfRangeNumbersNameTheirKey() {
    IllegalArgumentException topN = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("topN", "0")));
    assertTrue(topN.getMessage().startsWith("topN must be between 1 and"), topN.getMessage());

    IllegalArgumentException slow = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("slowThresholdMs", "fast")));
    assertTrue(slow.getMessage().startsWith("slowThresholdMs must be an integer"), slow.getMessage());
  }

  @Test
  void assumeOrderedMustBeBoolean() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("assumeOrdered", "yes")));
    assertTrue(ex.getMessage().startsWith("assumeOrdered must be true or false"), ex.getMessage());
  }

  @Test
  void unknownFormatIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options("format", "xml")));
  }

  @Test
  void commandSettingsIgnoreLogAndCommands() {
    CommandSettings settings = AnalyzeConfig.commandSettings(Map.of("topN", "7"));
    assertEquals(new CommandSettings(CommandSettings.DEFAULT_SLOW_REQUEST_THRESHOLD_MS, 7), settings);
  }
}
