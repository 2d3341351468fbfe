package ca.gc.cra.proxylog.config;

import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.pipeline.LogSource;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PROXYLOG CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code analyze})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "analyze" -> buildAnalyzeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("log", "");
    map.put("commands", "");
    map.put("start", "");
    map.put("delta", "");
    map.put("filters", "");
    map.put("format", OutputFormat.TEXT.name().toLowerCase(Locale.ROOT));
    map.put("slowThresholdMs", Long.toString(CommandSettings.DEFAULT_SLOW_REQUEST_THRESHOLD_MS));
    map.put("topN", Integer.toString(CommandSettings.DEFAULT_TOP_N));
    map.put("assumeOrdered", "false");
    map.put("maxFailureSamples", Integer.toString(LogSource.DEFAULT_MAX_FAILURE_SAMPLES));
    map.put("dryRun", "false");
    return map;
  }
}
