package ca.gc.cra.proxylog.config;

import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.filter.FilterActivation;
import ca.gc.cra.proxylog.application.pipeline.AnalysisRequest;
import ca.gc.cra.proxylog.application.pipeline.LogSource;
import ca.gc.cra.proxylog.validation.Numbers;
import ca.gc.cra.proxylog.validation.Paths;
import ca.gc.cra.proxylog.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings of one {@code analyze} run.
 * <p><strong>Why:</strong> Turns the merged defaults/YAML/CLI map into typed, validated values so the
 * use case never sees raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param logFile log file to scan
 * @param commands command names in report order
 * @param start optional window start
 * @param delta optional window length; requires {@code start}
 * @param filters filter activations in request order
 * @param format report output format
 * @param slowRequestThresholdMs threshold used by the slow-request commands
 * @param topN entries kept by top-N commands
 * @param assumeOrdered whether the file may be treated as time-ordered for early exit
 * @param maxFailureSamples rejected lines kept as samples
 * @since 0.1.0
 * @see ca.gc.cra.proxylog.application.pipeline.AnalyzeUseCase
 */
public record AnalyzeConfig(
    Path logFile,
    List<String> commands,
    Optional<LocalDateTime> start,
    Optional<Duration> delta,
    List<FilterActivation> filters,
    OutputFormat format,
    long slowRequestThresholdMs,
    int topN,
    boolean assumeOrdered,
    int maxFailureSamples) {

  private static final int MAX_TOP_N = 1_000_000;
  private static final int MAX_FAILURE_SAMPLES = 10_000;

  /**
   * Normalizes values and enforces invariants.
   *
   * @throws IllegalArgumentException if no command is given, {@code delta} lacks {@code start}, or a
   *     number is out of range
   */
  public AnalyzeConfig {
    Objects.requireNonNull(logFile, "logFile");
    commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
    if (commands.isEmpty()) {
      throw new IllegalArgumentException("commands must name at least one command");
    }
    start = Objects.requireNonNullElse(start, Optional.empty());
    delta = Objects.requireNonNullElse(delta, Optional.empty());
    if (delta.isPresent() && start.isEmpty()) {
      throw new IllegalArgumentException("delta requires start");
    }
    filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    format = Objects.requireNonNullElse(format, OutputFormat.TEXT);
    Numbers.requireRange("slowThresholdMs", slowRequestThresholdMs, 0, Long.MAX_VALUE);
    Numbers.requireRange("topN", topN, 1, MAX_TOP_N);
    Numbers.requireRange("maxFailureSamples", maxFailureSamples, 0, MAX_FAILURE_SAMPLES);
  }

  /**
   * Creates a configuration from flattened key/value pairs.
   *
   * @param options keys such as {@code log}, {@code commands}, {@code start}, {@code delta},
   *     {@code filters}, {@code format}, {@code slowThresholdMs}, {@code topN}, {@code assumeOrdered}
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String logRaw = options.get("log");
    if (logRaw == null || logRaw.isBlank()) {
      throw new IllegalArgumentException("log is required");
    }
    Path logFile = Paths.sanitize("log", logRaw);

    List<String> commands = splitList("commands", options.get("commands"));

    Optional<LocalDateTime> start = optional(options.get("start")).map(TimeArguments::parseStart);
    Optional<Duration> delta = optional(options.get("delta")).map(TimeArguments::parseDelta);
    List<FilterActivation> filters = optional(options.get("filters"))
        .map(FilterActivation::parseList)
        .orElse(List.of());

    OutputFormat format = OutputFormat.parse(options.get("format"));
    CommandSettings settings = commandSettings(options);
    boolean assumeOrdered = parseBoolean(options, "assumeOrdered", false);
    int samples = (int) parseLong(options, "maxFailureSamples",
        LogSource.DEFAULT_MAX_FAILURE_SAMPLES, 0, MAX_FAILURE_SAMPLES);

    return new AnalyzeConfig(
        logFile, commands, start, delta, filters, format,
        settings.slowRequestThresholdMs(), settings.topN(), assumeOrdered, samples);
  }

  /**
   * Reads only the command tunables; used where no log file is involved ({@code --list-commands}).
   *
   * @param options flattened configuration
   * @return command settings with defaults for absent keys
   * @throws IllegalArgumentException if a value is out of range
   */
  public static CommandSettings commandSettings(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    long slowMs = parseLong(options, "slowThresholdMs",
        CommandSettings.DEFAULT_SLOW_REQUEST_THRESHOLD_MS, 0, Long.MAX_VALUE);
    int topN = (int) parseLong(options, "topN", CommandSettings.DEFAULT_TOP_N, 1, MAX_TOP_N);
    return new CommandSettings(slowMs, topN);
  }

  /**
   * Builds the use case request.
   *
   * @return request carrying file, commands, window bounds and filters
   */
  public AnalysisRequest toRequest() {
    return new AnalysisRequest(logFile, commands, start, delta, filters);
  }

  public CommandSettings commandSettings() {
    return new CommandSettings(slowRequestThresholdMs, topN);
  }

  private static List<String> splitList(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    List<String> items = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        items.add(Strings.requireIdentifier(key, trimmed));
      }
    }
    if (items.isEmpty()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return items;
  }

  private static Optional<String> optional(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static long parseLong(
      Map<String, String> options, String key, long defaultValue, long min, long max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
  }
}
