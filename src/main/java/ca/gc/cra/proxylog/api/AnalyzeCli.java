package ca.gc.cra.proxylog.api;

import ca.gc.cra.proxylog.application.command.CommandRegistry;
import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.application.pipeline.AnalysisResult;
import ca.gc.cra.proxylog.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.proxylog.application.port.MetricsPort;
import ca.gc.cra.proxylog.config.AnalyzeConfig;
import ca.gc.cra.proxylog.config.CompositionRoot;
import ca.gc.cra.proxylog.config.ConfigMerger;
import ca.gc.cra.proxylog.config.DefaultsForMode;
import ca.gc.cra.proxylog.config.YamlConfigLoader;
import ca.gc.cra.proxylog.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.proxylog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.proxylog.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code proxylog analyze}: validates arguments, runs the requested report commands
 * over one log file and prints the reports.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run", "--list-commands", "--list-filters");
  private static final String SUMMARY_USAGE =
      "usage: analyze log=PATH commands=NAME[,NAME...] [start=DD/Mon/YYYY[:HH[:MM[:SS]]]] "
          + "[delta=N(s|m|h|d)] [filters=[!]NAME[:ARG],...] [format=text|json] "
          + "[slowThresholdMs=N] [topN=N] [assumeOrdered=true|false] [config=PATH] "
          + "[--list-commands] [--list-filters] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      PROXYLOG analyze

      Usage:
        analyze log=/var/log/haproxy.log commands=counter,status_codes_counter [options]

      Required:
        log=PATH                   HAProxy log file
        commands=NAME,...          Report commands, reported in the order given

      Selection:
        start=11/Dec/2013[:HH[:MM[:SS]]]  Inclusive window start
        delta=45s|2m|13h|1d        Window length after start (requires start)
        filters=NAME[:ARG],...     Filters AND-ed together; prefix a name with ! to negate

      Optional:
        format=text|json           Output format (default text)
        slowThresholdMs=N          Threshold for slow_requests commands (default 1000)
        topN=N                     Entries kept by top_* commands (default 10)
        assumeOrdered=true|false   Stop parsing once past the window on time-ordered files (default false)
        maxFailureSamples=N        Malformed lines kept for diagnostics (default 10)
        config=PATH                YAML file with common/analyze sections; CLI wins over YAML
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --list-commands            Print available commands and exit
        --list-filters             Print available filters and exit
        --dry-run                  Validate arguments and print the plan without reading the log
        --verbose                  Enable DEBUG logging (logs each skipped line)
        --help                     Show this message
      """;

  private AnalyzeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(CliInput.parse(args));
  }

  /**
   * Executes the analyze CLI logic using structured logging and exit codes.
   *
   * @param input parsed arguments without the sub-command token
   * @return exit code capturing the outcome
   */
  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose") && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (input.hasFlag("--list-commands") || input.hasFlag("--list-filters")) {
      return printListings(input, effective);
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    AnalyzeConfig config;
    boolean metricsEnabled;
    try {
      metricsEnabled = TelemetryConfigurator.configureMetrics(configInputs);
      config = AnalyzeConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MetricsPort metrics = metricsEnabled && !dryRun
        ? new OpenTelemetryMetricsAdapter()
        : new NoOpMetricsAdapter();
    try {
      CompositionRoot root = new CompositionRoot(metrics);
      AnalyzeUseCase useCase = root.analyzeUseCase(config);
      if (dryRun) {
        return printDryRunPlan(config, useCase.plan(config.toRequest()));
      }
      AnalysisResult result = useCase.analyze(config.toRequest());
      Writer out = CliPrinter.out();
      root.renderer(config.format()).render(result, out);
      out.flush();
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read log file {}: {}", config.logFile(), describe(ex));
      log.debug("I/O failure details", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while analyzing {}", config.logFile(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.forceFlush();
        otel.close();
      }
    }
  }

  private static ExitCode printListings(CliInput input, Map<String, String> effective) {
    CompositionRoot root = new CompositionRoot(new NoOpMetricsAdapter());
    if (input.hasFlag("--list-commands")) {
      CommandRegistry commands;
      try {
        commands = root.commandRegistry(AnalyzeConfig.commandSettings(effective));
      } catch (IllegalArgumentException ex) {
        log.error("Invalid analyze arguments: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      CliPrinter.println("Commands:");
      printTable(commands.descriptions());
    }
    if (input.hasFlag("--list-filters")) {
      FilterRegistry filters = root.filterRegistry();
      CliPrinter.println("Filters (prefix with ! to negate):");
      printTable(filters.descriptions());
    }
    return ExitCode.SUCCESS;
  }

  private static void printTable(Map<String, String> rows) {
    int width = 0;
    for (String name : rows.keySet()) {
      width = Math.max(width, name.length());
    }
    for (Map.Entry<String, String> row : rows.entrySet()) {
      CliPrinter.println("  " + String.format("%-" + width + "s", row.getKey()) + "  " + row.getValue());
    }
  }

  private static ExitCode printDryRunPlan(AnalyzeConfig config, AnalyzeUseCase.Plan plan) {
    CliPrinter.printLines(
        "Analyze dry-run: the log file will not be read.",
        " Log file          : " + plan.logFile()
            + (Files.isReadable(plan.logFile()) ? "" : " (not readable)"),
        " Commands          : " + String.join(", ", plan.commands()),
        " Window            : " + plan.window(),
        " Filters           : " + (plan.filters().isEmpty() ? "<none>" : plan.filters()),
        " Format            : " + config.format(),
        " Slow threshold ms : " + config.slowRequestThresholdMs(),
        " Top N             : " + config.topN(),
        " Assume ordered    : " + config.assumeOrdered(),
        " Re-run without --dry-run to produce the reports.");
    return ExitCode.SUCCESS;
  }

  private static String describe(IOException ex) {
    String type = ex.getClass().getSimpleName();
    return ex.getMessage() == null ? type : type + ": " + ex.getMessage();
  }
}
