package ca.gc.cra.proxylog.config;

import ca.gc.cra.proxylog.application.command.CommandRegistry;
import ca.gc.cra.proxylog.application.command.CommandSettings;
import ca.gc.cra.proxylog.application.command.builtin.BuiltInCommands;
import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.application.filter.builtin.BuiltInFilters;
import ca.gc.cra.proxylog.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.proxylog.application.pipeline.LogSource;
import ca.gc.cra.proxylog.application.port.LineReaderFactory;
import ca.gc.cra.proxylog.application.port.MetricsPort;
import ca.gc.cra.proxylog.application.port.ReportRenderer;
import ca.gc.cra.proxylog.infrastructure.io.FileLineReaderFactory;
import ca.gc.cra.proxylog.infrastructure.parse.HaproxyLineParser;
import ca.gc.cra.proxylog.infrastructure.report.JsonReportRenderer;
import ca.gc.cra.proxylog.infrastructure.report.TextReportRenderer;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analyze use case to its concrete adapters.
 * <p><strong>Why:</strong> One place translates an {@link AnalyzeConfig} into registries, a log
 * source and a renderer; the CLI and tests share it.</p>
 * <p><strong>Thread-safety:</strong> Factory methods build fresh object graphs and are not synchronized.</p>
 *
 * @since 0.1.0
 * @see AnalyzeUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final LineReaderFactory readers;

  /**
   * Creates a composition root reading local files.
   *
   * @param metrics metrics adapter handed to use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new FileLineReaderFactory());
  }

  /**
   * Creates a composition root with an explicit line source.
   *
   * @param metrics metrics adapter handed to use cases
   * @param readers opens log files
   */
  public CompositionRoot(MetricsPort metrics, LineReaderFactory readers) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.readers = Objects.requireNonNull(readers, "readers");
  }

  /**
   * Registry holding every built-in filter.
   *
   * @return populated filter registry
   */
  public FilterRegistry filterRegistry() {
    return BuiltInFilters.registerAll(new FilterRegistry());
  }

  /**
   * Registry holding every built-in command.
   *
   * @param settings thresholds and limits for the parameterized commands
   * @return populated command registry
   */
  public CommandRegistry commandRegistry(CommandSettings settings) {
    return BuiltInCommands.registerAll(new CommandRegistry(), settings);
  }

  /**
   * Builds the analyze use case.
   *
   * @param config analyze settings
   * @return ready use case
   */
  public AnalyzeUseCase analyzeUseCase(AnalyzeConfig config) {
    Objects.requireNonNull(config, "config");
    LogSource source = new LogSource(
        readers, new HaproxyLineParser(), config.assumeOrdered(), config.maxFailureSamples());
    return new AnalyzeUseCase(source, filterRegistry(), commandRegistry(config.commandSettings()), metrics);
  }

  /**
   * Selects the renderer for an output format.
   *
   * @param format requested format
   * @return renderer instance
   */
  public ReportRenderer renderer(OutputFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case TEXT -> new TextReportRenderer();
      case JSON -> new JsonReportRenderer();
    };
  }
}
