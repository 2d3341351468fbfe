package ca.gc.cra.proxylog.application.pipeline;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.CommandRegistry;
import ca.gc.cra.proxylog.application.command.Report;
import ca.gc.cra.proxylog.application.command.ReportMetadata;
import ca.gc.cra.proxylog.application.filter.FilterChain;
import ca.gc.cra.proxylog.application.filter.FilterRegistry;
import ca.gc.cra.proxylog.application.port.MetricsPort;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs report commands over one log file.
 * <p><strong>Why:</strong> Single entry point that validates a request, scans the file once for all
 * single-pass commands and hands back every report or nothing.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve command names, filter activations and the time window before touching the file.</li>
 *   <li>Feed one shared traversal to every aggregator; reopen the file for extra passes.</li>
 *   <li>Collect reports in request order and publish {@code analyze.*} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share; each call owns its aggregators and streams.</p>
 * <p><strong>Observability:</strong> Puts the input file under MDC key {@value #MDC_LOG_FILE} for the
 * duration of a scan.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  /** MDC key holding the file being scanned. */
  public static final String MDC_LOG_FILE = "proxylog.log";

  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);

  private final LogSource source;
  private final FilterRegistry filters;
  private final CommandRegistry commands;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param source opens traversals of a log file
   * @param filters registry used to activate requested filters
   * @param commands registry used to resolve requested commands
   * @param metrics receives scan counters
   */
  public AnalyzeUseCase(LogSource source, FilterRegistry filters, CommandRegistry commands, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.filters = Objects.requireNonNull(filters, "filters");
    this.commands = Objects.requireNonNull(commands, "commands");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Validates a request without reading the file.
   *
   * @param request request to check
   * @return resolved window and filter chain
   * @throws IllegalArgumentException naming the first unknown command, unknown filter, invalid
   *     filter parameter or invalid window
   */
  public Plan plan(AnalysisRequest request) {
    Objects.requireNonNull(request, "request");
    commands.requireKnown(request.commands());
    TimeWindow window = TimeWindow.of(request.start(), request.duration());
    FilterChain chain = filters.chain(request.filters());
    return new Plan(request.logFile(), List.copyOf(request.commands()), window, chain);
  }

  /**
   * Runs every requested command.
   *
   * @param request what to analyze
   * @return one report per command in request order, with the scan diagnostics
   * @throws IllegalArgumentException if the request is invalid; no line has been read
   * @throws IOException if the file cannot be opened or read; no report is produced
   */
  public AnalysisResult analyze(AnalysisRequest request) throws IOException {
    Plan plan = plan(request);
    List<Aggregator> aggregators = new ArrayList<>(plan.commands().size());
    for (String name : plan.commands()) {
      aggregators.add(commands.create(name));
    }

    MDC.put(MDC_LOG_FILE, plan.logFile().toString());
    long started = System.nanoTime();
    try {
      log.info("Analyzing {} with commands {} window {} filters {}",
          plan.logFile(), plan.commands(), plan.window(), plan.filters());
      ScanDiagnostics diagnostics = scan(plan, aggregators, 0);
      for (Aggregator aggregator : aggregators) {
        for (int pass = 1; pass < aggregator.passes(); pass++) {
          scan(plan, List.of(aggregator), pass);
        }
      }

      ReportMetadata metadata =
          new ReportMetadata(diagnostics.valid(), diagnostics.malformedCount(), plan.window());
      List<Report> reports = new ArrayList<>(aggregators.size());
      for (int i = 0; i < aggregators.size(); i++) {
        reports.add(new Report(plan.commands().get(i), aggregators.get(i).result(diagnostics), metadata));
      }

      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
      publish(diagnostics, reports.size(), elapsedMillis);
      if (diagnostics.malformedCount() > 0) {
        log.warn("Skipped {} malformed lines ({} structural, {} value) in {}",
            diagnostics.malformedCount(), diagnostics.malformedStructural(), diagnostics.malformedValue(),
            plan.logFile());
      }
      log.info("Analysis of {} finished in {} ms: {} lines read, {} valid, {} filtered out, {} unscanned",
          plan.logFile(), elapsedMillis, diagnostics.linesRead(), diagnostics.valid(),
          diagnostics.filteredOut(), diagnostics.unscannedLines());
      return new AnalysisResult(plan.logFile(), plan.window(), reports, diagnostics);
    } finally {
      MDC.remove(MDC_LOG_FILE);
    }
  }

  private ScanDiagnostics scan(Plan plan, List<Aggregator> targets, int pass) throws IOException {
    for (Aggregator aggregator : targets) {
      aggregator.startPass(pass);
    }
    try (RecordStream stream = source.open(plan.logFile(), plan.window(), plan.filters())) {
      while (stream.hasNext()) {
        LogRecord record = stream.next();
        for (Aggregator aggregator : targets) {
          aggregator.accept(record);
        }
      }
      return stream.diagnostics();
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }

  private void publish(ScanDiagnostics diagnostics, int reportCount, long elapsedMillis) {
    metrics.add("analyze.lines.read", diagnostics.linesRead());
    metrics.add("analyze.lines.malformed", diagnostics.malformedCount());
    metrics.add("analyze.lines.filtered", diagnostics.filteredOut());
    metrics.add("analyze.records.valid", diagnostics.valid());
    metrics.add("analyze.reports.produced", reportCount);
    metrics.observe("analyze.scan.durationMillis", elapsedMillis);
  }

  /**
   * Validated form of a request.
   *
   * @param logFile file to scan
   * @param commands command names in report order
   * @param window resolved time window
   * @param filters activated filter chain
   */
  public record Plan(Path logFile, List<String> commands, TimeWindow window, FilterChain filters) {}
}
