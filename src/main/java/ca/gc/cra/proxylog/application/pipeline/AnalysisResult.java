package ca.gc.cra.proxylog.application.pipeline;

import ca.gc.cra.proxylog.application.command.Report;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import ca.gc.cra.proxylog.domain.window.TimeWindow;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reports produced for one request, in request order, with the scan counters.
 *
 * @param logFile file that was scanned
 * @param window window that was applied
 * @param reports one report per requested command
 * @param diagnostics counters of the shared traversal
 * @since 0.1.0
 */
public record AnalysisResult(Path logFile, TimeWindow window, List<Report> reports, ScanDiagnostics diagnostics) {

  public AnalysisResult {
    Objects.requireNonNull(logFile, "logFile");
    Objects.requireNonNull(window, "window");
    reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
    Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /**
   * Finds the first report of a command.
   *
   * @param command command name
   * @return report, or empty when the command was not requested
   */
  public Optional<Report> report(String command) {
    return reports.stream().filter(r -> r.command().equals(command)).findFirst();
  }
}
