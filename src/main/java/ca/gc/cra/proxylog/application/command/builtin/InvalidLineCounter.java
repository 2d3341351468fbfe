package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;

/** Reports the number of lines the parser rejected; valid records are ignored. */
final class InvalidLineCounter implements Aggregator {

  @Override
  public void accept(LogRecord record) {
    // malformed lines never reach aggregators; the count comes from the scan diagnostics
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    return ReportValue.scalar(diagnostics.malformedCount());
  }
}
