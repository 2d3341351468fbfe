package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;

/** Counts valid records. */
final class RecordCounter implements Aggregator {
  private long count;

  @Override
  public void accept(LogRecord record) {
    count++;
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    return ReportValue.scalar(count);
  }
}
