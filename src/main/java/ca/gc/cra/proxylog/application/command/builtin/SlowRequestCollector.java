package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Flags records whose total session time exceeds a threshold.
 *
 * <p>Lists the records in file order, or only counts them. A missing total time ({@code -1})
 * never counts as slow.</p>
 */
final class SlowRequestCollector implements Aggregator {
  private final long thresholdMs;
  private final boolean listRecords;
  private final List<LogRecord> slow = new ArrayList<>();
  private long count;

  SlowRequestCollector(long thresholdMs, boolean listRecords) {
    this.thresholdMs = thresholdMs;
    this.listRecords = listRecords;
  }

  @Override
  public void accept(LogRecord record) {
    OptionalLong total = record.timers().total();
    if (total.isPresent() && total.getAsLong() > thresholdMs) {
      count++;
      if (listRecords) {
        slow.add(record);
      }
    }
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    return listRecords ? ReportValue.records(slow) : ReportValue.scalar(count);
  }
}
