package ca.gc.cra.proxylog.application.command;

import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;

/**
 * <strong>What:</strong> Running state of one report command over a sequence of records.
 * <p><strong>Contract:</strong> the engine calls {@link #startPass(int)} before each traversal,
 * {@link #accept(LogRecord)} once per valid record in file order, and {@link #result(ScanDiagnostics)}
 * once after the last traversal. An aggregator never sees raw lines, the file, or other aggregators.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance serves exactly one invocation.</p>
 *
 * @since 0.1.0
 */
public interface Aggregator {

  /**
   * Number of traversals this aggregator needs.
   *
   * @return at least 1; single-pass aggregators share one traversal with each other
   */
  default int passes() {
    return 1;
  }

  /**
   * Signals the beginning of a traversal.
   *
   * @param pass zero-based pass index, below {@link #passes()}
   */
  default void startPass(int pass) {}

  void accept(LogRecord record);

  /**
   * Produces the final value.
   *
   * @param diagnostics counters of the first traversal
   * @return report value
   */
  ReportValue result(ScanDiagnostics diagnostics);
}
