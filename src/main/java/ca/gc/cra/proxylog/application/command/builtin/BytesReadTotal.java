package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Sums bytes sent to clients.
 *
 * <p>The sum stays a {@code long} until it would overflow, then continues as a {@link BigInteger}
 * and is reported as a {@link BigDecimal} scalar.</p>
 */
final class BytesReadTotal implements Aggregator {
  private long total;
  private BigInteger overflowed;

  @Override
  public void accept(LogRecord record) {
    long bytes = record.bytesRead();
    if (overflowed != null) {
      overflowed = overflowed.add(BigInteger.valueOf(bytes));
      return;
    }
    long sum = total + bytes;
    // Both operands are non-negative, so a wrap shows up as a negative sum.
    if (sum < 0) {
      overflowed = BigInteger.valueOf(total).add(BigInteger.valueOf(bytes));
      return;
    }
    total = sum;
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    return overflowed == null ? ReportValue.scalar(total) : ReportValue.scalar(new BigDecimal(overflowed));
  }
}
