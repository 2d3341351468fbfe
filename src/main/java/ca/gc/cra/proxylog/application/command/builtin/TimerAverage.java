package ca.gc.cra.proxylog.application.command.builtin;

import ca.gc.cra.proxylog.application.command.Aggregator;
import ca.gc.cra.proxylog.application.command.ReportValue;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.Timers;
import ca.gc.cra.proxylog.domain.scan.ScanDiagnostics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;

/** Mean of one session timer over the records where it applies, rounded half-up to two decimals. */
final class TimerAverage implements Aggregator {
  private static final int SCALE = 2;

  private final Function<Timers, OptionalLong> timer;
  private BigDecimal sum = BigDecimal.ZERO;
  private long samples;

  TimerAverage(Function<Timers, OptionalLong> timer) {
    this.timer = Objects.requireNonNull(timer, "timer");
  }

  @Override
  public void accept(LogRecord record) {
    OptionalLong value = timer.apply(record.timers());
    if (value.isPresent()) {
      sum = sum.add(BigDecimal.valueOf(value.getAsLong()));
      samples++;
    }
  }

  @Override
  public ReportValue result(ScanDiagnostics diagnostics) {
    if (samples == 0) {
      return ReportValue.scalar(BigDecimal.ZERO.setScale(SCALE));
    }
    return ReportValue.scalar(sum.divide(BigDecimal.valueOf(samples), SCALE, RoundingMode.HALF_UP));
  }
}
