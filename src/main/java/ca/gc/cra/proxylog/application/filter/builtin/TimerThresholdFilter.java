package ca.gc.cra.proxylog.application.filter.builtin;

import ca.gc.cra.proxylog.application.filter.Filter;
import ca.gc.cra.proxylog.domain.log.LogRecord;
import ca.gc.cra.proxylog.domain.log.Timers;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * Selects records whose chosen timer exceeds a threshold in milliseconds.
 *
 * <p>Records where the timer was not applicable never match.</p>
 */
final class TimerThresholdFilter implements Filter {
  private final String name;
  private final Function<Timers, OptionalLong> timer;
  private final long thresholdMillis;

  TimerThresholdFilter(String name, Function<Timers, OptionalLong> timer, String argument) {
    this.name = name;
    this.timer = timer;
    this.thresholdMillis = BuiltInFilters.parseNonNegativeLong(name, argument);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean matches(LogRecord record) {
    OptionalLong value = timer.apply(record.timers());
    return value.isPresent() && value.getAsLong() > thresholdMillis;
  }
}
