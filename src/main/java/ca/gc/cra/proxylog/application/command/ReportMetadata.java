package ca.gc.cra.proxylog.application.command;

import ca.gc.cra.proxylog.domain.window.TimeWindow;
import java.util.Objects;

/**
 * Context reported next to a command's value.
 *
 * @param recordsConsidered records that passed the window and every filter
 * @param parseFailures lines the parser rejected
 * @param window time window actually applied
 * @since 0.1.0
 */
public record ReportMetadata(long recordsConsidered, long parseFailures, TimeWindow window) {

  public ReportMetadata {
    Objects.requireNonNull(window, "window");
  }
}
