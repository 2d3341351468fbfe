package ca.gc.cra.proxylog.application.command;

import java.util.Objects;

/**
 * Result of one report command.
 *
 * @param command command name as requested
 * @param value computed value
 * @param metadata scan context
 * @since 0.1.0
 */
public record Report(String command, ReportValue value, ReportMetadata metadata) {

  public Report {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(metadata, "metadata");
  }
}
