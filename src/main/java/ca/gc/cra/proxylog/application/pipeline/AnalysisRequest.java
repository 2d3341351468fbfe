package ca.gc.cra.proxylog.application.pipeline;

import ca.gc.cra.proxylog.application.filter.FilterActivation;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What to analyze: one log file, the commands to run, and how records are selected.
 *
 * <p>Names are only checked against the registries by {@link AnalyzeUseCase}.</p>
 *
 * @param logFile log file to scan
 * @param commands command names in report order
 * @param start optional inclusive window start
 * @param duration optional window length after {@code start}
 * @param filters filter activations, AND-ed together
 * @since 0.1.0
 */
public record AnalysisRequest(
    Path logFile,
    List<String> commands,
    Optional<LocalDateTime> start,
    Optional<Duration> duration,
    List<FilterActivation> filters) {

  public AnalysisRequest {
    Objects.requireNonNull(logFile, "logFile");
    commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
    start = start == null ? Optional.empty() : start;
    duration = duration == null ? Optional.empty() : duration;
    filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
  }

  /**
   * Request without a time window or filters.
   *
   * @param logFile log file to scan
   * @param commands command names
   * @return request over the whole file
   */
  public static AnalysisRequest of(Path logFile, List<String> commands) {
    return new AnalysisRequest(logFile, commands, Optional.empty(), Optional.empty(), List.of());
  }
}
