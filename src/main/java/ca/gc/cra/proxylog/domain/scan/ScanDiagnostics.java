package ca.gc.cra.proxylog.domain.scan;

import ca.gc.cra.proxylog.domain.log.ParseFailure;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Counters describing one traversal of a log file.
 * <p><strong>Accounting:</strong> every non-blank line read is exactly one of malformed,
 * filtered out or valid, so {@code linesRead == malformedCount() + filteredOut + valid}.
 * {@code unscannedLines} counts non-blank lines skipped without parsing after an early exit and is
 * not part of {@code linesRead}.</p>
 *
 * @param linesRead non-blank lines consumed
 * @param malformedStructural lines whose layout did not match
 * @param malformedValue lines with a bad numeric or timestamp value
 * @param filteredOut parsed lines excluded by the time window or a filter
 * @param valid lines that reached the aggregators
 * @param unscannedLines lines skipped without parsing after an early exit
 * @param failureSamples first rejected lines, bounded by the configured sample size
 * @since 0.1.0
 */
public record ScanDiagnostics(
    long linesRead,
    long malformedStructural,
    long malformedValue,
    long filteredOut,
    long valid,
    long unscannedLines,
    List<ParseFailure> failureSamples) {

  public ScanDiagnostics {
    if (linesRead < 0 || malformedStructural < 0 || malformedValue < 0 || filteredOut < 0 || valid < 0
        || unscannedLines < 0) {
      throw new IllegalArgumentException("counters must be non-negative");
    }
    failureSamples = List.copyOf(Objects.requireNonNull(failureSamples, "failureSamples"));
  }

  /**
   * Diagnostics of a traversal that read nothing.
   *
   * @return all-zero diagnostics
   */
  public static ScanDiagnostics empty() {
    return new ScanDiagnostics(0, 0, 0, 0, 0, 0, List.of());
  }

  public long malformedCount() {
    return malformedStructural + malformedValue;
  }

  /**
   * Indicates the scan stopped before the end of the file.
   *
   * @return {@code true} after an early exit on an ordered file
   */
  public boolean stoppedEarly() {
    return unscannedLines > 0;
  }
}
