package ca.gc.cra.proxylog.application.command;

/**
 * Tunables shared by the built-in report commands.
 *
 * @param slowRequestThresholdMs total session time above which a request counts as slow
 * @param topN number of entries kept by top-N reports
 * @since 0.1.0
 */
public record CommandSettings(long slowRequestThresholdMs, int topN) {
  public static final long DEFAULT_SLOW_REQUEST_THRESHOLD_MS = 1_000;
  public static final int DEFAULT_TOP_N = 10;

  public CommandSettings {
    if (slowRequestThresholdMs < 0) {
      throw new IllegalArgumentException("slowRequestThresholdMs must be >= 0 (was " + slowRequestThresholdMs + ")");
    }
    if (topN < 1) {
      throw new IllegalArgumentException("topN must be >= 1 (was " + topN + ")");
    }
  }

  public static CommandSettings defaults() {
    return new CommandSettings(DEFAULT_SLOW_REQUEST_THRESHOLD_MS, DEFAULT_TOP_N);
  }
}
