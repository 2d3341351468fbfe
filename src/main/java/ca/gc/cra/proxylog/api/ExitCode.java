package ca.gc.cra.proxylog.api;

/**
 * <strong>What:</strong> Process exit codes returned by PROXYLOG commands.
 * <p><strong>Why:</strong> Scripts wrapping an analysis can tell a bad invocation from an unreadable
 * log without parsing output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Reports were produced (or a listing/dry run completed). */
  SUCCESS(0),
  /** Arguments, configuration keys, command or filter names were invalid. */
  INVALID_ARGS(2),
  /** The log or configuration file could not be read. */
  IO_ERROR(3),
  /** The YAML configuration file exists but is not valid YAML or has the wrong structure. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
