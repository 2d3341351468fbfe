package ca.gc.cra.proxylog.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by PROXYLOG CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards report sizes, thresholds and failure sample limits before a scan starts.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and range-checks it.
   *
   * @param name logical parameter name included in diagnostics
   * @param text candidate text
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside {@code [min, max]}
   */
  public static long parseInRange(String name, String text, long min, long max) {
    String trimmed = Strings.requireNonBlank(name, text);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be an integer (was " + trimmed + ")", ex);
    }
    return requireRange(name, value, min, max);
  }
}
