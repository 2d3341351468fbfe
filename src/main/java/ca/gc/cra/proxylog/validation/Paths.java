package ca.gc.cra.proxylog.validation;

import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for PROXYLOG CLI and configuration flows.
 * <p><strong>Why:</strong> Rejects unusable log paths while arguments are still being checked,
 * so the operator sees a usage error instead of a failed scan.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Checks a path for null bytes and control characters and normalizes it.
   *
   * @param name parameter name for diagnostics
   * @param raw candidate path text
   * @return absolute, normalized path (existence is not checked)
   * @throws IllegalArgumentException if the text is blank or contains control characters
   */
  public static Path sanitize(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (java.nio.file.InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
