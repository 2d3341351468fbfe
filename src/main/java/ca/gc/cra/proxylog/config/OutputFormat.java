package ca.gc.cra.proxylog.config;

import java.util.Locale;

/** Report output format selected with {@code format=}. */
public enum OutputFormat {
  TEXT,
  JSON;

  /**
   * Parses a format name case-insensitively.
   *
   * @param raw {@code text} or {@code json}; blank yields {@link #TEXT}
   * @return parsed format
   * @throws IllegalArgumentException for any other value
   */
  public static OutputFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> TEXT;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("format must be 'text' or 'json' (was '" + raw + "')");
    };
  }
}
