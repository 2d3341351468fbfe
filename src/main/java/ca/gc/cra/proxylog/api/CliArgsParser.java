package ca.gc.cra.proxylog.api;

import ca.gc.cra.proxylog.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Values split on the first {@code '='} only, so {@code filters=path:/a?b=c} keeps its
 * parameter intact. A repeated key is rejected rather than silently overwritten.</p>
 */
public final class CliArgsParser {

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable, insertion-ordered map.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return map keyed by the text before the first {@code '='}
   * @throws IllegalArgumentException for a malformed, repeated or control-character argument
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = Strings.requireIdentifier("argument name", arg.substring(0, idx).trim());
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1).trim());
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument given more than once: " + key);
      }
    }
    return map;
  }
}
