package ca.gc.cra.proxylog.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads PROXYLOG configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <pre>
 * common:
 *   metricsExporter: none
 * analyze:
 *   commands: [counter, status_codes_counter]
 *   filters:
 *     - "status_code_family:5"
 *   slowThresholdMs: 500
 * </pre>
 *
 * <p>Only the {@code common} section and the section named after the mode are read; section names
 * match case-insensitively and the mode section wins over {@code common}. Nested mappings become
 * dotted keys. Lists of scalars are joined with commas, matching the CLI syntax of
 * {@code commands=} and {@code filters=}, so a list entry may not itself contain a comma.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Reads the {@code common} and {@code mode} sections of a YAML file.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code analyze})
   * @return flat configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or has the wrong shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }

    Map<String, String> flat = new LinkedHashMap<>();
    Object common = section(root, COMMON_SECTION);
    if (common != null) {
      flatten(COMMON_SECTION, "", common, flat);
    }
    Object selected = section(root, section);
    if (selected instanceof Map<?, ?>) {
      flatten(section, "", selected, flat);
    }
    return Optional.of(Map.copyOf(flat));
  }

  private static Object section(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(String section, String prefix, Object node, Map<String, String> out) {
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(section + " section must be a mapping");
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(section + " section has a blank or non-string key");
      }
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        flatten(section, key, value, out);
      } else if (value instanceof Iterable<?> list) {
        out.put(key, joinScalars(key, list));
      } else {
        out.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> list) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : list) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list " + key + " may only contain scalar values");
      }
      String text = item.toString().trim();
      if (text.contains(",")) {
        throw new IllegalArgumentException("YAML list " + key + " entries must not contain commas: " + text);
      }
      joined.add(text);
    }
    return joined.toString();
  }
}
