package ca.gc.cra.proxylog.api;

import ca.gc.cra.proxylog.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands the telemetry keys of the effective configuration to the OpenTelemetry bootstrap, which
 * reads them back as system properties.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /** Configuration key and the system property it is copied to. */
  private enum TelemetryKey {
    EXPORTER("metricsExporter", "otel.metrics.exporter"),
    ENDPOINT("otelEndpoint", "otel.exporter.otlp.endpoint"),
    RESOURCE_ATTRIBUTES("otelResourceAttributes", "otel.resource.attributes");

    private final String configKey;
    private final String property;

    TelemetryKey(String configKey, String property) {
      this.configKey = configKey;
      this.property = property;
    }
  }

  private TelemetryConfigurator() {}

  /**
   * Validates and applies {@code metricsExporter}, {@code otelEndpoint} and
   * {@code otelResourceAttributes}, removing them from {@code config}.
   *
   * @param config mutable effective configuration
   * @return {@code false} only when {@code metricsExporter=none}
   * @throws IllegalArgumentException for an unknown exporter, a malformed endpoint or non-ASCII
   *     resource attributes
   */
  static boolean configureMetrics(Map<String, String> config) {
    String exporter = take(config, TelemetryKey.EXPORTER);
    String endpoint = take(config, TelemetryKey.ENDPOINT);
    String attributes = take(config, TelemetryKey.RESOURCE_ATTRIBUTES);

    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + exporter + "')");
      }
    }
    if (endpoint != null) {
      requireHttpEndpoint(endpoint);
    }
    if (attributes != null) {
      Strings.requirePrintableAscii(
          TelemetryKey.RESOURCE_ATTRIBUTES.configKey, attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    apply(TelemetryKey.EXPORTER, exporter);
    apply(TelemetryKey.ENDPOINT, endpoint);
    apply(TelemetryKey.RESOURCE_ATTRIBUTES, attributes);
    return !"none".equals(exporter);
  }

  private static String take(Map<String, String> config, TelemetryKey key) {
    String value = config == null ? null : config.remove(key.configKey);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static void apply(TelemetryKey key, String value) {
    if (value != null) {
      log.debug("Setting {} from {}", key.property, key.configKey);
      System.setProperty(key.property, value);
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI (was '" + raw + "')", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("otelEndpoint must use http or https (was '" + raw + "')");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host (was '" + raw + "')");
    }
  }
}
