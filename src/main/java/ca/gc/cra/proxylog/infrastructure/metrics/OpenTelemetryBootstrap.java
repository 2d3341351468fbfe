package ca.gc.cra.proxylog.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a PROXYLOG run.
 *
 * <p>Each setting is read from a system property first (the CLI sets them from
 * {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}) and then from
 * the standard {@code OTEL_*} environment variable:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code otlp} or {@code none}</li>
 *   <li>{@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}</li>
 *   <li>{@code otel.resource.attributes} / {@code OTEL_RESOURCE_ATTRIBUTES}</li>
 *   <li>{@code otel.metric.export.interval} / {@code OTEL_METRIC_EXPORT_INTERVAL} in milliseconds</li>
 * </ul>
 *
 * <p>An analysis usually ends before the first periodic export, so the CLI flushes the handle
 * before exiting.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

  static final String SCOPE = "ca.gc.cra.proxylog";
  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";

  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  /**
   * Builds a meter handle from the JVM's system properties and environment.
   *
   * @return active handle, or a no-op handle when export is disabled or setup fails
   */
  static MeterHandle initialize() {
    try {
      Settings settings = Settings.resolve(System::getProperty, System::getenv);
      if (settings.exporter() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics export disabled");
        return MeterHandle.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader =
          PeriodicMetricReader.builder(exporter).setInterval(settings.exportInterval()).build();
      log.info("Exporting PROXYLOG metrics to {} every {} s",
          settings.endpoint(), settings.exportInterval().toSeconds());
      return MeterHandle.active(reader, resource(settings.resourceAttributes()));
    } catch (RuntimeException ex) {
      log.error("OpenTelemetry metrics setup failed; metrics will be dropped", ex);
      return MeterHandle.noop();
    }
  }

  /**
   * Builds an active handle around a caller-supplied reader, such as an in-memory reader.
   *
   * @param reader metric reader to register
   * @return active handle
   */
  static MeterHandle forTesting(MetricReader reader) {
    return MeterHandle.active(Objects.requireNonNull(reader, "reader"), resource(Attributes.empty()));
  }

  static Resource resource(Attributes extra) {
    AttributesBuilder service = Attributes.builder()
        .put(SERVICE_NAME, "proxylog")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, serviceVersion())
        .put(SERVICE_INSTANCE_ID, instanceId());
    return Resource.getDefault()
        .merge(Resource.create(service.build()))
        .merge(Resource.create(extra));
  }

  /**
   * Parses {@code key=value,key=value}; malformed entries are logged and skipped.
   *
   * @param raw attribute list, may be blank
   * @return parsed attributes
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring resource attribute without key=value form: {}", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.1.0-dev" : version;
  }

  private static String instanceId() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable; instance id uses the pid only", ex);
      host = "unknown-host";
    }
    return host + ':' + ProcessHandle.current().pid();
  }

  /**
   * Resolved exporter settings.
   *
   * @param exporter export mode
   * @param endpoint OTLP gRPC endpoint
   * @param exportInterval periodic export interval
   * @param resourceAttributes extra resource attributes
   */
  record Settings(
      ExporterMode exporter, String endpoint, Duration exportInterval, Attributes resourceAttributes) {

    /**
     * Resolves each setting from a property lookup, then an environment lookup, then its default.
     *
     * @param properties system property lookup
     * @param environment environment variable lookup
     * @return resolved settings
     */
    static Settings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      ExporterMode exporter = ExporterMode.from(
          pick(properties, EXPORTER_PROPERTY, environment, "OTEL_METRICS_EXPORTER", "otlp"));
      String endpoint = pick(
          properties, "otel.exporter.otlp.endpoint", environment, "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      String interval = pick(properties, "otel.metric.export.interval", environment,
          "OTEL_METRIC_EXPORT_INTERVAL", Long.toString(DEFAULT_INTERVAL.toMillis()));
      Attributes attributes = parseResourceAttributes(
          pick(properties, "otel.resource.attributes", environment, "OTEL_RESOURCE_ATTRIBUTES", ""));
      return new Settings(exporter, endpoint, interval(interval), attributes);
    }

    private static String pick(
        UnaryOperator<String> properties,
        String property,
        UnaryOperator<String> environment,
        String variable,
        String fallback) {
      String value = properties.apply(property);
      if (value == null || value.isBlank()) {
        value = environment.apply(variable);
      }
      return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Duration interval(String millis) {
      try {
        long value = Long.parseLong(millis);
        if (value > 0) {
          return Duration.ofMillis(value);
        }
      } catch (NumberFormatException ex) {
        log.debug("Non-numeric export interval '{}'", millis, ex);
      }
      log.warn("Ignoring metric export interval '{}'; using {} ms", millis, DEFAULT_INTERVAL.toMillis());
      return DEFAULT_INTERVAL;
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("none")) {
        return NONE;
      }
      if (!normalized.isEmpty() && !normalized.equals("otlp")) {
        log.warn("Unknown metrics exporter '{}'; using otlp", raw);
      }
      return OTLP;
    }
  }

  /**
   * Meter plus the provider that owns it; the provider is absent for the no-op handle.
   */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(SCOPE), null);
    }

    static MeterHandle active(MetricReader reader, Resource resource) {
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource)
          .registerMetricReader(reader)
          .build();
      Meter meter = provider.meterBuilder(SCOPE).setInstrumentationVersion(serviceVersion()).build();
      return new MeterHandle(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      result.join(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {} s", operation, SHUTDOWN_TIMEOUT.toSeconds());
      }
    }
  }
}
