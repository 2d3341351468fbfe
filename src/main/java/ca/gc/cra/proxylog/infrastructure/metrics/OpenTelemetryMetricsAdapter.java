package ca.gc.cra.proxylog.infrastructure.metrics;

import ca.gc.cra.proxylog.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards PROXYLOG scan counters and durations to OpenTelemetry.
 *
 * <p>Instruments are created on first use of a key. Instrument names are lower-cased and limited
 * to letters, digits, {@code . _ -}; when that changes the key, the key itself travels as the
 * {@code proxylog.metric.key} attribute. Keys ending in {@code Millis} become histograms with unit
 * {@code ms}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("proxylog.metric.key");

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting through the environment-configured OpenTelemetry pipeline.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    if (handle.isNoop()) {
      log.debug("OpenTelemetry metrics adapter created without an exporter");
    }
  }

  @Override
  public void increment(String key) {
    add(key, 1);
  }

  @Override
  public void add(String key, long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("counter delta must be non-negative (was " + delta + ")");
    }
    Instrument<LongCounter> counter = counters.computeIfAbsent(requireKey(key), this::counter);
    counter.instrument().add(delta, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(requireKey(key), this::histogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending data points to the exporter; called once a scan finishes. */
  public void forceFlush() {
    handle.flush();
  }

  @Override
  public void close() {
    handle.close();
  }

  private Instrument<LongCounter> counter(String key) {
    String name = instrumentName(key);
    LongCounter counter = handle.meter()
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("PROXYLOG " + key)
        .build();
    return new Instrument<>(counter, attributes(key, name));
  }

  private Instrument<LongHistogram> histogram(String key) {
    String name = instrumentName(key);
    LongHistogram histogram = handle.meter()
        .histogramBuilder(name)
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("PROXYLOG " + key)
        .build();
    return new Instrument<>(histogram, attributes(key, name));
  }

  private static String requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("metric key must not be blank");
    }
    return key;
  }

  private static Attributes attributes(String key, String name) {
    return name.equals(key) ? Attributes.empty() : Attributes.of(METRIC_KEY, key);
  }

  // OTel instrument names must start with a letter.
  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (lower.isEmpty() || !Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
      name.append(allowed ? c : '_');
    }
    return name.toString();
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
