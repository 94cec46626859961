package dev.ito.infrastructure.metrics;

import dev.ito.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards audit counters and observations to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached. Closing flushes and shuts down the provider.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("ito.metric.key");
  private static final String FALLBACK_METRIC_NAME = "ito.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the configured exporter.
   *
   * @param exporter {@code none} or {@code otlp}; blank falls back to system properties and environment
   * @param endpoint OTLP endpoint; blank falls back to system properties and environment
   */
  public OpenTelemetryMetricsAdapter(String exporter, String endpoint) {
    this(OpenTelemetryBootstrap.initialize(exporter, endpoint));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Whether metrics are actually exported.
   *
   * @return {@code false} when the exporter is disabled
   */
  public boolean isActive() {
    return !bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Counter createCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("ito audit counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("ito audit observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
