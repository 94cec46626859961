package dev.ito.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the audit CLI.
 *
 * <p>Exporter selection, highest precedence first: explicit setting from configuration, the
 * {@code otel.metrics.exporter} system property, the {@code OTEL_METRICS_EXPORTER} variable, then
 * {@value #DEFAULT_EXPORTER}. Short-lived CLI runs default to no export.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "dev.ito.audit";
  static final String DEFAULT_EXPORTER = "none";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(String exporterSetting, String endpointSetting) {
    try {
      String exporter = firstNonBlank(
          exporterSetting,
          System.getProperty("otel.metrics.exporter"),
          System.getenv("OTEL_METRICS_EXPORTER"),
          DEFAULT_EXPORTER);
      if (ExporterMode.from(exporter) == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = firstNonBlank(
          endpointSetting,
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(Duration.ofSeconds(30)).build();
      log.info("OpenTelemetry metrics exporting via OTLP to {}", endpoint);
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = detectServiceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        SERVICE_NAME, "ito",
        SERVICE_NAMESPACE, "dev.ito",
        SERVICE_VERSION, version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return null;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown();
      shutdown.join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
