package ca.gc.cra.scout.infrastructure.metrics;

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
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a scout run.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.scout";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.debug("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader =
          PeriodicMetricReader.builder(exporter).setInterval(settings.exportInterval()).build();
      BootstrapResult result = build(reader, parseResourceAttributes(settings.resourceAttributes()));
      log.info("OpenTelemetry metrics exporting to {}", settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraAttributes) {
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, extraAttributes))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "scout")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    Resource base = Resource.create(builder.build());
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(base).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed otelResourceAttributes entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to runtime MXBean for instance id", ex);
      String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
      return runtimeName != null ? runtimeName : "unknown";
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/scout/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
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
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
