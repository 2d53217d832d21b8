package ca.gc.cra.scout.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Metrics export settings resolved from configuration.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint; ignored when the exporter is {@code none}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes, possibly blank
 * @param exportInterval periodic export interval
 */
public record TelemetrySettings(
    String exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  public static final String EXPORTER_OTLP = "otlp";
  public static final String EXPORTER_NONE = "none";
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank()
        ? EXPORTER_NONE
        : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals(EXPORTER_OTLP) && !exporter.equals(EXPORTER_NONE)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    validateEndpoint(endpoint);
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    if (resourceAttributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(
          "otelResourceAttributes must be at most " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
    }
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /** Settings with metrics export disabled. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(EXPORTER_NONE, DEFAULT_ENDPOINT, "", Duration.ofSeconds(30));
  }

  public boolean enabled() {
    return EXPORTER_OTLP.equals(exporter);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
