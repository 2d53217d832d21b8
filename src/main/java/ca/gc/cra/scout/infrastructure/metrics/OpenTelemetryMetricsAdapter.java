package ca.gc.cra.scout.infrastructure.metrics;

import ca.gc.cra.scout.application.port.MetricsPort;
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
 * Metrics adapter that forwards scout counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily on first use and cached by key. Closing the adapter flushes
 * and shuts down the meter provider, which matters for a CLI process that exits right after the
 * session closes.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("scout.metric.key");
  private static final String FALLBACK_METRIC_NAME = "scout.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given export settings.
   *
   * @param settings exporter selection and endpoint
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("scout counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    LongHistogram histogram = meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("scout observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
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
      if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
        result.append(c);
      } else {
        result.append('_');
      }
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
