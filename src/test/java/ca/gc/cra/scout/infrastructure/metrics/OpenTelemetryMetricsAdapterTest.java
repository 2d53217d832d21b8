package ca.gc.cra.scout.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("aggregator.events");
    adapter.increment("aggregator.events");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "aggregator.events").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("aggregator.events", point.getAttributes().get(AttributeKey.stringKey("scout.metric.key")));
    assertEquals("scout", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("session.duration.millis", 1_200L);
    adapter.observe("session.duration.millis", 800L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "session.duration.millis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(2_000.0, point.getSum(), 0.001);
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("session.started", OpenTelemetryMetricsAdapter.sanitizeName("session.started"));
    assertEquals("watch._logs.txt.events", OpenTelemetryMetricsAdapter.sanitizeName("watch./logs.txt.events"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.sanitizeName("1st"));
    assertEquals("scout.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void disabledExporterFallsBackToNoop() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled());
    try {
      assertTrue(noop.isNoop());
      noop.increment("session.started");
    } finally {
      noop.close();
    }
  }

  @Test
  void settingsRejectUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings("prometheus", null, "", Duration.ofSeconds(30)));
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings("otlp", "ftp://collector:4317", "", Duration.ofSeconds(30)));
    assertEquals(TelemetrySettings.EXPORTER_NONE,
        new TelemetrySettings(" ", null, null, Duration.ofSeconds(30)).exporter());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
