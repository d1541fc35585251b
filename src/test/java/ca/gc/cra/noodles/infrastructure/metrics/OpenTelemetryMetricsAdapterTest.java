package ca.gc.cra.noodles.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private final InMemoryMetricReader reader = InMemoryMetricReader.create();
  private final OpenTelemetryMetricsAdapter adapter =
      new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithMetricKeyAttribute() {
    adapter.increment("ws.client.connected");
    adapter.increment("ws.client.connected");

    MetricData metric = find(reader.collectAllMetrics(), "ws.client.connected");
    LongPointData point = metric.getLongSumData().getPoints().iterator().next();
    assertEquals(2, point.getValue());
    assertEquals(
        Attributes.of(AttributeKey.stringKey("noodles.metric.key"), "ws.client.connected"),
        point.getAttributes());
  }

  @Test
  void observeRecordsHistogramInNanoseconds() {
    adapter.observe("tick.latencyNanos", 1_500L);

    MetricData metric = find(reader.collectAllMetrics(), "tick.latencynanos");
    HistogramPointData point = metric.getHistogramData().getPoints().iterator().next();
    assertEquals("ns", metric.getUnit());
    assertEquals(1, point.getCount());
    assertEquals(1_500.0, point.getSum());
  }

  @Test
  void namesAreSanitized() {
    assertEquals("m1st.metric", OpenTelemetryMetricsAdapter.sanitizeName("1st.metric"));
    assertEquals("bad_name", OpenTelemetryMetricsAdapter.sanitizeName("Bad Name"));
    assertEquals("noodles.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("By", OpenTelemetryMetricsAdapter.unitFor("dispatch.bytes"));
  }

  @Test
  void noopBootstrapAcceptsRecordings() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());

    assertDoesNotThrow(() -> {
      noop.increment("anything");
      noop.observe("anything.Nanos", 1);
      noop.close();
    });
  }

  @Test
  void explicitNoneExporterBuildsNoopMeter() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(" none ", "", "");

    assertTrue(result.isNoop());
    result.close();
  }

  @Test
  void exporterModeDefaultsToOtlp() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" NONE "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(2, OpenTelemetryBootstrap.parseResourceAttributes("a=1,broken,b=2").size());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not found: " + name));
  }
}
