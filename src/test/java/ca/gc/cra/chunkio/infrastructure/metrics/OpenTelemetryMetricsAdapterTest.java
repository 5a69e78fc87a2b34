package ca.gc.cra.chunkio.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private SdkMeterProvider provider;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    provider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    adapter = new OpenTelemetryMetricsAdapter(provider.get("ca.gc.cra.chunkio"));
  }

  @AfterEach
  void tearDown() {
    provider.close();
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("chunkio.writer.chunks.flushed");
    adapter.increment("chunkio.writer.chunks.flushed");
    adapter.increment("chunkio.writer.chunks.flushed");

    MetricData counter = find(reader.collectAllMetrics(), "chunkio.writer.chunks.flushed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("chunkio.writer.chunks.flushed",
        point.getAttributes().get(AttributeKey.stringKey("chunkio.metric.key")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("chunkio.writer.chunk.bytes", 100);
    adapter.observe("chunkio.writer.chunk.bytes", 300);

    MetricData histogram = find(reader.collectAllMetrics(), "chunkio.writer.chunk.bytes").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum());
  }

  @Test
  void sanitizesMetricNames() {
    adapter.increment("Recorder Bytes!");

    Optional<MetricData> metric = find(reader.collectAllMetrics(), "recorder_bytes_");
    assertTrue(metric.isPresent());
    assertEquals("m1.count", OpenTelemetryMetricsAdapter.sanitizeName("1.count"));
    assertEquals("chunkio.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noOpAdapterAcceptsEverything() {
    NoOpMetricsAdapter noOp = new NoOpMetricsAdapter();
    noOp.increment("anything");
    noOp.observe("anything", 1);
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
