package ca.gc.cra.chunkio.infrastructure.metrics;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import io.opentelemetry.api.GlobalOpenTelemetry;
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
 * <strong>What:</strong> Metrics adapter that forwards writer and recorder counters and histograms to an
 * OpenTelemetry {@link Meter}.
 * <p><strong>Role:</strong> Infrastructure implementation of {@link MetricsPort}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for concurrent use.</p>
 *
 * @implNote Keys are lower-cased and characters outside {@code [a-z0-9_.-]} become {@code _}; the original key is
 *     attached as the {@code chunkio.metric.key} attribute.
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("chunkio.metric.key");
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.chunkio";
  private static final String FALLBACK_METRIC_NAME = "chunkio.metric";

  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter bound to the globally registered OpenTelemetry instance (a no-op unless an SDK is
   * installed).
   */
  public OpenTelemetryMetricsAdapter() {
    this(GlobalOpenTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  /**
   * Creates an adapter that records through {@code meter}.
   *
   * @param meter OpenTelemetry meter
   */
  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
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

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("chunkio counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("chunkio observation for " + key)
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
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
