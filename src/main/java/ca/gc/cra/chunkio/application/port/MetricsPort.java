package ca.gc.cra.chunkio.application.port;

/**
 * <strong>What:</strong> Port abstracting operational metrics emitted by writers and recorders.
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}; distinct from the
 * {@code SearchMetric} values that travel to the host inside chunk metadata.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like flushed chunks.</li>
 *   <li>Record numeric observations for latencies and byte counts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code chunkio.writer.chunks.flushed}); must not be
   *     {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
