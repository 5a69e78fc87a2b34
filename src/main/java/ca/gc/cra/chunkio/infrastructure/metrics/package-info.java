/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.chunkio.application.port.MetricsPort} adapters.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chunkio.infrastructure.metrics;
