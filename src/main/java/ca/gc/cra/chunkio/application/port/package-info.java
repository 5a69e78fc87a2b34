/**
 * <strong>Purpose:</strong> Ports defining how commands emit records and operational metrics.
 * <p><strong>Role:</strong> Application layer; adapters in {@code ca.gc.cra.chunkio.infrastructure} implement
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Record writers are single-threaded; metrics ports must be thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.chunkio.application.port;
