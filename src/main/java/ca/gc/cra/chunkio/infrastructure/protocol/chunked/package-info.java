/**
 * Adapters for the {@code chunked 1.0} protocol: the record writer, its row buffer, and the chunk reader.
 * <p><strong>Role:</strong> Sink-side adapter implementing {@link ca.gc.cra.chunkio.application.port.RecordWriter}.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; each writer or reader exclusively owns its stream.</p>
 * <p><strong>Metrics:</strong> Emits {@code <prefix>.chunks.flushed}, {@code <prefix>.records.committed},
 * {@code <prefix>.chunk.bytes} and {@code <prefix>.flush.latencyNanos}.</p>
 */
package ca.gc.cra.chunkio.infrastructure.protocol.chunked;
