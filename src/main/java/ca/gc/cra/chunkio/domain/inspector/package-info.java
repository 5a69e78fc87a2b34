/**
 * Inspector model: message severities, named metrics, and the per-chunk accumulator.
 * <p><strong>Role:</strong> Out-of-band diagnostics carried next to record data in every chunk.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.chunkio.domain.inspector.Inspector} is single-threaded; value
 * types are immutable.</p>
 */
package ca.gc.cra.chunkio.domain.inspector;
