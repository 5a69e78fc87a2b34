/**
 * Chunk framing model: header line, flush modes, and decoded chunks.
 * <p><strong>Role:</strong> Domain types shared by the record writer and chunk readers.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 * <p><strong>Wire format:</strong> {@code chunked 1.0,<metadata_length>,<body_length>\n} followed by the two blocks.</p>
 */
package ca.gc.cra.chunkio.domain.chunk;
