/**
 * Metadata codec built on the Jackson streaming API.
 * <p><strong>Role:</strong> Adapter that turns chunk metadata graphs into JSON text and back.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec} is immutable and
 * thread-safe.</p>
 * <p><strong>Format:</strong> Compact JSON plus bare {@code NaN}, {@code Infinity} and {@code -Infinity} tokens.</p>
 */
package ca.gc.cra.chunkio.infrastructure.codec;
