/**
 * Domain utility classes for encoding helpers.
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 */
package ca.gc.cra.chunkio.domain.util;
