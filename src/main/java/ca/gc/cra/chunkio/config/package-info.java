/**
 * Writer configuration and the loaders that read it from properties and YAML files.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; loaders are stateless.</p>
 */
package ca.gc.cra.chunkio.config;
