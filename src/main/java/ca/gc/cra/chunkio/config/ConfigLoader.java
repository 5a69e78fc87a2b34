package ca.gc.cra.chunkio.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link WriterConfig} instances from properties or YAML files.
 * <p><strong>Role:</strong> Configuration helper for hosts embedding the writer.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * Reads optional configuration properties from the given path.
   *
   * @param path properties file path; may be {@code null} or non-existent to use defaults
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value fails validation
   */
  public static WriterConfig fromProperties(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      log.debug("No writer properties at {}; using defaults", path);
      return WriterConfig.defaults();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      values.put(name, props.getProperty(name));
    }
    return WriterConfig.fromMap(values);
  }

  /**
   * Reads the {@code common} section and the {@code profile} section of a YAML file.
   *
   * @param path YAML file path; a missing file yields defaults
   * @param profile profile section name, matched case-insensitively
   * @return merged configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or a value fails validation
   */
  public static WriterConfig fromYaml(Path path, String profile) throws IOException {
    return YamlConfigLoader.load(path, profile)
        .map(WriterConfig::fromMap)
        .orElseGet(() -> {
          log.debug("No writer YAML at {}; using defaults", path);
          return WriterConfig.defaults();
        });
  }
}
