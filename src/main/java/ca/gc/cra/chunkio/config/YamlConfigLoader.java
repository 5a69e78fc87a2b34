package ca.gc.cra.chunkio.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads writer settings from a profile-structured YAML document.
 *
 * <p>The document root holds a {@code common} section plus one section per profile. Each section nests the
 * setting keys of {@link WriterConfig#KEYS}:</p>
 * <pre>
 * common:
 *   maxResultRows: 50000
 *   recording:
 *     directory: /var/tmp/chunkio
 * test:
 *   recording:
 *     enabled: true
 * </pre>
 * <p>Profile values win over {@code common}. Unknown settings are rejected so a misspelt key cannot silently
 * fall back to its default.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Returns the settings of {@code profile} layered over {@code common}, keyed as {@link WriterConfig#fromMap}
   * expects.
   *
   * @param path YAML document
   * @param profile profile section, matched case-insensitively
   * @return settings, or empty when {@code path} does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or names an unknown setting
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(profile, "profile").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed writer YAML at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> sections)) {
      throw new IllegalArgumentException("Writer YAML at " + path + " must map profile names to sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    Object common = null;
    Object selected = null;
    for (Map.Entry<?, ?> section : sections.entrySet()) {
      String name = String.valueOf(section.getKey()).trim().toLowerCase(Locale.ROOT);
      if (name.equals(COMMON_SECTION)) {
        common = section.getValue();
      } else if (name.equals(wanted)) {
        selected = section.getValue();
      }
    }
    collectSettings(common, "", settings);
    collectSettings(selected, "", settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static void collectSettings(Object node, String key, Map<String, String> settings) {
    if (node == null) {
      return;
    }
    if (node instanceof Map<?, ?> children) {
      for (Map.Entry<?, ?> child : children.entrySet()) {
        String segment = String.valueOf(child.getKey()).trim();
        if (segment.isEmpty()) {
          throw new IllegalArgumentException("Blank writer setting name under '" + key + "'");
        }
        collectSettings(child.getValue(), key.isEmpty() ? segment : key + '.' + segment, settings);
      }
      return;
    }
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Writer YAML sections must be mappings");
    }
    if (!WriterConfig.KEYS.contains(key)) {
      throw new IllegalArgumentException("Unknown writer setting '" + key + "'; expected one of "
          + WriterConfig.KEYS);
    }
    if (node instanceof Iterable<?>) {
      throw new IllegalArgumentException("Writer setting '" + key + "' must be a scalar");
    }
    settings.put(key, node.toString());
  }
}
