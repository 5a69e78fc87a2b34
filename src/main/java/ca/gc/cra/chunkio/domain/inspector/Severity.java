package ca.gc.cra.chunkio.domain.inspector;

import java.util.Locale;

/**
 * Severity of an inspector message, written to the host by its lower-case wire name.
 *
 * @since 0.1.0
 */
public enum Severity {
  DEBUG,
  INFO,
  WARN,
  ERROR,
  FATAL;

  /**
   * Returns the name used on the wire.
   *
   * @return lower-case severity name, e.g. {@code "warn"}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a severity from its wire name, ignoring case and surrounding whitespace.
   *
   * @param name severity name such as {@code "debug"} or {@code "ERROR"}
   * @return matching severity
   * @throws IllegalArgumentException if {@code name} is {@code null} or not a known severity
   */
  public static Severity fromWireName(String name) {
    if (name != null) {
      String normalized = name.trim().toUpperCase(Locale.ROOT);
      for (Severity severity : values()) {
        if (severity.name().equals(normalized)) {
          return severity;
        }
      }
    }
    throw new IllegalArgumentException("Unknown message severity: " + name);
  }
}
