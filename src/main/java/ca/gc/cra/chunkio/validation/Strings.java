package ca.gc.cra.chunkio.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for names supplied by commands and configuration files.
 * <p><strong>Role:</strong> Support utilities invoked before writers accept metric names, call sites, or
 * metric prefixes.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Reject names with surrounding whitespace.</li>
 *   <li>Restrict dotted identifiers (metric prefixes) to {@code [A-Za-z0-9._-]}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern DOTTED_IDENTIFIER = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a name is non-blank, control-character free, and carries no surrounding whitespace.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate name; must not be {@code null}
   * @return {@code value} unchanged
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, has control characters, or has surrounding whitespace
   */
  public static String requireName(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!trimmed.equals(value)) {
      throw new IllegalArgumentException(message(name, "must not have leading or trailing whitespace (was '"
          + value + "')"));
    }
    return value;
  }

  /**
   * Validates a dotted identifier such as {@code chunkio.writer}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identifier; must not be {@code null}
   * @return trimmed identifier
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank or uses characters outside {@code [A-Za-z0-9._-]}
   */
  public static String requireDottedIdentifier(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!DOTTED_IDENTIFIER.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name, "must match [A-Za-z0-9._-]+ (was " + trimmed + ")"));
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
