package ca.gc.cra.chunkio.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and writer construction.
 * <p><strong>Role:</strong> Support utilities invoked before writers allocate buffers.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a count is zero or positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate count
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static long requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(label(name) + " must not be negative (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
