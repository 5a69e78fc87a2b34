package ca.gc.cra.chunkio.domain.inspector;

import java.util.List;

/**
 * <strong>What:</strong> Named-metric value reported to the host through the chunk inspector.
 * <p><strong>Role:</strong> Domain value stored by the record writer under {@code metric.<name>}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param elapsedSeconds time spent, in seconds; may be any double including non-finite values
 * @param invocationCount number of invocations measured
 * @param inputCount records consumed
 * @param outputCount records produced
 * @since 0.1.0
 */
public record SearchMetric(double elapsedSeconds, long invocationCount, long inputCount, long outputCount) {

  /**
   * Returns the four-element list written into chunk metadata.
   *
   * @return {@code [elapsedSeconds, invocationCount, inputCount, outputCount]}
   */
  public List<Object> toList() {
    return List.of(elapsedSeconds, invocationCount, inputCount, outputCount);
  }

  /**
   * Rebuilds a metric from its decoded metadata form.
   *
   * @param values four numeric elements as produced by {@link #toList()}
   * @return metric carrying the decoded values
   * @throws IllegalArgumentException if {@code values} is not a list of four numbers
   */
  public static SearchMetric fromList(List<?> values) {
    if (values == null || values.size() != 4) {
      throw new IllegalArgumentException("metric must have exactly four elements: " + values);
    }
    for (Object value : values) {
      if (!(value instanceof Number)) {
        throw new IllegalArgumentException("metric elements must be numeric: " + values);
      }
    }
    return new SearchMetric(
        ((Number) values.get(0)).doubleValue(),
        ((Number) values.get(1)).longValue(),
        ((Number) values.get(2)).longValue(),
        ((Number) values.get(3)).longValue());
  }
}
