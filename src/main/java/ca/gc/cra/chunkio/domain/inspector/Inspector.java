package ca.gc.cra.chunkio.domain.inspector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-chunk accumulator of diagnostic messages and named metrics.
 * <p><strong>Role:</strong> Owned by a record writer; drained into the {@code inspector} object of each chunk.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep messages in arrival order.</li>
 *   <li>Keep one metric per name, the latest write winning.</li>
 *   <li>Render the metadata view with metric keys under the {@value #METRIC_KEY_PREFIX} prefix.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the writer's thread.</p>
 *
 * @since 0.1.0
 */
public final class Inspector {
  /** Key prefix that separates metrics from other inspector entries. */
  public static final String METRIC_KEY_PREFIX = "metric.";

  /** Inspector key holding the message list. */
  public static final String MESSAGES_KEY = "messages";

  private final List<Message> messages = new ArrayList<>();
  private final Map<String, SearchMetric> metrics = new LinkedHashMap<>();

  /**
   * Appends a message.
   *
   * @param severity message severity; must not be {@code null}
   * @param text formatted text; must not be {@code null}
   */
  public void addMessage(Severity severity, String text) {
    messages.add(new Message(severity, text));
  }

  /**
   * Stores or replaces the metric registered under {@code name}.
   *
   * @param name metric name without the key prefix; must not be {@code null}
   * @param metric metric value; must not be {@code null}
   */
  public void putMetric(String name, SearchMetric metric) {
    metrics.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(metric, "metric"));
  }

  /**
   * Returns the accumulated messages.
   *
   * @return unmodifiable message list in arrival order
   */
  public List<Message> messages() {
    return Collections.unmodifiableList(messages);
  }

  /**
   * Returns the accumulated metrics keyed by their plain names.
   *
   * @return unmodifiable metric map in first-registration order
   */
  public Map<String, SearchMetric> metrics() {
    return Collections.unmodifiableMap(metrics);
  }

  /**
   * Indicates whether nothing has been accumulated since the last {@link #clear()}.
   *
   * @return {@code true} when there are no messages and no metrics
   */
  public boolean isEmpty() {
    return messages.isEmpty() && metrics.isEmpty();
  }

  /**
   * Drops every message and metric.
   */
  public void clear() {
    messages.clear();
    metrics.clear();
  }

  /**
   * Renders the {@code inspector} metadata object.
   *
   * <p>Messages appear under {@value #MESSAGES_KEY} as {@code [severity, text]} pairs, followed by one
   * {@code metric.<name>} entry per metric.</p>
   *
   * @return fresh mutable map safe for the caller to encode
   */
  public Map<String, Object> toMetadata() {
    Map<String, Object> view = new LinkedHashMap<>();
    if (!messages.isEmpty()) {
      List<Object> rendered = new ArrayList<>(messages.size());
      for (Message message : messages) {
        rendered.add(List.of(message.severity().wireName(), message.text()));
      }
      view.put(MESSAGES_KEY, rendered);
    }
    for (Map.Entry<String, SearchMetric> entry : metrics.entrySet()) {
      view.put(METRIC_KEY_PREFIX + entry.getKey(), entry.getValue().toList());
    }
    return view;
  }

  /**
   * One inspector message.
   *
   * @param severity message severity
   * @param text formatted message text
   */
  public record Message(Severity severity, String text) {
    /**
     * Validates the message components.
     */
    public Message {
      Objects.requireNonNull(severity, "severity");
      Objects.requireNonNull(text, "text");
    }
  }
}
