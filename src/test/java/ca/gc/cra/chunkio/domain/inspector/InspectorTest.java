package ca.gc.cra.chunkio.domain.inspector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InspectorTest {

  @Test
  void emptyInspectorRendersEmptyObject() {
    Inspector inspector = new Inspector();

    assertTrue(inspector.isEmpty());
    assertEquals(Map.of(), inspector.toMetadata());
  }

  @Test
  void rendersMessagesBeforeMetrics() {
    Inspector inspector = new Inspector();
    inspector.putMetric("search", new SearchMetric(1.5, 1, 10, 5));
    inspector.addMessage(Severity.INFO, "first");
    inspector.addMessage(Severity.ERROR, "second");

    Map<String, Object> view = inspector.toMetadata();

    assertEquals(List.of("messages", "metric.search"), new ArrayList<>(view.keySet()));
    assertEquals(List.of(List.of("info", "first"), List.of("error", "second")), view.get("messages"));
    assertEquals(List.of(1.5, 1L, 10L, 5L), view.get("metric.search"));
  }

  @Test
  void latestMetricWins() {
    Inspector inspector = new Inspector();
    inspector.putMetric("m", new SearchMetric(1, 1, 1, 1));
    inspector.putMetric("m", new SearchMetric(2, 2, 2, 2));

    assertEquals(1, inspector.metrics().size());
    assertEquals(new SearchMetric(2, 2, 2, 2), inspector.metrics().get("m"));
  }

  @Test
  void clearDropsEverything() {
    Inspector inspector = new Inspector();
    inspector.addMessage(Severity.WARN, "w");
    inspector.putMetric("m", new SearchMetric(0, 0, 0, 0));

    inspector.clear();

    assertTrue(inspector.isEmpty());
    assertTrue(inspector.messages().isEmpty());
  }
}
