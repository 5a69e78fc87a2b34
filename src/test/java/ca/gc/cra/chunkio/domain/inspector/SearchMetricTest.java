package ca.gc.cra.chunkio.domain.inspector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class SearchMetricTest {

  @Test
  void rebuildsFromDecodedList() {
    SearchMetric metric = SearchMetric.fromList(List.of(0.25, 3L, 100L, 7L));

    assertEquals(new SearchMetric(0.25, 3, 100, 7), metric);
  }

  @Test
  void rejectsWrongShape() {
    assertThrows(IllegalArgumentException.class, () -> SearchMetric.fromList(List.of(1, 2, 3)));
    assertThrows(IllegalArgumentException.class, () -> SearchMetric.fromList(List.of(1, 2, 3, "x")));
  }
}
