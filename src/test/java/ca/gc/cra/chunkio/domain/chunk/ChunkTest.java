package ca.gc.cra.chunkio.domain.chunk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChunkTest {

  @Test
  void exposesMetadataViews() {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("fieldnames", List.of("a", "b"));
    metadata.put("inspector", Map.of("messages", List.of(List.of("warn", "careful"))));
    metadata.put("finished", true);
    metadata.put("partial", false);
    Chunk chunk = new Chunk(metadata, "a,__mv_a\r\n".getBytes(StandardCharsets.UTF_8));

    assertEquals(List.of("a", "b"), chunk.fieldNames());
    assertTrue(chunk.inspector().containsKey("messages"));
    assertEquals(FlushMode.FINISHED, chunk.flushMode());
    assertEquals("a,__mv_a\r\n", chunk.bodyText());
  }

  @Test
  void missingEntriesYieldEmptyViews() {
    Chunk chunk = new Chunk(Map.of("finished", false, "partial", false), null);

    assertEquals(List.of(), chunk.fieldNames());
    assertEquals(Map.of(), chunk.inspector());
    assertEquals("", chunk.bodyText());
    assertEquals(FlushMode.CONTINUE, chunk.flushMode());
  }

  @Test
  void bodyIsCopied() {
    byte[] body = {'x'};
    Chunk chunk = new Chunk(Map.of(), body);
    body[0] = 'y';
    chunk.body()[0] = 'z';

    assertEquals("x", chunk.bodyText());
  }

  @Test
  void equalityComparesBodyContent() {
    Chunk first = new Chunk(Map.of("finished", true), new byte[] {1, 2});
    Chunk second = new Chunk(Map.of("finished", true), new byte[] {1, 2});

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, new Chunk(Map.of("finished", true), new byte[] {1}));
  }
}
