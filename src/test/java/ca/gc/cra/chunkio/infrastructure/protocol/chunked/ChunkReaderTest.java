package ca.gc.cra.chunkio.infrastructure.protocol.chunked;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chunkio.domain.chunk.Chunk;
import ca.gc.cra.chunkio.domain.chunk.FlushMode;
import ca.gc.cra.chunkio.infrastructure.codec.MetadataDecodeException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkReaderTest {

  @Test
  void readsConsecutiveChunks() throws IOException {
    String first = "{\"fieldnames\":[\"x\"],\"inspector\":{},\"finished\":false,\"partial\":false}";
    String body = "x,__mv_x\r\n1,\r\n";
    String second = "{\"inspector\":{},\"finished\":true,\"partial\":false}";
    String wire = "chunked 1.0," + first.length() + "," + body.length() + "\n" + first + body
        + "chunked 1.0," + second.length() + ",0\n" + second;
    ChunkReader reader = reader(wire);

    Chunk one = reader.next().orElseThrow();
    Chunk two = reader.next().orElseThrow();

    assertEquals(List.of("x"), one.fieldNames());
    assertEquals(body, one.bodyText());
    assertEquals(FlushMode.CONTINUE, one.flushMode());
    assertEquals(FlushMode.FINISHED, two.flushMode());
    assertTrue(reader.next().isEmpty());
    assertEquals(2, reader.chunksRead());
  }

  @Test
  void emptyStreamHasNoChunks() throws IOException {
    assertTrue(reader("").next().isEmpty());
  }

  @Test
  void rejectsMalformedHeader() {
    assertThrows(ChunkFormatException.class, () -> reader("chunked 2.0,2,0\n{}").next());
    assertThrows(ChunkFormatException.class, () -> reader("chunked 1.0,2").next());
  }

  @Test
  void rejectsOverlongHeader() {
    String header = "chunked 1.0," + "1".repeat(80) + "\n";

    assertThrows(ChunkFormatException.class, () -> reader(header).next());
  }

  @Test
  void rejectsTruncatedBlocks() {
    assertThrows(ChunkFormatException.class, () -> reader("chunked 1.0,10,0\n{}").next());
    assertThrows(ChunkFormatException.class, () -> reader("chunked 1.0,2,5\n{}ab").next());
  }

  @Test
  void rejectsInvalidMetadata() {
    assertThrows(MetadataDecodeException.class, () -> reader("chunked 1.0,2,0\n{]").next());
  }

  private static ChunkReader reader(String wire) {
    return new ChunkReader(new ByteArrayInputStream(wire.getBytes(StandardCharsets.UTF_8)));
  }
}
