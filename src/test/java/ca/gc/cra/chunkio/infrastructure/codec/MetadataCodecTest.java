package ca.gc.cra.chunkio.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chunkio.domain.inspector.SearchMetric;
import ca.gc.cra.chunkio.domain.inspector.Severity;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetadataCodecTest {
  private final MetadataCodec codec = new MetadataCodec();

  @Test
  void encodesNonFiniteDoublesAsBareTokens() {
    List<Object> values = Arrays.asList(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);

    assertEquals("[NaN,Infinity,-Infinity]", codec.encode(values));
  }

  @Test
  void decodesNonFiniteTokens() {
    List<?> decoded = (List<?>) codec.decode("[NaN, Infinity, -Infinity, 1.5]");

    assertTrue(Double.isNaN((Double) decoded.get(0)));
    assertEquals(Double.POSITIVE_INFINITY, decoded.get(1));
    assertEquals(Double.NEGATIVE_INFINITY, decoded.get(2));
    assertEquals(1.5, decoded.get(3));
  }

  @Test
  void roundTripsNestedStructuresPreservingKeyOrder() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("z", List.of(1L, "two", 3.25));
    inner.put("a", Map.of());
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("nan", Double.NaN);
    value.put("empty", "");
    value.put("nested", inner);
    value.put("flag", true);
    value.put("none", null);

    Map<String, Object> decoded = codec.decodeObject(codec.encodeToBytes(value));

    assertEquals(List.of("nan", "empty", "nested", "flag", "none"), new ArrayList<>(decoded.keySet()));
    assertTrue(Double.isNaN((Double) decoded.get("nan")));
    assertEquals("", decoded.get("empty"));
    assertEquals(inner, decoded.get("nested"));
    assertEquals(Boolean.TRUE, decoded.get("flag"));
    assertTrue(decoded.containsKey("none"));
  }

  @Test
  void producesCompactOutput() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("a", 1);
    nested.put("b", 2);
    nested.put("c", Map.of("d", 3));

    assertEquals("{\"a\":1,\"b\":2,\"c\":{\"d\":3}}", codec.encode(nested));
  }

  @Test
  void reencodesDecodedCompactJsonVerbatim() {
    String flat = "{\"a\":1,\"b\":2,\"c\":{\"d\":3}}";
    String nested = "{\"a\":1,\"b\":2,\"c\":{\"d\":3,\"e\":4,\"f\":{\"g\":5,\"h\":6,\"i\":7},"
        + "\"j\":8,\"k\":9},\"l\":10,\"m\":11,\"n\":12}";

    assertEquals(flat, codec.encode(codec.decode(flat)));
    assertEquals(nested, codec.encode(codec.decode(nested)));
  }

  @Test
  void nonFiniteAndExtremeDoublesSurviveEncodeThenDecode() {
    List<Object> values = Arrays.asList(
        Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 1.0E300, -0.0, Double.MIN_VALUE);

    assertEquals(values, codec.decode(codec.encode(values)));
  }

  @Test
  void decodesIntegersAsLongAndHugeIntegersAsBigInteger() {
    List<?> decoded = (List<?>) codec.decode("[7, 123456789012345678901234567890]");

    assertEquals(7L, decoded.get(0));
    assertInstanceOf(BigInteger.class, decoded.get(1));
  }

  @Test
  void encodesDomainValues() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("metric", new SearchMetric(0.5, 1, 2, 3));
    value.put("severity", Severity.WARN);
    value.put("bytes", "héllo".getBytes(StandardCharsets.UTF_8));
    value.put("ints", new int[] {1, 2});

    assertEquals("{\"metric\":[0.5,1,2,3],\"severity\":\"warn\",\"bytes\":\"héllo\",\"ints\":[1,2]}",
        codec.encode(value));
  }

  @Test
  void rejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> codec.encode(Map.of("thread", new Object())));
  }

  @Test
  void rejectsInvalidUtf8Bytes() {
    byte[] invalid = {(byte) 0xC3, (byte) 0x28};

    assertThrows(IllegalArgumentException.class, () -> codec.encode(invalid));
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(MetadataDecodeException.class, () -> codec.decode("{\"a\":"));
    assertThrows(MetadataDecodeException.class, () -> codec.decode("{\"a\" 1}"));
    assertThrows(MetadataDecodeException.class, () -> codec.decode(""));
    assertThrows(MetadataDecodeException.class, () -> codec.decode("{} {}"));
    assertThrows(MetadataDecodeException.class, () -> codec.decode("[1, 2"));
  }

  @Test
  void decodeObjectRequiresObjectRoot() {
    byte[] array = "[1]".getBytes(StandardCharsets.UTF_8);

    assertThrows(MetadataDecodeException.class, () -> codec.decodeObject(array));
  }

  @Test
  void encodeToStreamLeavesStreamOpen() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.encode(List.of("a"), out);
    out.write('!');

    assertArrayEquals("[\"a\"]!".getBytes(StandardCharsets.UTF_8), out.toByteArray());
  }

  @Test
  void numberTextMatchesJsonRendering() {
    assertEquals("NaN", MetadataCodec.numberText(Double.NaN));
    assertEquals("-Infinity", MetadataCodec.numberText(Double.NEGATIVE_INFINITY));
    assertEquals("42", MetadataCodec.numberText(42));
    assertEquals("0.25", MetadataCodec.numberText(0.25f));
  }
}
