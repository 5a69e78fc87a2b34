package ca.gc.cra.chunkio.infrastructure.codec;

import ca.gc.cra.chunkio.domain.inspector.SearchMetric;
import ca.gc.cra.chunkio.domain.inspector.Severity;
import ca.gc.cra.chunkio.domain.util.Utf8;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON codec for chunk metadata that also round-trips {@code NaN}, {@code Infinity} and {@code -Infinity}.
 *
 * <p>Non-finite doubles are written as the bare tokens {@code NaN}, {@code Infinity} and {@code -Infinity};
 * everything else is compact standard JSON. Map key order is kept on both sides. Decoded objects are
 * {@link LinkedHashMap}, arrays are {@link ArrayList}, integers are {@link Long} (or {@link BigInteger} when
 * out of range) and fractional numbers are {@link Double}.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MetadataCodec {
  private final JsonFactory factory = JsonFactory.builder()
      .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
      .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
      .build();

  /**
   * Encodes a value as compact JSON text.
   *
   * @param value value drawn from the record data model; may be {@code null}
   * @return JSON text
   * @throws IllegalArgumentException if the value graph contains an unsupported type
   */
  public String encode(Object value) {
    StringWriter writer = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(writer)) {
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode metadata", ex);
    }
    return writer.toString();
  }

  /**
   * Encodes a value as UTF-8 JSON bytes.
   *
   * @param value value drawn from the record data model; may be {@code null}
   * @return UTF-8 encoded JSON
   * @throws IllegalArgumentException if the value graph contains an unsupported type
   */
  public byte[] encodeToBytes(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      encode(value, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode metadata", ex);
    }
    return out.toByteArray();
  }

  /**
   * Encodes a value as UTF-8 JSON onto {@code out}. The stream is flushed but not closed.
   *
   * @param value value drawn from the record data model; may be {@code null}
   * @param out destination stream; must not be {@code null}
   * @throws IOException if writing to {@code out} fails
   */
  public void encode(Object value, OutputStream out) throws IOException {
    Objects.requireNonNull(out, "out");
    try (JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      writeValue(generator, value);
    }
  }

  /**
   * Decodes JSON text.
   *
   * @param json JSON text; must not be {@code null}
   * @return decoded value graph
   * @throws MetadataDecodeException if the text is empty, malformed, truncated or has trailing content
   */
  public Object decode(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new MetadataDecodeException("Invalid metadata JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Decodes UTF-8 JSON bytes.
   *
   * @param json UTF-8 encoded JSON; must not be {@code null}
   * @return decoded value graph
   * @throws MetadataDecodeException if the bytes are empty, malformed, truncated or have trailing content
   */
  public Object decode(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new MetadataDecodeException("Invalid metadata JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Decodes JSON text that must hold an object.
   *
   * @param json JSON text; must not be {@code null}
   * @return decoded object with key order preserved
   * @throws MetadataDecodeException if the text is invalid or its root is not an object
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> decodeObject(byte[] json) {
    Object value = decode(json);
    if (!(value instanceof Map<?, ?>)) {
      throw new MetadataDecodeException(
          "Metadata root must be a JSON object but was " + (value == null ? "null" : value.getClass().getSimpleName()));
    }
    return (Map<String, Object>) value;
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      throw new MetadataDecodeException("Metadata JSON is empty");
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new MetadataDecodeException("Metadata JSON contains trailing content: " + trailing);
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new MetadataDecodeException("Metadata JSON is truncated");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
          ? parser.getBigIntegerValue()
          : Long.valueOf(parser.getLongValue());
      case VALUE_NUMBER_FLOAT -> Double.valueOf(parser.getDoubleValue());
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new MetadataDecodeException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new MetadataDecodeException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof CharSequence text) {
      generator.writeString(text.toString());
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Number number) {
      writeNumber(generator, number);
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof byte[] bytes) {
      generator.writeString(Utf8.decodeStrict(bytes));
    } else if (value.getClass().isArray()) {
      generator.writeStartArray();
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        writeValue(generator, Array.get(value, i));
      }
      generator.writeEndArray();
    } else if (value instanceof SearchMetric metric) {
      writeValue(generator, metric.toList());
    } else if (value instanceof Severity severity) {
      generator.writeString(severity.wireName());
    } else if (value instanceof Enum<?> constant) {
      generator.writeString(constant.name());
    } else {
      throw new IllegalArgumentException("Unsupported metadata value type: " + value.getClass().getName());
    }
  }

  private static void writeNumber(JsonGenerator generator, Number number) throws IOException {
    if (number instanceof Double || number instanceof Float) {
      generator.writeNumber(number.doubleValue());
    } else if (number instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (number instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (number instanceof Long || number instanceof Integer
        || number instanceof Short || number instanceof Byte) {
      generator.writeNumber(number.longValue());
    } else {
      generator.writeNumber(number.doubleValue());
    }
  }

  /**
   * Renders a number the way {@link #encode(Object)} writes it, used for text cells outside JSON.
   *
   * @param number number to render; must not be {@code null}
   * @return textual form, {@code NaN}/{@code Infinity}/{@code -Infinity} for non-finite values
   */
  public static String numberText(Number number) {
    if (number instanceof Float f) {
      return Double.toString(f.doubleValue());
    }
    if (number instanceof BigDecimal decimal) {
      return decimal.toString();
    }
    return String.valueOf(number);
  }
}
