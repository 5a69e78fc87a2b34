package ca.gc.cra.chunkio.infrastructure.protocol.chunked;

import ca.gc.cra.chunkio.domain.util.Utf8;
import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import java.io.ByteArrayOutputStream;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Buffers serialized rows for the body of the next chunk and renders them as CSV.
 *
 * <p>Every field {@code f} occupies two columns, {@code f} and {@code __mv_f}. The second column only carries
 * data for multi-valued fields. Rows are stored as cells at write time and padded to the final field list when
 * the body is rendered, so fields first seen halfway through a chunk leave earlier rows short but valid.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class RowBuffer {
  static final String MULTI_VALUE_PREFIX = "__mv_";
  private static final byte[] CRLF = {'\r', '\n'};

  private final MetadataCodec codec;
  private final List<String[]> rows = new ArrayList<>();

  RowBuffer(MetadataCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Serializes {@code record} following {@code fieldNames}; fields absent from the record become empty cells.
   *
   * @param fieldNames negotiated field order, already including every key of {@code record}
   * @param record record to serialize
   * @throws IllegalArgumentException if a byte value is not valid UTF-8 or a nested value cannot be encoded
   */
  void append(List<String> fieldNames, Map<String, ?> record) {
    String[] cells = new String[fieldNames.size() * 2];
    for (int i = 0; i < fieldNames.size(); i++) {
      String name = fieldNames.get(i);
      if (!record.containsKey(name)) {
        continue;
      }
      encodeField(record.get(name), cells, i * 2);
    }
    rows.add(cells);
  }

  int size() {
    return rows.size();
  }

  void clear() {
    rows.clear();
  }

  /**
   * Renders the header row and every buffered row as UTF-8 CSV.
   *
   * @param fieldNames final field order for the chunk
   * @return body bytes; empty when no rows are buffered
   */
  byte[] render(List<String> fieldNames) {
    if (rows.isEmpty()) {
      return new byte[0];
    }
    int width = fieldNames.size() * 2;
    ByteArrayOutputStream out = new ByteArrayOutputStream(256 + rows.size() * 64);
    String[] header = new String[width];
    for (int i = 0; i < fieldNames.size(); i++) {
      header[i * 2] = fieldNames.get(i);
      header[i * 2 + 1] = MULTI_VALUE_PREFIX + fieldNames.get(i);
    }
    writeLine(out, header);
    for (String[] row : rows) {
      writeLine(out, row.length == width ? row : Arrays.copyOf(row, width));
    }
    return out.toByteArray();
  }

  private void encodeField(Object value, String[] cells, int index) {
    if (value == null) {
      return;
    }
    List<Object> values = asList(value);
    if (values == null) {
      cells[index] = scalarText(value);
      return;
    }
    if (values.isEmpty()) {
      return;
    }
    if (values.size() == 1) {
      encodeField(values.get(0), cells, index);
      return;
    }
    StringBuilder single = new StringBuilder();
    StringBuilder multi = new StringBuilder("$");
    for (int i = 0; i < values.size(); i++) {
      Object item = values.get(i);
      String text = item == null ? "" : scalarText(item);
      if (i > 0) {
        single.append('\n');
        multi.append(";$");
      }
      single.append(text);
      multi.append(text.replace("$", "$$")).append('$');
    }
    cells[index] = single.toString();
    cells[index + 1] = multi.toString();
  }

  private String scalarText(Object value) {
    if (value instanceof Boolean flag) {
      return flag ? "1" : "0";
    }
    if (value instanceof Number number) {
      return MetadataCodec.numberText(number);
    }
    if (value instanceof CharSequence text) {
      return text.toString();
    }
    if (value instanceof byte[] bytes) {
      return Utf8.decodeStrict(bytes);
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?> || value.getClass().isArray()) {
      return codec.encode(value);
    }
    return String.valueOf(value);
  }

  private static List<Object> asList(Object value) {
    if (value instanceof List<?> list) {
      return new ArrayList<>(list);
    }
    if (value instanceof Iterable<?> iterable) {
      List<Object> copy = new ArrayList<>();
      iterable.forEach(copy::add);
      return copy;
    }
    if (value.getClass().isArray() && !(value instanceof byte[])) {
      int length = Array.getLength(value);
      List<Object> copy = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        copy.add(Array.get(value, i));
      }
      return copy;
    }
    return null;
  }

  private static void writeLine(ByteArrayOutputStream out, String[] cells) {
    for (int i = 0; i < cells.length; i++) {
      if (i > 0) {
        out.write(',');
      }
      String cell = cells[i];
      if (cell != null && !cell.isEmpty()) {
        out.writeBytes(quote(cell).getBytes(StandardCharsets.UTF_8));
      }
    }
    out.writeBytes(CRLF);
  }

  private static String quote(String cell) {
    boolean needsQuotes = false;
    for (int i = 0; i < cell.length(); i++) {
      char c = cell.charAt(i);
      if (c == ',' || c == '"' || c == '\r' || c == '\n') {
        needsQuotes = true;
        break;
      }
    }
    if (!needsQuotes) {
      return cell;
    }
    return '"' + cell.replace("\"", "\"\"") + '"';
  }
}
