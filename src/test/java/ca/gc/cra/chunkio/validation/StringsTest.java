package ca.gc.cra.chunkio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("search", Strings.requireNonBlank("metric name", "  search "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("metric name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("metric name", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("metric name", null));
  }

  @Test
  void requireNameKeepsExactNameAndRejectsSurroundingWhitespace() {
    assertEquals("search.time", Strings.requireName("metric name", "search.time"));
    assertEquals("two words", Strings.requireName("metric name", "two words"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireName("metric name", " m "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireName("metric name", "m\n"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireName("metric name", ""));
  }

  @Test
  void requireDottedIdentifier() {
    assertEquals("chunkio.writer-2", Strings.requireDottedIdentifier("prefix", "chunkio.writer-2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDottedIdentifier("prefix", ".hidden"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDottedIdentifier("prefix", "a/b"));
  }
}
