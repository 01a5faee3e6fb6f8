package ca.gc.cra.ingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("dataField", "  "));
    assertEquals("dataField must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("dataField", "da\nta"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("dataField", null));
  }

  @Test
  void printableAsciiEnforcesCharsetAndLength() {
    assertEquals("ingest/1.0", Strings.requirePrintableAscii("userAgent", "ingest/1.0", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("userAgent", "café", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("userAgent", "abcdef", 5));
  }

  @Test
  void splitListDropsBlanksAndDuplicates() {
    assertEquals(List.of("sku", "quantity"), List.copyOf(Strings.splitList("f", " sku ,quantity,, sku")));
    assertTrue(Strings.splitList("f", null).isEmpty());
  }
}
