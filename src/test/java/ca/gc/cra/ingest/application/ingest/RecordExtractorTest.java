package ca.gc.cra.ingest.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.application.json.JsonSupport;
import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordExtractorTest {
  private final JsonSupport json = new JsonSupport();
  private final RecordExtractor extractor = new RecordExtractor("data");

  @Test
  void objectYieldsDataArray() {
    List<JsonValue> records = extractor.extract(json.parse("{\"data\":[{\"a\":1},{\"a\":2}],\"next\":null}"));

    assertEquals(2, records.size());
  }

  @Test
  void bareArrayYieldsElements() {
    assertEquals(3, extractor.extract(json.parse("[1,2,3]")).size());
  }

  @Test
  void missingOrNonArrayDataFieldYieldsNothing() {
    assertTrue(extractor.extract(json.parse("{\"items\":[{\"a\":1}]}")).isEmpty());
    assertTrue(extractor.extract(json.parse("{\"data\":{\"a\":1}}")).isEmpty());
    assertTrue(extractor.extract(json.parse("{\"data\":\"none\"}")).isEmpty());
  }

  @Test
  void scalarYieldsNothing() {
    assertTrue(extractor.extract(json.parse("42")).isEmpty());
    assertTrue(extractor.extract(json.parse("null")).isEmpty());
  }

  @Test
  void honoursConfiguredField() {
    RecordExtractor custom = new RecordExtractor("results");

    assertEquals(1, custom.extract(json.parse("{\"results\":[{}],\"data\":[{},{}]}")).size());
  }

  @Test
  void rejectsBlankField() {
    assertThrows(IllegalArgumentException.class, () -> new RecordExtractor(" "));
  }
}
