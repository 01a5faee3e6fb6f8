package ca.gc.cra.ingest.application.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.domain.json.JsonScalar;
import ca.gc.cra.ingest.domain.record.DataRecord;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvRecordReaderTest {
  private final CsvRecordReader reader = new CsvRecordReader();

  @Test
  void headerRowNamesTheFields() throws IOException {
    List<DataRecord> rows = reader.read("sku,quantity\nA,3\nB,5\n");

    assertEquals(2, rows.size());
    assertEquals(List.of("sku", "quantity"), List.copyOf(rows.get(0).fieldNames()));
    assertEquals(JsonScalar.of("3"), rows.get(0).get("quantity").orElseThrow());
    assertEquals(JsonScalar.of("B"), rows.get(1).get("sku").orElseThrow());
  }

  @Test
  void emptyCellsBecomeNull() throws IOException {
    List<DataRecord> rows = reader.read("sku,quantity\nA,\n");

    assertEquals(JsonScalar.NULL, rows.get(0).get("quantity").orElseThrow());
  }

  @Test
  void quotedCellsKeepDelimiters() throws IOException {
    List<DataRecord> rows = reader.read("sku,name\nA,\"Widget, large\"\n");

    assertEquals(JsonScalar.of("Widget, large"), rows.get(0).get("name").orElseThrow());
  }

  @Test
  void blankLinesAndSurroundingSpacesAreIgnored() throws IOException {
    List<DataRecord> rows = reader.read("sku,quantity\n\n  A , 3 \n\n");

    assertEquals(1, rows.size());
    assertEquals(JsonScalar.of("A"), rows.get(0).get("sku").orElseThrow());
  }

  @Test
  void blankTextYieldsNoRows() throws IOException {
    assertTrue(reader.read("").isEmpty());
    assertTrue(reader.read(" \n ").isEmpty());
  }

  @Test
  void headerOnlyYieldsNoRows() throws IOException {
    assertTrue(reader.read("sku,quantity\n").isEmpty());
  }
}
