package ca.gc.cra.ingest.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.domain.json.JsonScalar;
import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatasetTest {

  @Test
  void columnsAreUnionInFirstSeenOrder() {
    Dataset dataset = Dataset.builder()
        .add(record("sku", JsonScalar.of("A"), "quantity", JsonScalar.of(1)))
        .add(record("warehouse", JsonScalar.of("east"), "sku", JsonScalar.of("B")))
        .build();

    assertEquals(List.of("sku", "quantity", "warehouse"), dataset.columns());
    assertEquals(2, dataset.size());
    assertTrue(dataset.cell(1, "quantity").isEmpty());
  }

  @Test
  void rowMapsFillMissingColumnsWithNull() {
    Dataset dataset = Dataset.builder()
        .add(record("sku", JsonScalar.of("A"), "quantity", JsonScalar.of(1)))
        .add(record("sku", JsonScalar.of("B"), "note", JsonScalar.NULL))
        .build();

    List<Map<String, Object>> rows = dataset.toRowMaps();

    assertEquals(1, rows.get(0).get("quantity"));
    assertNull(rows.get(0).get("note"));
    assertNull(rows.get(1).get("quantity"));
    assertTrue(rows.get(1).containsKey("note"));
  }

  @Test
  void emptyBuilderYieldsSharedEmptyDataset() {
    assertSame(Dataset.empty(), Dataset.builder().build());
    assertTrue(Dataset.empty().columns().isEmpty());
  }

  @Test
  void builtDatasetIsImmutable() {
    Dataset dataset = Dataset.builder().add(record("sku", JsonScalar.of("A"), "quantity", JsonScalar.of(1))).build();

    assertThrows(UnsupportedOperationException.class, () -> dataset.rows().clear());
    assertThrows(UnsupportedOperationException.class, () -> dataset.rows().get(0).fields().clear());
  }

  private static DataRecord record(String k1, JsonValue v1, String k2, JsonValue v2) {
    Map<String, JsonValue> fields = new LinkedHashMap<>();
    fields.put(k1, v1);
    fields.put(k2, v2);
    return new DataRecord(fields);
  }
}
