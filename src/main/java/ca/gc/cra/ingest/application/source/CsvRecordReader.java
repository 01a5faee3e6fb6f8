package ca.gc.cra.ingest.application.source;

import ca.gc.cra.ingest.domain.json.JsonScalar;
import ca.gc.cra.ingest.domain.json.JsonValue;
import ca.gc.cra.ingest.domain.record.DataRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Parses CSV text with a header row into records.
 * <p><strong>Why:</strong> The local and object-store sources share one parsing path so a file produces the same rows
 * wherever it is stored.</p>
 * <p><strong>Responsibilities:</strong> header names become field names in header order; cells stay text; empty cells
 * become JSON {@code null}; a header-only file yields no rows.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the underlying {@link ObjectReader} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CsvRecordReader {
  private final ObjectReader reader;

  /**
   * Creates a reader for comma-separated input with a header row.
   */
  public CsvRecordReader() {
    CsvMapper mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    this.reader = mapper.readerFor(Map.class).with(schema);
  }

  /**
   * Parses a whole document.
   *
   * @param text decoded CSV content
   * @return rows in file order
   * @throws IOException when the content is not well-formed CSV
   */
  public List<DataRecord> read(String text) throws IOException {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) {
      return List.of();
    }
    List<DataRecord> records = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows = reader.readValues(text)) {
      while (rows.hasNextValue()) {
        records.add(toRecord(rows.nextValue()));
      }
    }
    return records;
  }

  private static DataRecord toRecord(Map<String, String> row) {
    Map<String, JsonValue> fields = new LinkedHashMap<>(row.size());
    for (Map.Entry<String, String> cell : row.entrySet()) {
      String value = cell.getValue();
      fields.put(cell.getKey(), value == null || value.isEmpty() ? JsonScalar.NULL : JsonScalar.of(value));
    }
    return new DataRecord(fields);
  }
}
