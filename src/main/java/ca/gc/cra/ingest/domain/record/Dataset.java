package ca.gc.cra.ingest.domain.record;

import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered, rectangular collection of ingested records.
 * <p><strong>Why:</strong> Sole externally visible output of an ingestion run; rows are accepted records in arrival
 * order and columns are the union of observed field names in first-seen order.</p>
 * <p><strong>Role:</strong> Domain aggregate built by a {@link Builder} owned by one ingestion run.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; the builder is single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class Dataset {
  private static final Dataset EMPTY = new Dataset(List.of(), List.of());

  private final List<DataRecord> rows;
  private final List<String> columns;

  private Dataset(List<DataRecord> rows, List<String> columns) {
    this.rows = rows;
    this.columns = columns;
  }

  /**
   * Returns a dataset with no rows and no columns.
   *
   * @return shared empty dataset
   */
  public static Dataset empty() {
    return EMPTY;
  }

  /**
   * Creates a new accumulator.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the rows in arrival order.
   *
   * @return unmodifiable row list
   */
  public List<DataRecord> rows() {
    return rows;
  }

  /**
   * Returns the union of field names across rows, in first-seen order.
   *
   * @return unmodifiable column list
   */
  public List<String> columns() {
    return columns;
  }

  /**
   * Returns the number of rows.
   *
   * @return row count
   */
  public int size() {
    return rows.size();
  }

  /**
   * Indicates whether the dataset holds no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Reads one cell.
   *
   * @param row zero-based row index
   * @param column column name
   * @return cell value; empty when the row does not carry the column
   * @throws IndexOutOfBoundsException if {@code row} is out of range
   */
  public Optional<JsonValue> cell(int row, String column) {
    return rows.get(row).get(column);
  }

  /**
   * Renders every row as a plain map keyed by every column; absent cells map to {@code null}.
   *
   * @return rectangular list of row maps
   */
  public List<Map<String, Object>> toRowMaps() {
    List<Map<String, Object>> result = new ArrayList<>(rows.size());
    for (DataRecord record : rows) {
      Map<String, Object> row = new LinkedHashMap<>(columns.size());
      for (String column : columns) {
        row.put(column, record.get(column).map(JsonValue::unwrap).orElse(null));
      }
      result.add(row);
    }
    return result;
  }

  @Override
  public String toString() {
    return "Dataset[rows=" + rows.size() + ", columns=" + columns + "]";
  }

  /**
   * Append-only accumulator; the only mutable view of a dataset.
   */
  public static final class Builder {
    private final List<DataRecord> rows = new ArrayList<>();
    private final Set<String> columns = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Appends one record.
     *
     * @param record record to append; must not be {@code null}
     * @return this builder
     */
    public Builder add(DataRecord record) {
      Objects.requireNonNull(record, "record");
      rows.add(record);
      columns.addAll(record.fieldNames());
      return this;
    }

    /**
     * Appends a batch of records in order.
     *
     * @param batch records to append; must not be {@code null}
     * @return this builder
     */
    public Builder addAll(List<DataRecord> batch) {
      Objects.requireNonNull(batch, "batch");
      for (DataRecord record : batch) {
        add(record);
      }
      return this;
    }

    /**
     * Returns the number of rows accumulated so far.
     *
     * @return row count
     */
    public int size() {
      return rows.size();
    }

    /**
     * Freezes the accumulated rows into an immutable dataset.
     *
     * @return dataset snapshot
     */
    public Dataset build() {
      if (rows.isEmpty()) {
        return EMPTY;
      }
      return new Dataset(
          Collections.unmodifiableList(new ArrayList<>(rows)),
          List.copyOf(columns));
    }
  }
}
