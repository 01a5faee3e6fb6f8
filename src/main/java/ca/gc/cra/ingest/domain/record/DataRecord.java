package ca.gc.cra.ingest.domain.record;

import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> One ingested entity: an ordered mapping of field names to values with unique keys.
 * <p><strong>Why:</strong> Gives the dataset a uniform row type regardless of whether rows came from JSON pages or
 * CSV files.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param fields field name to value mapping in source order; copied and never {@code null}
 * @since 0.1.0
 */
public record DataRecord(Map<String, JsonValue> fields) {

  /**
   * Copies the fields into an unmodifiable, order-preserving map.
   */
  public DataRecord {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
  }

  /**
   * Builds a record from a parsed JSON object.
   *
   * @param object source object; must not be {@code null}
   * @return record holding the object's fields
   */
  public static DataRecord of(JsonObject object) {
    return new DataRecord(Objects.requireNonNull(object, "object").fields());
  }

  /**
   * Looks up a field value.
   *
   * @param name field name
   * @return value when the field is present
   */
  public Optional<JsonValue> get(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  /**
   * Returns the field names in source order.
   *
   * @return unmodifiable view of the field names
   */
  public Set<String> fieldNames() {
    return fields.keySet();
  }

  /**
   * Indicates whether every supplied field name is present.
   *
   * @param names required field names
   * @return {@code true} when no name is missing
   */
  public boolean containsAll(Collection<String> names) {
    return fields.keySet().containsAll(names);
  }
}
