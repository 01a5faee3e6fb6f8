package ca.gc.cra.ingest.domain.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON object preserving field insertion order.
 *
 * @param fields field name to value mapping; copied and never {@code null}
 * @since 0.1.0
 */
public record JsonObject(Map<String, JsonValue> fields) implements JsonValue {

  /**
   * Copies the supplied fields into an unmodifiable, order-preserving map.
   */
  public JsonObject {
    Objects.requireNonNull(fields, "fields");
    Map<String, JsonValue> copy = new LinkedHashMap<>(fields.size());
    for (Map.Entry<String, JsonValue> entry : fields.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "field name"),
          Objects.requireNonNull(entry.getValue(), "field value"));
    }
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Looks up a field by name.
   *
   * @param name field name
   * @return value when present
   */
  public Optional<JsonValue> get(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  /**
   * Indicates whether the object declares a field, including fields holding JSON {@code null}.
   *
   * @param name field name
   * @return {@code true} when the key is present
   */
  public boolean has(String name) {
    return fields.containsKey(name);
  }

  @Override
  public Kind kind() {
    return Kind.OBJECT;
  }

  @Override
  public Object unwrap() {
    Map<String, Object> plain = new LinkedHashMap<>(fields.size());
    fields.forEach((key, value) -> plain.put(key, value.unwrap()));
    return plain;
  }
}
