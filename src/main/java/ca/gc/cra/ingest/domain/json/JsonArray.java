package ca.gc.cra.ingest.domain.json;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered JSON array.
 *
 * @param elements array elements; copied and never {@code null}
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> elements) implements JsonValue {

  /**
   * Copies the elements into an unmodifiable list.
   */
  public JsonArray {
    elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
  }

  /**
   * Returns the number of elements.
   *
   * @return element count
   */
  public int size() {
    return elements.size();
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }

  @Override
  public Object unwrap() {
    List<Object> plain = new ArrayList<>(elements.size());
    for (JsonValue element : elements) {
      plain.add(element.unwrap());
    }
    return plain;
  }
}
