package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.domain.json.JsonArray;
import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonValue;
import ca.gc.cra.ingest.validation.Strings;
import java.util.List;
import java.util.Optional;

/**
 * Pulls the candidate records out of a parsed page.
 *
 * <p>An object yields the array under the data field (empty when the field is absent or not an array); a bare
 * array yields its elements; a scalar yields nothing. An empty result ends pagination.</p>
 *
 * @since 0.1.0
 */
public class RecordExtractor {
  private final String dataField;

  /**
   * Creates an extractor.
   *
   * @param dataField name of the record array inside a container object
   */
  public RecordExtractor(String dataField) {
    this.dataField = Strings.requireNonBlank("dataField", dataField);
  }

  /**
   * Extracts candidate records in source order.
   *
   * @param payload parsed page
   * @return candidate records; never {@code null}
   */
  public List<JsonValue> extract(JsonValue payload) {
    if (payload instanceof JsonArray array) {
      return array.elements();
    }
    if (payload instanceof JsonObject object) {
      Optional<JsonValue> data = object.get(dataField);
      if (data.isPresent() && data.get() instanceof JsonArray array) {
        return array.elements();
      }
    }
    return List.of();
  }
}
