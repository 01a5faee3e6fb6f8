package ca.gc.cra.ingest.application.json;

import ca.gc.cra.ingest.domain.json.JsonArray;
import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonScalar;
import ca.gc.cra.ingest.domain.json.JsonValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON reader producing the immutable {@link JsonValue} model.
 *
 * <p>Duplicate object keys keep the last value. Documents nested deeper than Jackson's stream read constraint are
 * rejected as invalid.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a UTF-8 (or UTF-16/32 with BOM) JSON document.
   *
   * @param body raw document bytes; never {@code null}
   * @return parsed value
   * @throws IllegalArgumentException when the bytes are empty, not valid JSON, or carry trailing content
   */
  public JsonValue parse(byte[] body) {
    Objects.requireNonNull(body, "body");
    try (JsonParser parser = factory.createParser(body)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON document held in a string.
   *
   * @param json JSON text; never {@code null}
   * @return parsed value
   * @throws IllegalArgumentException when the text is empty or not valid JSON
   */
  public JsonValue parse(String json) {
    Objects.requireNonNull(json, "json");
    return parse(json.getBytes(StandardCharsets.UTF_8));
  }

  private JsonValue readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      throw new IllegalArgumentException("JSON document is empty");
    }
    JsonValue value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private JsonValue readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> JsonScalar.of(parser.getText());
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> JsonScalar.of(parser.getNumberValue());
      case VALUE_TRUE -> JsonScalar.of(true);
      case VALUE_FALSE -> JsonScalar.of(false);
      case VALUE_NULL -> JsonScalar.NULL;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private JsonObject readObject(JsonParser parser) throws IOException {
    Map<String, JsonValue> fields = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken == null) {
        throw new IllegalArgumentException("Unexpected end of JSON document");
      }
      fields.put(fieldName, readValue(parser, valueToken));
    }
    return new JsonObject(fields);
  }

  private JsonArray readArray(JsonParser parser) throws IOException {
    List<JsonValue> elements = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      if (token == null) {
        throw new IllegalArgumentException("Unexpected end of JSON document");
      }
      elements.add(readValue(parser, token));
    }
    return new JsonArray(elements);
  }
}
