package ca.gc.cra.ingest.domain.json;

/**
 * <strong>What:</strong> Parsed JSON value expressed as an explicit tagged union of object, array, and scalar.
 * <p><strong>Why:</strong> Validation and extraction walks branch on the value shape once per node instead of probing
 * untyped maps and lists.</p>
 * <p><strong>Role:</strong> Domain value type produced by the JSON parser and consumed by payload guards, record
 * extraction, and the dataset model.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonObject, JsonArray, JsonScalar {

  /** Shape tag for a {@link JsonValue}. */
  enum Kind {
    /** JSON object with string keys. */
    OBJECT,
    /** Ordered JSON array. */
    ARRAY,
    /** String, number, boolean, or {@code null}. */
    SCALAR
  }

  /**
   * Returns the shape tag of this value.
   *
   * @return value kind; never {@code null}
   */
  Kind kind();

  /**
   * Converts this value into plain Java structures ({@link java.util.Map}, {@link java.util.List}, boxed scalars).
   *
   * @return plain representation; {@code null} for JSON {@code null}
   */
  Object unwrap();
}
