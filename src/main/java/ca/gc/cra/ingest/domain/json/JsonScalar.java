package ca.gc.cra.ingest.domain.json;

/**
 * JSON leaf value: string, number, boolean, or {@code null}.
 *
 * @param value boxed scalar ({@link String}, {@link Number}, {@link Boolean}) or {@code null}
 * @since 0.1.0
 */
public record JsonScalar(Object value) implements JsonValue {
  /** Shared JSON {@code null}. */
  public static final JsonScalar NULL = new JsonScalar(null);

  /**
   * Rejects values that are not JSON scalars.
   */
  public JsonScalar {
    if (value != null
        && !(value instanceof String)
        && !(value instanceof Number)
        && !(value instanceof Boolean)) {
      throw new IllegalArgumentException("unsupported scalar type: " + value.getClass().getName());
    }
  }

  /**
   * Creates a string scalar, mapping {@code null} to {@link #NULL}.
   *
   * @param text string value
   * @return scalar wrapper
   */
  public static JsonScalar of(String text) {
    return text == null ? NULL : new JsonScalar(text);
  }

  /**
   * Creates a numeric scalar, mapping {@code null} to {@link #NULL}.
   *
   * @param number numeric value
   * @return scalar wrapper
   */
  public static JsonScalar of(Number number) {
    return number == null ? NULL : new JsonScalar(number);
  }

  /**
   * Creates a boolean scalar.
   *
   * @param flag boolean value
   * @return scalar wrapper
   */
  public static JsonScalar of(boolean flag) {
    return new JsonScalar(flag);
  }

  /**
   * Indicates whether this scalar is JSON {@code null}.
   *
   * @return {@code true} for JSON {@code null}
   */
  public boolean isNull() {
    return value == null;
  }

  @Override
  public Kind kind() {
    return Kind.SCALAR;
  }

  @Override
  public Object unwrap() {
    return value;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
