package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.domain.ingest.RawResponse;
import ca.gc.cra.ingest.domain.json.JsonArray;
import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.Objects;

/**
 * <strong>What:</strong> Structural limits applied to every page before its records are used.
 * <p><strong>Why:</strong> The byte check runs before parsing so an oversized body is never decoded; the depth check
 * rejects payloads whose nesting does not fit flat records.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #checkSize(RawResponse)}: observed byte length at most the configured maximum.</li>
 *   <li>{@link #checkDepth(JsonValue)}: the root container is level one and each nested container adds one;
 *   scalars never count. A value of nesting depth {@code d} passes exactly when {@code d <= maxDepth}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable limits.</p>
 *
 * @since 0.1.0
 */
public final class PayloadGuard {
  private final long maxPayloadBytes;
  private final int maxDepth;

  /**
   * Creates a guard.
   *
   * @param maxPayloadBytes largest accepted body
   * @param maxDepth deepest accepted container nesting
   */
  public PayloadGuard(long maxPayloadBytes, int maxDepth) {
    if (maxPayloadBytes < 1) {
      throw new IllegalArgumentException("maxPayloadBytes must be >= 1");
    }
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1");
    }
    this.maxPayloadBytes = maxPayloadBytes;
    this.maxDepth = maxDepth;
  }

  /**
   * Checks the raw byte length of a response.
   *
   * @param response fetched response
   * @return {@code true} when {@code byteLength <= maxPayloadBytes}
   */
  public boolean checkSize(RawResponse response) {
    return Objects.requireNonNull(response, "response").byteLength() <= maxPayloadBytes;
  }

  /**
   * Checks nesting depth against the configured maximum.
   *
   * @param value parsed payload
   * @return {@code true} when every container sits at level {@code <= maxDepth}
   */
  public boolean checkDepth(JsonValue value) {
    return checkDepth(value, maxDepth);
  }

  /**
   * Checks nesting depth against an explicit maximum.
   *
   * @param value parsed payload
   * @param maxDepth deepest accepted container level
   * @return {@code true} when every container sits at level {@code <= maxDepth}
   */
  public static boolean checkDepth(JsonValue value, int maxDepth) {
    return withinDepth(Objects.requireNonNull(value, "value"), 1, maxDepth);
  }

  /**
   * Measures nesting depth: zero for a scalar, one for a flat container.
   *
   * @param value parsed value
   * @return container nesting depth
   */
  public static int depth(JsonValue value) {
    int deepest = 0;
    if (value instanceof JsonObject object) {
      for (JsonValue child : object.fields().values()) {
        deepest = Math.max(deepest, depth(child));
      }
      return deepest + 1;
    }
    if (value instanceof JsonArray array) {
      for (JsonValue child : array.elements()) {
        deepest = Math.max(deepest, depth(child));
      }
      return deepest + 1;
    }
    return 0;
  }

  /**
   * Returns the configured byte limit.
   *
   * @return maximum body size in bytes
   */
  public long maxPayloadBytes() {
    return maxPayloadBytes;
  }

  /**
   * Returns the configured depth limit.
   *
   * @return maximum container nesting
   */
  public int maxDepth() {
    return maxDepth;
  }

  private static boolean withinDepth(JsonValue value, int level, int maxDepth) {
    if (value instanceof JsonObject object) {
      if (level > maxDepth) {
        return false;
      }
      for (JsonValue child : object.fields().values()) {
        if (!withinDepth(child, level + 1, maxDepth)) {
          return false;
        }
      }
      return true;
    }
    if (value instanceof JsonArray array) {
      if (level > maxDepth) {
        return false;
      }
      for (JsonValue child : array.elements()) {
        if (!withinDepth(child, level + 1, maxDepth)) {
          return false;
        }
      }
      return true;
    }
    return true;
  }
}
