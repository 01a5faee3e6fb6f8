package ca.gc.cra.ingest.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ingest.application.json.JsonSupport;
import ca.gc.cra.ingest.domain.ingest.RawResponse;
import ca.gc.cra.ingest.domain.json.JsonArray;
import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonScalar;
import ca.gc.cra.ingest.domain.json.JsonValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class PayloadGuardTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void scalarsHaveDepthZeroAndFlatContainersDepthOne() {
    assertEquals(0, PayloadGuard.depth(JsonScalar.of(5)));
    assertEquals(1, PayloadGuard.depth(json.parse("[]")));
    assertEquals(1, PayloadGuard.depth(json.parse("{\"a\":1,\"b\":\"x\"}")));
    assertEquals(3, PayloadGuard.depth(json.parse("{\"data\":[{\"sku\":\"A\"}]}")));
  }

  @Test
  void depthAtLimitPassesAndOneBeyondFails() {
    JsonValue three = json.parse("{\"data\":[{\"sku\":\"A\"}]}");

    assertTrue(PayloadGuard.checkDepth(three, 3));
    assertFalse(PayloadGuard.checkDepth(three, 2));
  }

  @Test
  void scalarRootAlwaysPasses() {
    assertTrue(PayloadGuard.checkDepth(JsonScalar.of("done"), 1));
  }

  @Test
  void deepestBranchDecides() {
    JsonValue value = json.parse("[1, [2], [[3]], {\"a\":{\"b\":{\"c\":[]}}}]");

    assertEquals(5, PayloadGuard.depth(value));
    assertTrue(PayloadGuard.checkDepth(value, 5));
    assertFalse(PayloadGuard.checkDepth(value, 4));
  }

  @Test
  void randomNestedStructuresMatchTheirConstructedDepth() {
    Random random = new Random(20240301L);
    for (int round = 0; round < 500; round++) {
      int depth = 1 + random.nextInt(12);
      JsonValue value = nested(random, depth);
      int limit = 1 + random.nextInt(12);

      assertEquals(depth, PayloadGuard.depth(value), "round " + round);
      assertEquals(depth <= limit, PayloadGuard.checkDepth(value, limit), "round " + round);
    }
  }

  @Test
  void sizeCheckUsesObservedLength() {
    PayloadGuard guard = new PayloadGuard(10, 5);

    assertTrue(guard.checkSize(RawResponse.of(200, new byte[10])));
    assertFalse(guard.checkSize(RawResponse.of(200, new byte[11])));
    assertFalse(guard.checkSize(new RawResponse(200, new byte[11], 5_000, null)));
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> new PayloadGuard(0, 5));
    assertThrows(IllegalArgumentException.class, () -> new PayloadGuard(10, 0));
  }

  /**
   * Builds a container of exactly {@code depth} levels: one spine reaching the full depth plus shallower siblings.
   */
  private static JsonValue nested(Random random, int depth) {
    if (depth == 0) {
      return JsonScalar.of(random.nextInt(100));
    }
    List<JsonValue> children = new ArrayList<>();
    children.add(nested(random, depth - 1));
    int siblings = random.nextInt(3);
    for (int i = 0; i < siblings; i++) {
      children.add(nested(random, random.nextInt(depth)));
    }
    if (random.nextBoolean()) {
      return new JsonArray(children);
    }
    Map<String, JsonValue> fields = new LinkedHashMap<>();
    for (int i = 0; i < children.size(); i++) {
      fields.put("f" + i, children.get(i));
    }
    return new JsonObject(fields);
  }
}
