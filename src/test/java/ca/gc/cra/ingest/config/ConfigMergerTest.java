package ca.gc.cra.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("pageSize", "100", "metricsExporter", "none");
    Map<String, String> yaml = Map.of("pageSize", "50", "endpoint", "/items");
    Map<String, String> cli = Map.of("pageSize", "25", "endpoint", "/orders");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        IngestMode.API, Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("25", merged.get("pageSize"));
    assertEquals("/orders", merged.get("endpoint"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: pageSize"));
    assertTrue(warnings.contains("CLI overrides YAML for key: endpoint"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        IngestMode.LOCAL, Optional.of(Map.of("recursive", "false")), Map.of(),
        DefaultsForMode.asFlatMap(IngestMode.LOCAL), warnings::add);

    assertEquals("false", merged.get("recursive"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void tokenInYamlTriggersWarning() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        IngestMode.API, Optional.of(Map.of("token", "abc")), Map.of(), Map.of(), warnings::add);

    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).contains(ApiIngestConfig.TOKEN_ENV));
  }

  @Test
  void backoffCapBelowInitialIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        IngestMode.API,
        Optional.empty(),
        Map.of("backoffInitialSeconds", "10", "backoffMaxSeconds", "2"),
        DefaultsForMode.asFlatMap(IngestMode.API),
        msg -> {}));
  }

  @Test
  void unpairedS3CredentialsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        IngestMode.S3,
        Optional.empty(),
        Map.of("awsSecretAccessKey", "secret"),
        DefaultsForMode.asFlatMap(IngestMode.S3),
        msg -> {}));
  }

  @Test
  void recognisesSecretKeys() {
    assertTrue(ConfigMerger.isSecretKey("token"));
    assertTrue(ConfigMerger.isSecretKey("awsSecretAccessKey"));
    assertFalse(ConfigMerger.isSecretKey("awsAccessKeyId"));
    assertFalse(ConfigMerger.isSecretKey(null));
  }
}
