package ca.gc.cra.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LocalIngestConfigTest {

  @Test
  void appliesDefaults() {
    LocalIngestConfig config = LocalIngestConfig.fromMap(Map.of());

    assertEquals(Path.of(LocalIngestConfig.DEFAULT_PATH).toAbsolutePath().normalize(), config.directory());
    assertEquals(SourceFormat.CSV, config.format());
    assertTrue(config.recursive());
    assertEquals(Charset.forName("windows-1252"), config.fallbackCharset());
  }

  @Test
  void parsesOverrides() {
    LocalIngestConfig config = LocalIngestConfig.fromMap(Map.of(
        "localPath", "/srv/exports", "recursive", "FALSE", "fallbackCharset", "ISO-8859-1", "fileType", ".csv"));

    assertEquals(Path.of("/srv/exports").toAbsolutePath(), config.directory());
    assertFalse(config.recursive());
    assertEquals(Charset.forName("ISO-8859-1"), config.fallbackCharset());
  }

  @Test
  void rejectsUnknownCharsetAndBadBoolean() {
    assertThrows(IllegalArgumentException.class,
        () -> LocalIngestConfig.fromMap(Map.of("fallbackCharset", "no-such-charset")));
    assertThrows(IllegalArgumentException.class,
        () -> LocalIngestConfig.fromMap(Map.of("recursive", "yes")));
  }

  @Test
  void parquetIsRejectedAtConfigurationTime() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> LocalIngestConfig.fromMap(Map.of("fileType", "parquet")));
    assertTrue(ex.getMessage().contains("parquet"));
  }

  @Test
  void formatMatchesExtensionIgnoringCase() {
    assertTrue(SourceFormat.CSV.matches("inventory.CSV"));
    assertFalse(SourceFormat.CSV.matches("inventory.csv.bak"));
    assertFalse(SourceFormat.CSV.matches(null));
    assertThrows(IllegalArgumentException.class, () -> SourceFormat.fromString("xlsx"));
  }
}
