package ca.gc.cra.ingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir
  Path dir;

  @Test
  void parseNormalizesToAbsolute() {
    Path parsed = Paths.parse("localPath", "data/../data/raw");

    assertTrue(parsed.isAbsolute());
    assertEquals(Path.of("data/raw").toAbsolutePath().normalize(), parsed);
  }

  @Test
  void parseRejectsBlankAndNullBytes() {
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("localPath", " "));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("localPath", "a\0b"));
  }

  @Test
  void readableDirResolvesRealPath() throws IOException {
    assertEquals(dir.toRealPath(), Paths.requireReadableDir(dir));
  }

  @Test
  void readableDirRejectsFilesAndMissingPaths() throws IOException {
    Path file = Files.writeString(dir.resolve("a.csv"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir(file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir(dir.resolve("absent")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir(null));
  }
}
