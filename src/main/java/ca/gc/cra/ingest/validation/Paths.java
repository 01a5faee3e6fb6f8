package ca.gc.cra.ingest.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> The local source reads every file under a directory; the directory must exist and be
 * readable before the walk starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a path option into an absolute, normalized path without touching the filesystem.
   *
   * @param name logical parameter name used for diagnostics
   * @param value raw path string supplied by operators
   * @return normalized absolute path
   * @throws IllegalArgumentException if the path is blank, contains null bytes, or is invalid
   */
  public static Path parse(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    if (trimmed.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(trimmed).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + trimmed, ex);
    }
  }

  /**
   * Validates that a directory exists and can be listed.
   *
   * @param path candidate directory; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the path is missing, not a directory, or unreadable
   */
  public static Path requireReadableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("directory is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
