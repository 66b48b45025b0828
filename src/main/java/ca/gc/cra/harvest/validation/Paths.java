package ca.gc.cra.harvest.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the watched directory and the database file.
 * <p><strong>Why:</strong> Surfaces unusable paths as configuration errors before the poll loop starts, while still
 * tolerating a watched directory that does not exist yet.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} for the checked path itself.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates the directory to watch. A missing directory is accepted; it simply yields no files until created.
   *
   * @param path candidate directory; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains control characters or exists but is not a directory
   */
  public static Path validateWatchDir(Path path) {
    Path normalized = normalize(path);
    if (Files.exists(normalized) && !Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("dir is not a directory: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates the database file location, optionally creating its parent directories.
   *
   * @param path candidate database file; must not be {@code null}
   * @param createParent whether to create missing parent directories
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory, its parent cannot be created, or the parent is not
   *     writable
   */
  public static Path validateDatabaseFile(Path path, boolean createParent) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("db must be a file, not a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      return normalized;
    }
    try {
      if (!Files.exists(parent)) {
        if (!createParent) {
          return normalized;
        }
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to create database directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("database parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("database directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
