package ca.gc.cra.sweep.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem checks for configured input files and the artifact directory.
 *
 * <p>The artifact directory is reused across runs because checkpoint resume reads from it, so it is never
 * required to be empty.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Normalizes an output directory, creating it when missing, and checks it is writable.
   *
   * @param name label used in error messages
   * @param path requested directory
   * @return absolute normalized directory
   * @throws IllegalArgumentException if the path is unusable
   */
  public static Path requireWritableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    try {
      Files.createDirectories(normalized);
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " cannot be created: " + normalized + " (" + ex.getMessage() + ")", ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Normalizes a path to an existing readable regular file.
   *
   * @param name label used in error messages
   * @param path requested file
   * @return absolute normalized file
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
