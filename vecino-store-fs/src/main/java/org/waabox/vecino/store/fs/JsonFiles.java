package org.waabox.vecino.store.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.waabox.vecino.PersistenceException;

/**
 * File helpers shared by the file system stores.
 *
 * <p>Writes use an atomic pattern: the content is written to a temporary
 * sibling file and then renamed over the target. If the JVM crashes
 * mid-write, the previous content remains intact.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JsonFiles {

  /** The suffix of the temporary file used while writing. */
  private static final String TEMP_SUFFIX = ".tmp";

  /** Private constructor to prevent instantiation. */
  private JsonFiles() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Creates the parent directories of the given file.
   *
   * @param file the file, never null
   *
   * @throws PersistenceException if the directories cannot be created
   */
  static void createParentDirectories(final Path file) {
    final Path parent = file.toAbsolutePath().getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (final IOException e) {
      throw new PersistenceException(
          "Failed to create directory: " + parent, e);
    }
  }

  /**
   * Reads the whole file if it exists.
   *
   * @param file the file, never null
   * @return the content, or empty if the file does not exist
   *
   * @throws PersistenceException if the file exists but cannot be read
   */
  static Optional<byte[]> read(final Path file) {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (final IOException e) {
      throw new PersistenceException("Failed to read file: " + file, e);
    }
  }

  /**
   * Replaces the content of the given file atomically.
   *
   * @param file the target file, never null
   * @param content the new content, never null
   *
   * @throws PersistenceException if writing fails
   */
  static void writeAtomically(final Path file, final byte[] content) {
    final Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
    try {
      Files.write(temp, content);
      Files.move(temp, file,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new PersistenceException("Failed to write file: " + file, e);
    }
  }
}
