package org.waabox.vecino.store.fs;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.client.MutationIntent;
import org.waabox.vecino.client.MutationIntentCodec;
import org.waabox.vecino.client.QueueStorage;

/**
 * A {@link QueueStorage} that keeps the offline queue in a local JSON file,
 * so queued changes survive client restarts.
 *
 * <p>Every store rewrites the file atomically.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemQueueStorage implements QueueStorage {

  /** The JSON file, never null. */
  private final Path file;

  /**
   * Creates a new storage over the given file.
   *
   * @param theFile the JSON file, never null
   *
   * @throws PersistenceException if the parent directories cannot be
   *                              created
   */
  public FileSystemQueueStorage(final Path theFile) {
    Objects.requireNonNull(theFile, "file must not be null");
    file = theFile;
    JsonFiles.createParentDirectories(file);
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if the file cannot be read or parsed
   */
  @Override
  public List<MutationIntent> load() {
    final Optional<byte[]> content = JsonFiles.read(file);
    if (content.isEmpty()) {
      return List.of();
    }
    try {
      return MutationIntentCodec.deserialize(content.get());
    } catch (final IllegalArgumentException e) {
      throw new PersistenceException("Corrupt offline queue file: " + file,
          e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if the file cannot be written
   */
  @Override
  public void store(final List<MutationIntent> intents) {
    Objects.requireNonNull(intents, "intents must not be null");
    JsonFiles.writeAtomically(file, MutationIntentCodec.serialize(intents));
  }
}
