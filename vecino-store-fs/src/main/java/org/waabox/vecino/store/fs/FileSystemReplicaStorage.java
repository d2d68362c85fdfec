package org.waabox.vecino.store.fs;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.client.ReplicaStorage;
import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.ListingCodec;

/**
 * A {@link ReplicaStorage} that keeps a client replica in a local JSON
 * file, in the same format as {@link FileSystemListingStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemReplicaStorage implements ReplicaStorage {

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
  public FileSystemReplicaStorage(final Path theFile) {
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
  public List<Listing> load() {
    final Optional<byte[]> content = JsonFiles.read(file);
    if (content.isEmpty()) {
      return List.of();
    }
    try {
      return ListingCodec.deserialize(content.get());
    } catch (final IllegalArgumentException e) {
      throw new PersistenceException("Corrupt replica file: " + file, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if the file cannot be written
   */
  @Override
  public void store(final List<Listing> listings) {
    Objects.requireNonNull(listings, "listings must not be null");
    JsonFiles.writeAtomically(file, ListingCodec.serialize(listings));
  }
}
