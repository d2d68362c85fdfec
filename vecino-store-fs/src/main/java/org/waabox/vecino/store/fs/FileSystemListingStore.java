package org.waabox.vecino.store.fs;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.ListingCodec;
import org.waabox.vecino.store.ListingStore;

/**
 * A {@link ListingStore} that keeps every listing in a single local JSON
 * file.
 *
 * <p>The file holds a pretty-printed JSON array of listing documents. Every
 * save or delete rewrites the whole file atomically: the content is written
 * to a temporary file and then renamed over the previous one.
 *
 * <p>The store keeps an in-memory copy of the file, read on first use. If
 * the file exists but cannot be read, the store refuses to write instead of
 * overwriting it with partial content.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemListingStore implements ListingStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemListingStore.class);

  /** The JSON file, never null. */
  private final Path file;

  /** The stored listings by id, null until the file was read. */
  private Map<String, Listing> listings;

  /**
   * Creates a new store over the given file.
   *
   * <p>The parent directories are created if missing. The file itself is
   * created on the first write.
   *
   * @param theFile the JSON file, never null
   *
   * @throws NullPointerException if theFile is null
   * @throws PersistenceException if the directories cannot be created
   */
  public FileSystemListingStore(final Path theFile) {
    Objects.requireNonNull(theFile, "file must not be null");
    file = theFile;
    JsonFiles.createParentDirectories(file);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Reads the file again, replacing the in-memory copy. A missing file
   * holds no listings.
   *
   * @throws PersistenceException if the file cannot be read or parsed
   */
  @Override
  public synchronized List<Listing> loadAll() {
    listings = read();
    log.debug("Read {} listing(s) from {}", listings.size(), file);
    return List.copyOf(listings.values());
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if the file cannot be read or written
   */
  @Override
  public synchronized void save(final Listing listing) {
    Objects.requireNonNull(listing, "listing must not be null");
    current().put(listing.id(), listing);
    write();
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if the file cannot be read or written
   */
  @Override
  public synchronized void delete(final String listingId) {
    Objects.requireNonNull(listingId, "listingId must not be null");
    if (current().remove(listingId) != null) {
      write();
    }
  }

  /**
   * Returns the file this store writes to.
   *
   * @return the file, never null
   */
  public Path file() {
    return file;
  }

  /** Returns the in-memory copy, reading the file on first use.
   *
   * @return the listings by id, never null.
   */
  private Map<String, Listing> current() {
    if (listings == null) {
      listings = read();
    }
    return listings;
  }

  /** Reads the file into a map.
   *
   * @return the listings by id in file order, never null.
   */
  private Map<String, Listing> read() {
    final Optional<byte[]> content = JsonFiles.read(file);
    final Map<String, Listing> result = new LinkedHashMap<>();
    if (content.isEmpty()) {
      return result;
    }
    try {
      for (Listing listing : ListingCodec.deserialize(content.get())) {
        result.put(listing.id(), listing);
      }
    } catch (final IllegalArgumentException e) {
      throw new PersistenceException("Corrupt listings file: " + file, e);
    }
    return result;
  }

  /** Writes the in-memory copy to the file. */
  private void write() {
    JsonFiles.writeAtomically(file,
        ListingCodec.serialize(listings.values()));
  }
}
