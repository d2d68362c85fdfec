package org.waabox.vecino.listing;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An insertion-ordered collection of listings keyed by id.
 *
 * <p>A replica never holds two listings with the same id. Replacing a
 * listing keeps its position; new listings go to the end.
 *
 * <p>This class is not thread-safe. The server guards its replica with the
 * coordinator lock and each client confines its replica to its event loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Replica {

  /** The listings by id, in insertion order. */
  private final Map<String, Listing> listings = new LinkedHashMap<>();

  /**
   * Checks whether a listing with the given id is present.
   *
   * @param id the listing id, never null
   * @return true if present
   */
  public boolean contains(final String id) {
    return listings.containsKey(id);
  }

  /**
   * Inserts the listing only if its id is not present yet.
   *
   * @param listing the listing, never null
   * @return true if the listing was inserted
   */
  public boolean insertIfAbsent(final Listing listing) {
    Objects.requireNonNull(listing, "listing must not be null");
    return listings.putIfAbsent(listing.id(), listing) == null;
  }

  /**
   * Inserts the listing or replaces the one with the same id.
   *
   * @param listing the listing, never null
   * @return the replaced listing, or empty if it was inserted
   */
  public Optional<Listing> upsert(final Listing listing) {
    Objects.requireNonNull(listing, "listing must not be null");
    return Optional.ofNullable(listings.put(listing.id(), listing));
  }

  /**
   * Removes the listing with the given id.
   *
   * @param id the listing id, never null
   * @return true if a listing was removed
   */
  public boolean remove(final String id) {
    return listings.remove(id) != null;
  }

  /**
   * Replaces the whole content of this replica.
   *
   * <p>When the given collection repeats an id, the last value wins and
   * keeps the position of the first one.
   *
   * @param replacement the new content, never null
   */
  public void replaceAll(final Collection<Listing> replacement) {
    Objects.requireNonNull(replacement, "replacement must not be null");
    listings.clear();
    for (Listing listing : replacement) {
      listings.put(listing.id(), listing);
    }
  }

  /**
   * Returns an immutable copy of the listings in insertion order.
   *
   * @return the listings, never null
   */
  public List<Listing> snapshot() {
    return List.copyOf(listings.values());
  }

  /**
   * Returns the number of listings.
   *
   * @return the size
   */
  public int size() {
    return listings.size();
  }
}
