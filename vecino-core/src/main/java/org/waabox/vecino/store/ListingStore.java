package org.waabox.vecino.store;

import java.util.List;

import org.waabox.vecino.listing.Listing;

/**
 * The persistence backend of the authoritative replica.
 *
 * <p>Implementations define where listings are stored (a local JSON file,
 * an S3 bucket) and signal failures by throwing
 * {@link org.waabox.vecino.PersistenceException}. The server coordinator is
 * the only writer and calls the store while holding its lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ListingStore {

  /**
   * Loads every stored listing.
   *
   * @return the stored listings, never null, empty when nothing is stored
   */
  List<Listing> loadAll();

  /**
   * Saves a listing, replacing any stored listing with the same id.
   *
   * @param listing the listing to store, never null
   */
  void save(Listing listing);

  /**
   * Deletes the listing with the given id. Deleting an unknown id has no
   * effect.
   *
   * @param listingId the id of the listing to delete, never null
   */
  void delete(String listingId);
}
