package org.waabox.vecino.client;

import java.util.List;

import org.waabox.vecino.listing.Listing;

/**
 * Durable storage for a client replica, so that a restarted client shows
 * its last known listings before it reconnects.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ReplicaStorage {

  /**
   * Loads the stored replica.
   *
   * @return the listings, never null, empty when nothing was stored
   */
  List<Listing> load();

  /**
   * Replaces the stored replica.
   *
   * @param listings the whole replica, never null
   */
  void store(List<Listing> listings);
}
