package org.waabox.vecino.client;

import java.util.List;

import org.waabox.vecino.listing.Listing;

/**
 * Observes a client agent.
 *
 * <p>All callbacks run on the agent event loop; implementations must
 * return quickly and must not block on the agent. Exceptions thrown by a
 * listener are logged and otherwise ignored. Every method has an empty
 * default so implementations override only what they need.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncListener {

  /**
   * Called when the connection status changes.
   *
   * @param status the new status, never null
   */
  default void onStatusChanged(final ConnectionStatus status) {
  }

  /**
   * Called after the offline queue was replayed on (re)connection.
   *
   * @param drainedIntents the number of queued changes delivered
   */
  default void onSynced(final int drainedIntents) {
  }

  /**
   * Called after any change of the local replica.
   *
   * @param listings the whole replica, never null
   */
  default void onReplicaChanged(final List<Listing> listings) {
  }

  /**
   * Called when another client created a listing.
   *
   * @param listing the new listing, never null
   */
  default void onListingAdded(final Listing listing) {
  }

  /**
   * Called when a listing was replaced by the server.
   *
   * @param listing the new value, never null
   */
  default void onListingUpdated(final Listing listing) {
  }

  /**
   * Called when a listing was deleted by the server.
   *
   * @param listingId the removed listing id, never null
   */
  default void onListingRemoved(final String listingId) {
  }

  /**
   * Called when the server announces the number of connected users.
   *
   * @param count the users count
   */
  default void onUsersCount(final int count) {
  }
}
