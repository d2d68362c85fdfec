package org.waabox.vecino.event;

/**
 * A message exchanged over a sync channel.
 *
 * <p>Client to server: {@link ListingAdded}, {@link ListingUpdated},
 * {@link ListingDeleted} and {@link SyncListings}. Server to client:
 * {@link UpdateListings}, {@link SyncAllListings} and {@link UsersCount}.
 *
 * <p>Consumers dispatch on the event type with a {@link Visitor}, so adding
 * an event breaks every consumer at compile time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public sealed interface SyncEvent permits ListingAdded, ListingUpdated,
    ListingDeleted, SyncListings, UpdateListings, SyncAllListings,
    UsersCount {

  /**
   * Returns the wire name of the event.
   *
   * @return the event name, never null
   */
  String name();

  /**
   * Dispatches this event to the matching visitor method.
   *
   * @param <R> the visitor result type
   * @param visitor the visitor, never null
   * @return the visitor result
   */
  <R> R accept(Visitor<R> visitor);

  /**
   * Handles each kind of sync event.
   *
   * @param <R> the result type
   */
  interface Visitor<R> {

    /** Visits a {@link ListingAdded}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitListingAdded(ListingAdded event);

    /** Visits a {@link ListingUpdated}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitListingUpdated(ListingUpdated event);

    /** Visits a {@link ListingDeleted}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitListingDeleted(ListingDeleted event);

    /** Visits a {@link SyncListings}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitSyncListings(SyncListings event);

    /** Visits a {@link UpdateListings}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitUpdateListings(UpdateListings event);

    /** Visits a {@link SyncAllListings}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitSyncAllListings(SyncAllListings event);

    /** Visits a {@link UsersCount}.
     *
     * @param event the event, never null.
     * @return the result.
     */
    R visitUsersCount(UsersCount event);
  }
}
