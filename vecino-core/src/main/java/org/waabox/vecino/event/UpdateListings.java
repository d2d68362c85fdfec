package org.waabox.vecino.event;

import java.time.Instant;
import java.util.Objects;

import org.waabox.vecino.listing.Listing;

/**
 * The server broadcasts one applied mutation.
 *
 * <p>An {@link UpdateAction#ADDED} or {@link UpdateAction#UPDATED} update
 * carries the full listing; a {@link UpdateAction#DELETED} update carries
 * only the listing id.
 *
 * @param action the applied action, never null
 * @param listing the listing, null for deletions
 * @param listingId the target listing id, never null
 * @param timestamp the time the server applied the mutation, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record UpdateListings(UpdateAction action, Listing listing,
    String listingId, Instant timestamp) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "update-listings";

  /** Validates the event. */
  public UpdateListings {
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if (action == UpdateAction.DELETED) {
      Objects.requireNonNull(listingId, "listingId must not be null");
      if (listing != null) {
        throw new IllegalArgumentException(
            "A deleted update carries no listing");
      }
    } else {
      Objects.requireNonNull(listing, "listing must not be null");
      if (listingId != null && !listingId.equals(listing.id())) {
        throw new IllegalArgumentException("listingId " + listingId
            + " does not match listing " + listing.id());
      }
      listingId = listing.id();
    }
  }

  /**
   * Creates an added update.
   *
   * @param listing the created listing, never null
   * @param timestamp the application time, never null
   * @return the event, never null
   */
  public static UpdateListings added(final Listing listing,
      final Instant timestamp) {
    return new UpdateListings(UpdateAction.ADDED, listing, null, timestamp);
  }

  /**
   * Creates an updated update.
   *
   * @param listing the replacement value, never null
   * @param timestamp the application time, never null
   * @return the event, never null
   */
  public static UpdateListings updated(final Listing listing,
      final Instant timestamp) {
    return new UpdateListings(UpdateAction.UPDATED, listing, null, timestamp);
  }

  /**
   * Creates a deleted update.
   *
   * @param listingId the removed listing id, never null
   * @param timestamp the application time, never null
   * @return the event, never null
   */
  public static UpdateListings deleted(final String listingId,
      final Instant timestamp) {
    return new UpdateListings(UpdateAction.DELETED, null, listingId,
        timestamp);
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitUpdateListings(this);
  }
}
