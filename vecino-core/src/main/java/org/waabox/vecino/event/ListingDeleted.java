package org.waabox.vecino.event;

import java.util.Objects;

/**
 * A client deleted a listing.
 *
 * @param listingId the id of the deleted listing, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ListingDeleted(String listingId) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "listing-deleted";

  /** Validates the event. */
  public ListingDeleted {
    Objects.requireNonNull(listingId, "listingId must not be null");
    if (listingId.isBlank()) {
      throw new IllegalArgumentException("listingId must not be blank");
    }
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitListingDeleted(this);
  }
}
