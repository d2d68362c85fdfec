package org.waabox.vecino.event;

import java.util.Objects;

import org.waabox.vecino.listing.Listing;

/**
 * A client replaced a listing with a new full value.
 *
 * @param listing the replacement value, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ListingUpdated(Listing listing) implements SyncEvent {

  /** The wire name of this event. */
  public static final String NAME = "listing-updated";

  /** Validates the event. */
  public ListingUpdated {
    Objects.requireNonNull(listing, "listing must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return NAME;
  }

  /** {@inheritDoc} */
  @Override
  public <R> R accept(final Visitor<R> visitor) {
    return visitor.visitListingUpdated(this);
  }
}
